// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.letrec.planner;

import static org.apache.letrec.planner.util.PlanConstructor.get;
import static org.apache.letrec.planner.util.PlanConstructor.let;
import static org.apache.letrec.planner.util.PlanConstructor.letRec;
import static org.apache.letrec.planner.util.PlanConstructor.scan;
import static org.apache.letrec.planner.util.PlanConstructor.union;

import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.util.BagEvaluator;
import org.apache.letrec.qe.SessionVariable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

/**
 * Evaluates plans before and after normalization and compares the resulting bags.
 */
public class SemanticPreservationTest {

    private final BagEvaluator evaluator = new BagEvaluator()
            .withTable("t", ImmutableList.of(1), ImmutableList.of(7), ImmutableList.of(7))
            .withTable("u", ImmutableList.of(2), ImmutableList.of(3))
            .withTable("unused", ImmutableList.of(0))
            .withScalar("#0 + 1", row -> (Integer) row.get(0) + 1)
            .withPredicate("#1 <= 5", row -> (Integer) row.get(1) <= 5)
            .withPredicate("#0 > 1", row -> (Integer) row.get(0) > 1);

    private void assertPreserved(Plan plan, ScopeNormalizer normalizer) {
        Map<List<Object>, Integer> expected = evaluator.evaluate(plan);
        Plan normalized = normalizer.normalize(plan);
        Assertions.assertEquals(expected, evaluator.evaluate(normalized), normalized.treeString());
    }

    @Test
    public void testScenariosKeepTheirResult() {
        ScopeNormalizer normalizer = new ScopeNormalizer();
        for (Plan plan : NormalizationScenarios.all()) {
            assertPreserved(plan, normalizer);
        }
    }

    @Test
    public void testScenariosKeepTheirResultWithoutHoisting() {
        ScopeNormalizer normalizer = new ScopeNormalizer(new SessionVariable().setEnableNestedScopeHoisting(false));
        for (Plan plan : NormalizationScenarios.all()) {
            assertPreserved(plan, normalizer);
        }
    }

    @Test
    public void testCounterProducesOneToFive() {
        Plan normalized = new ScopeNormalizer().normalize(NormalizationScenarios.counter());
        Map<?, ?> expected = ImmutableMap.of(ImmutableList.of(1), 1, ImmutableList.of(2), 1, ImmutableList.of(3), 1,
                ImmutableList.of(4), 1, ImmutableList.of(5), 1);
        Assertions.assertEquals(expected, evaluator.evaluate(normalized));
    }

    @Test
    public void testMergedRecursionsKeepTheirResults() {
        ScopeNormalizer normalizer = new ScopeNormalizer();
        assertPreserved(NormalizationScenarios.interleavedRecursive(), normalizer);
        assertPreserved(NormalizationScenarios.threeWayInterleaved(), normalizer);
        assertPreserved(NormalizationScenarios.recursionAfterItsInput(), normalizer);

        Map<?, ?> expected = ImmutableMap.of(ImmutableList.of(1), 1, ImmutableList.of(7), 2,
                ImmutableList.of(2), 2, ImmutableList.of(3), 2);
        Assertions.assertEquals(expected, evaluator.evaluate(normalizer.normalize(
                NormalizationScenarios.threeWayInterleaved())));
    }

    @Test
    public void testDuplicatedScansKeepMultiplicity() {
        Plan plan = union(let(1, scan("t"), get(1)), let(2, scan("t"), get(2)));
        Map<List<Object>, Integer> result = evaluator.evaluate(new ScopeNormalizer().normalize(plan));
        Assertions.assertEquals(ImmutableMap.of(ImmutableList.of(1), 2, ImmutableList.of(7), 4), result);
    }

    @Test
    public void testNonRecursiveGroupMember() {
        Plan plan = letRec(ImmutableList.of(1, 2),
                ImmutableList.of(union(get(2), get(2)), scan("t")),
                union(get(1), get(2)));
        assertPreserved(plan, new ScopeNormalizer());
    }
}
