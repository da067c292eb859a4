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

package org.apache.letrec.planner.rules.rewrite;

import static org.apache.letrec.planner.util.PlanConstructor.distinct;
import static org.apache.letrec.planner.util.PlanConstructor.filter;
import static org.apache.letrec.planner.util.PlanConstructor.get;
import static org.apache.letrec.planner.util.PlanConstructor.map;
import static org.apache.letrec.planner.util.PlanConstructor.negate;
import static org.apache.letrec.planner.util.PlanConstructor.scan;
import static org.apache.letrec.planner.util.PlanConstructor.union;

import org.apache.letrec.planner.trees.plans.Plan;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SimplifyTrivialOperatorsTest {

    @Test
    public void testEmptyFilterAndMapDisappear() {
        Assertions.assertEquals(get(0), SimplifyTrivialOperators.simplify(filter(map(get(0)))));
        Plan kept = filter(get(0), "#0 > 1");
        Assertions.assertSame(kept, SimplifyTrivialOperators.simplify(kept));
    }

    @Test
    public void testUnionsAreSplicedAndUnwrapped() {
        Plan plan = union(scan("a"), union(scan("b"), union(scan("c"))), filter(union(scan("d"))));
        Assertions.assertEquals(union(scan("a"), scan("b"), scan("c"), scan("d")),
                SimplifyTrivialOperators.simplify(plan));
        Assertions.assertEquals(get(1), SimplifyTrivialOperators.simplify(union(get(1))));
    }

    @Test
    public void testDoubleNegateAndDistinct() {
        Assertions.assertEquals(get(0), SimplifyTrivialOperators.simplify(negate(negate(get(0)))));
        Assertions.assertEquals(negate(get(0)), SimplifyTrivialOperators.simplify(negate(negate(negate(get(0))))));
        Assertions.assertEquals(distinct(get(0)), SimplifyTrivialOperators.simplify(distinct(distinct(get(0)))));
    }
}
