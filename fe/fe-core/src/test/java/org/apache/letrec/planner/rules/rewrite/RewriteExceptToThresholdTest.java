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
import static org.apache.letrec.planner.util.PlanConstructor.except;
import static org.apache.letrec.planner.util.PlanConstructor.exceptAll;
import static org.apache.letrec.planner.util.PlanConstructor.get;
import static org.apache.letrec.planner.util.PlanConstructor.negate;
import static org.apache.letrec.planner.util.PlanConstructor.scan;
import static org.apache.letrec.planner.util.PlanConstructor.threshold;
import static org.apache.letrec.planner.util.PlanConstructor.union;

import org.apache.letrec.planner.trees.plans.Plan;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RewriteExceptToThresholdTest {

    private final RewriteExceptToThreshold rule = new RewriteExceptToThreshold();

    @Test
    public void testExceptAll() {
        Plan rewritten = rule.rewriteRoot(exceptAll(get(0), get(1)), null);
        Assertions.assertEquals(threshold(union(get(0), negate(get(1)))), rewritten);
    }

    @Test
    public void testExceptDeduplicatesBothSides() {
        Plan rewritten = rule.rewriteRoot(except(scan("t"), scan("u")), null);
        Assertions.assertEquals(threshold(union(distinct(scan("t")), negate(distinct(scan("u"))))), rewritten);
    }

    @Test
    public void testNestedExceptIsRewrittenInside() {
        Plan plan = distinct(exceptAll(exceptAll(get(0), get(1)), get(2)));
        Plan expected = distinct(threshold(union(
                threshold(union(get(0), negate(get(1)))),
                negate(get(2)))));
        Assertions.assertEquals(expected, rule.rewriteRoot(plan, null));
    }

    @Test
    public void testPlanWithoutExceptIsReturnedAsIs() {
        Plan plan = union(get(0), scan("t"));
        Assertions.assertSame(plan, rule.rewriteRoot(plan, null));
    }
}
