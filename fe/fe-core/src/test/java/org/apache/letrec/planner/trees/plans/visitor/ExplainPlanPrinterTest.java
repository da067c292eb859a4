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

package org.apache.letrec.planner.trees.plans.visitor;

import static org.apache.letrec.planner.util.PlanConstructor.constant;
import static org.apache.letrec.planner.util.PlanConstructor.countBy;
import static org.apache.letrec.planner.util.PlanConstructor.distinct;
import static org.apache.letrec.planner.util.PlanConstructor.except;
import static org.apache.letrec.planner.util.PlanConstructor.exceptAll;
import static org.apache.letrec.planner.util.PlanConstructor.filter;
import static org.apache.letrec.planner.util.PlanConstructor.get;
import static org.apache.letrec.planner.util.PlanConstructor.let;
import static org.apache.letrec.planner.util.PlanConstructor.letRec;
import static org.apache.letrec.planner.util.PlanConstructor.lines;
import static org.apache.letrec.planner.util.PlanConstructor.map;
import static org.apache.letrec.planner.util.PlanConstructor.opaque;
import static org.apache.letrec.planner.util.PlanConstructor.project;
import static org.apache.letrec.planner.util.PlanConstructor.rows;
import static org.apache.letrec.planner.util.PlanConstructor.scan;
import static org.apache.letrec.planner.util.PlanConstructor.threshold;
import static org.apache.letrec.planner.util.PlanConstructor.union;

import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalConstant;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ExplainPlanPrinterTest {

    @Test
    public void testOperatorLabels() {
        Plan plan = union(
                project(filter(map(scan("t"), "#0 + 1"), "#0 > 1", "#1 = 2"), 1, 0),
                countBy(rows(ImmutableList.of(1, "a"), ImmutableList.of(2, "b")), 0),
                threshold(exceptAll(LogicalConstant.empty(), except(scan("u"), scan("v")))),
                opaque("CrossJoin", "", scan("t"), scan("u")),
                opaque("TopK", "order_by=[#0] limit=3", get(4)));
        String expected = lines(
                "Union",
                "  Project (#1, #0)",
                "    Filter #0 > 1 AND #1 = 2",
                "      Map (#0 + 1)",
                "        ReadStorage t",
                "  Reduce group_by=[#0] aggregates=[count(*)]",
                "    Constant",
                "      - (1, a)",
                "      - (2, b)",
                "  Threshold",
                "    ExceptAll",
                "      Constant <empty>",
                "      Except",
                "        ReadStorage u",
                "        ReadStorage v",
                "  CrossJoin",
                "    ReadStorage t",
                "    ReadStorage u",
                "  TopK order_by=[#0] limit=3",
                "    Get l4");
        Assertions.assertEquals(expected, plan.treeString());
    }

    @Test
    public void testEmptyFilterHasNoPredicateText() {
        Assertions.assertEquals(lines("Filter", "  Get l0"), filter(get(0)).treeString());
    }

    @Test
    public void testConsecutiveLetsShareOneBlock() {
        Plan plan = let(0, scan("t"), let(1, scan("u"), union(get(0), get(1))));
        String expected = lines(
                "Return",
                "  Union",
                "    Get l0",
                "    Get l1",
                "With",
                "  cte l1 =",
                "    ReadStorage u",
                "  cte l0 =",
                "    ReadStorage t");
        Assertions.assertEquals(expected, plan.treeString());
    }

    @Test
    public void testScopeChainRendersInnermostRunFirst() {
        Plan plan = let(0, scan("t"),
                letRec(ImmutableList.of(1, 2),
                        ImmutableList.of(distinct(union(get(0), get(2))), distinct(get(1))),
                        let(3, get(1), union(get(3), get(2)))));
        String expected = lines(
                "Return",
                "  Union",
                "    Get l3",
                "    Get l2",
                "With",
                "  cte l3 =",
                "    Get l1",
                "With Mutually Recursive",
                "  cte l2 =",
                "    Distinct",
                "      Get l1",
                "  cte l1 =",
                "    Distinct",
                "      Union",
                "        Get l0",
                "        Get l2",
                "With",
                "  cte l0 =",
                "    ReadStorage t");
        Assertions.assertEquals(expected, plan.treeString());
    }

    @Test
    public void testScopeNestedInValueIsIndented() {
        Plan plan = letRec(0, distinct(union(constant(1), letRec(1, get(0), get(1)))), get(0));
        String expected = lines(
                "Return",
                "  Get l0",
                "With Mutually Recursive",
                "  cte l0 =",
                "    Distinct",
                "      Union",
                "        Constant",
                "          - (1)",
                "        Return",
                "          Get l1",
                "        With Mutually Recursive",
                "          cte l1 =",
                "            Get l0");
        Assertions.assertEquals(expected, plan.treeString());
        Assertions.assertEquals(expected, plan.toString());
    }
}
