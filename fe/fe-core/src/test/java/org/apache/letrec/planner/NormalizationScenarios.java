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

import static org.apache.letrec.planner.util.PlanConstructor.constant;
import static org.apache.letrec.planner.util.PlanConstructor.distinct;
import static org.apache.letrec.planner.util.PlanConstructor.exceptAll;
import static org.apache.letrec.planner.util.PlanConstructor.filter;
import static org.apache.letrec.planner.util.PlanConstructor.get;
import static org.apache.letrec.planner.util.PlanConstructor.let;
import static org.apache.letrec.planner.util.PlanConstructor.letRec;
import static org.apache.letrec.planner.util.PlanConstructor.map;
import static org.apache.letrec.planner.util.PlanConstructor.project;
import static org.apache.letrec.planner.util.PlanConstructor.scan;
import static org.apache.letrec.planner.util.PlanConstructor.union;

import org.apache.letrec.planner.trees.plans.Plan;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Input plans shared by the normalizer tests.
 */
public class NormalizationScenarios {

    private NormalizationScenarios() {
    }

    /** a = distinct(1 union b), b = pass-through filter of a */
    public static Plan mutualWithPassThrough() {
        return letRec(ImmutableList.of(10, 11),
                ImmutableList.of(distinct(union(constant(1), get(11))), filter(get(10))),
                get(10));
    }

    /** inner recursive binding nested in the outer one, the two reference each other */
    public static Plan nestedMutual() {
        return letRec(20,
                distinct(union(constant(1),
                        letRec(21, distinct(union(get(20), get(21))), exceptAll(get(20), get(21))))),
                get(20));
    }

    /** inner recursive binding that only passes the outer one through */
    public static Plan nestedPassThrough() {
        return letRec(30,
                distinct(union(constant(1), letRec(31, get(30), union(get(31), get(30))))),
                get(30));
    }

    /** two unrelated recursive bindings consumed by the arms of a union */
    public static Plan siblingRecursive() {
        return union(
                letRec(40, distinct(union(constant(1), get(40))), get(40)),
                letRec(41, distinct(union(constant(2), get(41))), get(41)));
    }

    /** counts from 1 to 5 */
    public static Plan counter() {
        return letRec(50,
                distinct(union(constant(1), project(filter(map(get(50), "#0 + 1"), "#1 <= 5"), 1))),
                get(50));
    }

    /** the same scan bound twice in sibling branches, plus a dead binding */
    public static Plan duplicatedLets() {
        return union(
                let(60, scan("t"), get(60)),
                let(61, scan("t"), let(62, scan("unused"), project(get(61), 0))));
    }

    /** a binding that does not depend on the recursion, nested in a recursive value */
    public static Plan hoistable() {
        return letRec(70,
                distinct(union(constant(1), let(71, scan("t"), union(get(71), get(70))))),
                get(70));
    }

    /** two unrelated recursive bindings with a non-recursive one discovered between them */
    public static Plan interleavedRecursive() {
        return union(
                letRec(80, distinct(union(constant(1), get(80))), get(80)),
                let(81, filter(scan("t"), "#0 > 1"), get(81)),
                letRec(82, distinct(union(constant(2), get(82))), get(82)));
    }

    /** three unrelated recursive bindings alternating with non-recursive ones */
    public static Plan threeWayInterleaved() {
        return union(
                letRec(90, distinct(union(constant(1), get(90))), get(90)),
                let(91, filter(scan("t"), "#0 > 1"), get(91)),
                letRec(92, distinct(union(constant(2), get(92))), get(92)),
                let(93, scan("u"), get(93)),
                letRec(94, distinct(union(constant(3), get(94))), get(94)));
    }

    /** a recursive binding that depends on a non-recursive one can not join the earlier recursion */
    public static Plan recursionAfterItsInput() {
        return union(
                letRec(100, distinct(union(constant(1), get(100))), get(100)),
                let(101, filter(scan("t"), "#0 > 1"), union(
                        get(101),
                        letRec(102, distinct(union(constant(2), get(102))), get(102)),
                        let(103, project(get(101), 0),
                                letRec(104, distinct(union(get(103), get(104))), get(104))))));
    }

    public static List<Plan> all() {
        return ImmutableList.of(mutualWithPassThrough(), nestedMutual(), nestedPassThrough(), siblingRecursive(),
                counter(), duplicatedLets(), hoistable(), interleavedRecursive(), threeWayInterleaved(),
                recursionAfterItsInput());
    }
}
