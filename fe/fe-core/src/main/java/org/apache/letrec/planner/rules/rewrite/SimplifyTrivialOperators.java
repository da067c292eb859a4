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

import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalDistinct;
import org.apache.letrec.planner.trees.plans.logical.LogicalFilter;
import org.apache.letrec.planner.trees.plans.logical.LogicalMap;
import org.apache.letrec.planner.trees.plans.logical.LogicalNegate;
import org.apache.letrec.planner.trees.plans.logical.LogicalUnion;
import org.apache.letrec.planner.trees.plans.visitor.DefaultPlanRewriter;

import com.google.common.collect.ImmutableList;

/**
 * Bottom-up removal of operators that do nothing, so equal computations get equal structure:
 * <ul>
 *   <li>Filter without predicates, Map without scalars: replaced by the input</li>
 *   <li>Union: nested unions spliced in, a single input replaces the union</li>
 *   <li>Negate(Negate(x)): x</li>
 *   <li>Distinct(Distinct(x)): Distinct(x)</li>
 * </ul>
 */
public class SimplifyTrivialOperators extends DefaultPlanRewriter<Void> {

    private static final SimplifyTrivialOperators INSTANCE = new SimplifyTrivialOperators();

    public static Plan simplify(Plan plan) {
        return plan.accept(INSTANCE, null);
    }

    @Override
    public Plan visitLogicalFilter(LogicalFilter filter, Void context) {
        filter = visitChildren(this, filter, context);
        return filter.getPredicates().isEmpty() ? filter.child() : filter;
    }

    @Override
    public Plan visitLogicalMap(LogicalMap map, Void context) {
        map = visitChildren(this, map, context);
        return map.getScalars().isEmpty() ? map.child() : map;
    }

    @Override
    public Plan visitLogicalUnion(LogicalUnion union, Void context) {
        union = visitChildren(this, union, context);
        boolean spliced = false;
        ImmutableList.Builder<Plan> inputs = ImmutableList.builder();
        for (Plan input : union.getInputs()) {
            if (input instanceof LogicalUnion) {
                inputs.addAll(input.children());
                spliced = true;
            } else {
                inputs.add(input);
            }
        }
        Plan result = spliced ? new LogicalUnion(inputs.build()) : union;
        return result.arity() == 1 ? result.child(0) : result;
    }

    @Override
    public Plan visitLogicalNegate(LogicalNegate negate, Void context) {
        negate = visitChildren(this, negate, context);
        if (negate.child() instanceof LogicalNegate) {
            return ((LogicalNegate) negate.child()).child();
        }
        return negate;
    }

    @Override
    public Plan visitLogicalDistinct(LogicalDistinct distinct, Void context) {
        distinct = visitChildren(this, distinct, context);
        return distinct.child() instanceof LogicalDistinct ? distinct.child() : distinct;
    }
}
