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

package org.apache.letrec.planner.rules.rewrite.scope;

import org.apache.letrec.planner.trees.plans.BindingScope;
import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLetRec;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * Ids referenced by a plan that are not bound inside the plan itself, in first-use order.
 */
public class FreeReferences extends PlanVisitor<Void, Set<CTEId>> {

    private final Set<CTEId> result = Sets.newLinkedHashSet();

    private FreeReferences() {
    }

    public static Set<CTEId> of(Plan plan) {
        FreeReferences collector = new FreeReferences();
        plan.accept(collector, ImmutableSet.of());
        return collector.result;
    }

    /** references made by the binding values of a scope, its own ids excluded */
    public static Set<CTEId> ofBindingValues(BindingScope scope) {
        FreeReferences collector = new FreeReferences();
        Set<CTEId> bound = scope.isRecursive() ? ImmutableSet.copyOf(scope.getCteIds()) : ImmutableSet.of();
        for (Plan value : scope.getBindingValues()) {
            value.accept(collector, bound);
        }
        return collector.result;
    }

    @Override
    public Void visit(Plan plan, Set<CTEId> bound) {
        if (!plan.containsType(LogicalGet.class)) {
            return null;
        }
        for (Plan child : plan.children()) {
            child.accept(this, bound);
        }
        return null;
    }

    @Override
    public Void visitLogicalGet(LogicalGet get, Set<CTEId> bound) {
        if (!bound.contains(get.getCteId())) {
            result.add(get.getCteId());
        }
        return null;
    }

    @Override
    public Void visitLogicalLet(LogicalLet let, Set<CTEId> bound) {
        let.getValue().accept(this, bound);
        let.getBody().accept(this, withIds(bound, let));
        return null;
    }

    @Override
    public Void visitLogicalLetRec(LogicalLetRec letRec, Set<CTEId> bound) {
        Set<CTEId> inner = withIds(bound, letRec);
        for (Plan child : letRec.children()) {
            child.accept(this, inner);
        }
        return null;
    }

    private static Set<CTEId> withIds(Set<CTEId> bound, BindingScope scope) {
        return ImmutableSet.<CTEId>builder().addAll(bound).addAll(scope.getCteIds()).build();
    }
}
