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

import org.apache.letrec.planner.analyzer.Scope;
import org.apache.letrec.planner.exceptions.AnalysisException;
import org.apache.letrec.planner.exceptions.AnalysisException.ErrorCode;
import org.apache.letrec.planner.trees.plans.BindingScope;
import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLetRec;
import org.apache.letrec.planner.trees.plans.visitor.DefaultPlanRewriter;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lift every binding of a region into the {@link BindingTable} and return the region body
 * with all binding scopes removed.
 *
 * <p>Bindings get fresh ids in pre-order; every reference is resolved through the lexical
 * {@link Scope} chain and rewritten to the fresh id. Operators that are not scopes are entered
 * so bindings nested anywhere below them are found.
 *
 * <p>递归绑定的值是独立的内层区域：先对其完整规范化，再把顶部不依赖本递归组的作用域提升到当前区域，
 * 其余的作用域保留在值内部，因为它们必须在外层不动点的每一步中重新计算。
 */
public class ScopeFlattener extends DefaultPlanRewriter<Scope> {

    private final RegionNormalizer regionNormalizer;
    private final BindingTable table;
    private int hoistedBindings = 0;

    public ScopeFlattener(RegionNormalizer regionNormalizer, BindingTable table) {
        this.regionNormalizer = regionNormalizer;
        this.table = table;
    }

    public int getHoistedBindings() {
        return hoistedBindings;
    }

    @Override
    public Plan visit(Plan plan, Scope scope) {
        if (!plan.containsType(LogicalGet.class, BindingScope.class)) {
            return plan;
        }
        return visitChildren(this, plan, scope);
    }

    @Override
    public Plan visitLogicalGet(LogicalGet get, Scope scope) {
        Optional<CTEId> resolved = scope.resolve(get.getCteId());
        if (resolved.isPresent()) {
            return get.withCteId(resolved.get());
        }
        if (regionNormalizer.isDeclared(get.getCteId())) {
            throw new AnalysisException(ErrorCode.FORWARD_REFERENCE,
                    "binding " + get.getCteId() + " is referenced where it is not visible");
        }
        throw new AnalysisException(ErrorCode.SCOPING_VIOLATION,
                "binding " + get.getCteId() + " is referenced but never declared");
    }

    @Override
    public Plan visitLogicalLet(LogicalLet let, Scope scope) {
        checkNotVisible(let.getCteIds(), scope);
        CTEId newId = regionNormalizer.nextId();
        Binding binding = table.register(newId, scope.getDepth());
        binding.setValue(let.getValue().accept(this, scope));
        return let.getBody().accept(this, scope.withBindings(ImmutableMap.of(let.getCteId(), newId)));
    }

    @Override
    public Plan visitLogicalLetRec(LogicalLetRec letRec, Scope scope) {
        checkNotVisible(letRec.getCteIds(), scope);
        Map<CTEId, CTEId> renamed = Maps.newLinkedHashMap();
        List<Binding> members = Lists.newArrayList();
        for (CTEId id : letRec.getCteIds()) {
            CTEId newId = regionNormalizer.nextId();
            renamed.put(id, newId);
            members.add(table.register(newId, scope.getDepth()));
        }
        Scope memberScope = scope.withBindings(renamed);
        List<Plan> values = letRec.getBindingValues();
        for (int i = 0; i < values.size(); i++) {
            Plan nested = regionNormalizer.normalizeRegion(values.get(i), memberScope);
            members.get(i).setValue(hoist(nested, renamed.values(), memberScope.getDepth()));
        }
        return letRec.getBody().accept(this, memberScope);
    }

    /**
     * 沿着内层区域顶部的作用域链，把与本递归组无关的作用域提升到当前表中。
     * 一旦某个作用域被保留，引用它的后续作用域也必须保留。
     */
    private Plan hoist(Plan nested, Collection<CTEId> groupIds, int depth) {
        if (!regionNormalizer.isNestedScopeHoistingEnabled()) {
            return nested;
        }
        Set<CTEId> blocked = Sets.newHashSet(groupIds);
        List<BindingScope> kept = Lists.newArrayList();
        Plan current = nested;
        while (current instanceof BindingScope) {
            BindingScope scope = (BindingScope) current;
            if (Collections.disjoint(FreeReferences.ofBindingValues(scope), blocked)) {
                for (int i = 0; i < scope.getCteIds().size(); i++) {
                    table.register(scope.getCteIds().get(i), depth).setValue(scope.getBindingValues().get(i));
                    hoistedBindings++;
                }
            } else {
                kept.add(scope);
                blocked.addAll(scope.getCteIds());
            }
            current = scope.getBody();
        }
        for (int i = kept.size() - 1; i >= 0; i--) {
            current = kept.get(i).withBody(current);
        }
        return current;
    }

    private static void checkNotVisible(List<CTEId> ids, Scope scope) {
        Set<CTEId> seen = Sets.newHashSet();
        for (CTEId id : ids) {
            if (!seen.add(id)) {
                throw new AnalysisException(ErrorCode.SCOPING_VIOLATION,
                        "binding " + id + " is declared twice in one recursive group");
            }
            if (scope.resolve(id).isPresent()) {
                throw new AnalysisException(ErrorCode.SCOPING_VIOLATION,
                        "binding " + id + " shadows a visible binding with the same id");
            }
        }
    }
}
