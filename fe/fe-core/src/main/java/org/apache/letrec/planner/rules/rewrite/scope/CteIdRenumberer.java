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

import org.apache.letrec.common.IdGenerator;
import org.apache.letrec.planner.exceptions.AnalysisException;
import org.apache.letrec.planner.exceptions.AnalysisException.ErrorCode;
import org.apache.letrec.planner.trees.plans.BindingScope;
import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLetRec;
import org.apache.letrec.planner.trees.plans.visitor.DefaultPlanRewriter;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Give the bindings of a rebuilt plan contiguous ids from l0 in pre-order.
 * The members of a recursive group are numbered together before anything inside their values.
 */
public class CteIdRenumberer extends DefaultPlanRewriter<Void> {

    private final IdGenerator<CTEId> idGenerator = CTEId.createGenerator();
    private final Map<CTEId, CTEId> renamed = Maps.newHashMap();

    private CteIdRenumberer() {
    }

    public static Plan renumber(Plan plan) {
        return plan.accept(new CteIdRenumberer(), null);
    }

    @Override
    public Plan visit(Plan plan, Void context) {
        if (!plan.containsType(LogicalGet.class, BindingScope.class)) {
            return plan;
        }
        return visitChildren(this, plan, context);
    }

    @Override
    public Plan visitLogicalGet(LogicalGet get, Void context) {
        CTEId newId = renamed.get(get.getCteId());
        if (newId == null) {
            throw new AnalysisException(ErrorCode.SCOPING_VIOLATION,
                    "binding " + get.getCteId() + " is referenced but not bound in the rebuilt plan");
        }
        return get.withCteId(newId);
    }

    @Override
    public Plan visitLogicalLet(LogicalLet let, Void context) {
        CTEId newId = assign(let.getCteId());
        Plan value = let.getValue().accept(this, context);
        Plan body = let.getBody().accept(this, context);
        return new LogicalLet(newId, value, body);
    }

    @Override
    public Plan visitLogicalLetRec(LogicalLetRec letRec, Void context) {
        ImmutableList.Builder<CTEId> newIds = ImmutableList.builder();
        for (CTEId id : letRec.getCteIds()) {
            newIds.add(assign(id));
        }
        ImmutableList.Builder<Plan> values = ImmutableList.builder();
        for (Plan value : letRec.getBindingValues()) {
            values.add(value.accept(this, context));
        }
        Plan body = letRec.getBody().accept(this, context);
        return new LogicalLetRec(newIds.build(), values.build(), body);
    }

    private CTEId assign(CTEId oldId) {
        CTEId newId = idGenerator.getNextId();
        Preconditions.checkState(renamed.put(oldId, newId) == null, "binding %s bound twice", oldId);
        return newId;
    }
}
