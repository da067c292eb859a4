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

package org.apache.letrec.planner.trees.plans.logical;

import org.apache.letrec.planner.trees.plans.AbstractPlan;
import org.apache.letrec.planner.trees.plans.BindingScope;
import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.PlanType;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Non-recursive binding: {@code let id = value in body}.
 * The id is visible in the body only; children are (value, body).
 */
public class LogicalLet extends AbstractPlan implements BindingScope {

    private final CTEId cteId;

    public LogicalLet(CTEId cteId, Plan value, Plan body) {
        super(PlanType.LOGICAL_LET, value, body);
        this.cteId = Objects.requireNonNull(cteId, "cteId can not be null");
    }

    public CTEId getCteId() {
        return cteId;
    }

    public Plan getValue() {
        return child(0);
    }

    @Override
    public List<CTEId> getCteIds() {
        return ImmutableList.of(cteId);
    }

    @Override
    public List<Plan> getBindingValues() {
        return ImmutableList.of(child(0));
    }

    @Override
    public Plan getBody() {
        return child(1);
    }

    @Override
    public Plan withBody(Plan body) {
        return new LogicalLet(cteId, getValue(), body);
    }

    @Override
    public boolean isRecursive() {
        return false;
    }

    @Override
    public Plan withChildren(List<Plan> children) {
        Preconditions.checkArgument(children.size() == 2);
        return new LogicalLet(cteId, children.get(0), children.get(1));
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalLet(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogicalLet that = (LogicalLet) o;
        return sameShape(that) && cteId.equals(that.cteId) && children.equals(that.children);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, cteId, children);
    }
}
