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
 * WITH MUTUALLY RECURSIVE group.
 * 所有成员同时迭代到最小不动点，成员的 id 在所有成员值以及 body 中可见。
 * children 为 (value_0, ..., value_n-1, body)。
 */
public class LogicalLetRec extends AbstractPlan implements BindingScope {

    private final List<CTEId> cteIds;

    public LogicalLetRec(List<CTEId> cteIds, List<Plan> values, Plan body) {
        super(PlanType.LOGICAL_LET_REC, ImmutableList.<Plan>builder().addAll(values).add(body).build());
        Preconditions.checkArgument(!cteIds.isEmpty(), "recursive group can not be empty");
        Preconditions.checkArgument(cteIds.size() == values.size(),
                "%s ids but %s values", cteIds.size(), values.size());
        this.cteIds = ImmutableList.copyOf(cteIds);
    }

    @Override
    public List<CTEId> getCteIds() {
        return cteIds;
    }

    @Override
    public List<Plan> getBindingValues() {
        return children.subList(0, cteIds.size());
    }

    @Override
    public Plan getBody() {
        return children.get(cteIds.size());
    }

    @Override
    public Plan withBody(Plan body) {
        return new LogicalLetRec(cteIds, getBindingValues(), body);
    }

    public LogicalLetRec withBindings(List<CTEId> newIds, List<Plan> newValues) {
        return new LogicalLetRec(newIds, newValues, getBody());
    }

    @Override
    public boolean isRecursive() {
        return true;
    }

    @Override
    public Plan withChildren(List<Plan> children) {
        Preconditions.checkArgument(children.size() == cteIds.size() + 1);
        return new LogicalLetRec(cteIds, children.subList(0, cteIds.size()), children.get(cteIds.size()));
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalLetRec(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogicalLetRec that = (LogicalLetRec) o;
        return sameShape(that) && cteIds.equals(that.cteIds) && children.equals(that.children);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, cteIds, children);
    }
}
