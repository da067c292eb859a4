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
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.PlanType;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Objects;

/**
 * EXCEPT / EXCEPT ALL as produced by the lowering stage.
 * Rewritten into threshold and negate before bindings are normalized.
 */
public class LogicalExcept extends AbstractPlan {

    private final boolean all;

    public LogicalExcept(boolean all, Plan left, Plan right) {
        super(PlanType.LOGICAL_EXCEPT, left, right);
        this.all = all;
    }

    public boolean isAll() {
        return all;
    }

    public Plan left() {
        return child(0);
    }

    public Plan right() {
        return child(1);
    }

    @Override
    public Plan withChildren(List<Plan> children) {
        Preconditions.checkArgument(children.size() == 2);
        return new LogicalExcept(all, children.get(0), children.get(1));
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalExcept(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogicalExcept that = (LogicalExcept) o;
        return sameShape(that) && all == that.all && children.equals(that.children);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, all, children);
    }
}
