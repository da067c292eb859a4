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

import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.PlanType;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Keep the rows for which every predicate holds. An empty predicate list keeps everything.
 */
public class LogicalFilter extends LogicalUnary {

    private final List<String> predicates;

    public LogicalFilter(List<String> predicates, Plan child) {
        super(PlanType.LOGICAL_FILTER, child);
        this.predicates = ImmutableList.copyOf(Objects.requireNonNull(predicates, "predicates can not be null"));
    }

    public List<String> getPredicates() {
        return predicates;
    }

    @Override
    public Plan withChildren(List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1);
        return new LogicalFilter(predicates, children.get(0));
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalFilter(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogicalFilter that = (LogicalFilter) o;
        return sameShape(that) && predicates.equals(that.predicates) && children.equals(that.children);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, predicates, children);
    }
}
