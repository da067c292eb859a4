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
 * Group by the key columns and compute the aggregates per group.
 */
public class LogicalAggregate extends LogicalUnary {

    private final List<Integer> groupKeys;
    private final List<String> aggregates;

    public LogicalAggregate(List<Integer> groupKeys, List<String> aggregates, Plan child) {
        super(PlanType.LOGICAL_AGGREGATE, child);
        this.groupKeys = ImmutableList.copyOf(Objects.requireNonNull(groupKeys, "groupKeys can not be null"));
        this.aggregates = ImmutableList.copyOf(Objects.requireNonNull(aggregates, "aggregates can not be null"));
    }

    public List<Integer> getGroupKeys() {
        return groupKeys;
    }

    public List<String> getAggregates() {
        return aggregates;
    }

    @Override
    public Plan withChildren(List<Plan> children) {
        Preconditions.checkArgument(children.size() == 1);
        return new LogicalAggregate(groupKeys, aggregates, children.get(0));
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalAggregate(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogicalAggregate that = (LogicalAggregate) o;
        return sameShape(that)
                && groupKeys.equals(that.groupKeys)
                && aggregates.equals(that.aggregates)
                && children.equals(that.children);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, groupKeys, aggregates, children);
    }
}
