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

import java.util.List;
import java.util.Objects;

/**
 * Any operator the normalizer does not interpret, e.g. a join or a top-n.
 * Its inputs are still traversed so that bindings and references inside them are seen.
 */
public class LogicalOpaque extends AbstractPlan {

    private final String operator;
    private final String arguments;

    public LogicalOpaque(String operator, String arguments, List<Plan> inputs) {
        super(PlanType.LOGICAL_OPAQUE, inputs);
        this.operator = Objects.requireNonNull(operator, "operator can not be null");
        this.arguments = Objects.requireNonNull(arguments, "arguments can not be null");
    }

    public String getOperator() {
        return operator;
    }

    public String getArguments() {
        return arguments;
    }

    @Override
    public Plan withChildren(List<Plan> children) {
        return new LogicalOpaque(operator, arguments, children);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalOpaque(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogicalOpaque that = (LogicalOpaque) o;
        return sameShape(that)
                && operator.equals(that.operator)
                && arguments.equals(that.arguments)
                && children.equals(that.children);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, operator, arguments, children);
    }
}
