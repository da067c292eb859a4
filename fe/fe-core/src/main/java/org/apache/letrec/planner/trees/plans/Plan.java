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

package org.apache.letrec.planner.trees.plans;

import org.apache.letrec.planner.trees.TreeNode;
import org.apache.letrec.planner.trees.plans.visitor.ExplainPlanPrinter;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

/**
 * Abstract class for all plan node.
 * Plans are immutable, equals and hashCode are structural over the whole subtree.
 */
public interface Plan extends TreeNode<Plan> {

    PlanType getType();

    <R, C> R accept(PlanVisitor<R, C> visitor, C context);

    default String treeString() {
        return ExplainPlanPrinter.print(this);
    }
}
