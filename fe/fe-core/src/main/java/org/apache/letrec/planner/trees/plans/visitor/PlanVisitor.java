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

package org.apache.letrec.planner.trees.plans.visitor;

import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalAggregate;
import org.apache.letrec.planner.trees.plans.logical.LogicalConstant;
import org.apache.letrec.planner.trees.plans.logical.LogicalDistinct;
import org.apache.letrec.planner.trees.plans.logical.LogicalExcept;
import org.apache.letrec.planner.trees.plans.logical.LogicalFilter;
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLetRec;
import org.apache.letrec.planner.trees.plans.logical.LogicalMap;
import org.apache.letrec.planner.trees.plans.logical.LogicalNegate;
import org.apache.letrec.planner.trees.plans.logical.LogicalOpaque;
import org.apache.letrec.planner.trees.plans.logical.LogicalProject;
import org.apache.letrec.planner.trees.plans.logical.LogicalTableScan;
import org.apache.letrec.planner.trees.plans.logical.LogicalThreshold;
import org.apache.letrec.planner.trees.plans.logical.LogicalUnion;

/**
 * Base class for the visitor of plan.
 * Every concrete node falls back to {@link #visit(Plan, Object)} unless overridden.
 *
 * @param <R> Return type of each visit method.
 * @param <C> Context type.
 */
public abstract class PlanVisitor<R, C> {

    public abstract R visit(Plan plan, C context);

    // *******************************
    // leaves
    // *******************************

    public R visitLogicalGet(LogicalGet get, C context) {
        return visit(get, context);
    }

    public R visitLogicalTableScan(LogicalTableScan tableScan, C context) {
        return visit(tableScan, context);
    }

    public R visitLogicalConstant(LogicalConstant constant, C context) {
        return visit(constant, context);
    }

    // *******************************
    // relational operators
    // *******************************

    public R visitLogicalProject(LogicalProject project, C context) {
        return visit(project, context);
    }

    public R visitLogicalMap(LogicalMap map, C context) {
        return visit(map, context);
    }

    public R visitLogicalFilter(LogicalFilter filter, C context) {
        return visit(filter, context);
    }

    public R visitLogicalUnion(LogicalUnion union, C context) {
        return visit(union, context);
    }

    public R visitLogicalDistinct(LogicalDistinct distinct, C context) {
        return visit(distinct, context);
    }

    public R visitLogicalAggregate(LogicalAggregate aggregate, C context) {
        return visit(aggregate, context);
    }

    public R visitLogicalThreshold(LogicalThreshold threshold, C context) {
        return visit(threshold, context);
    }

    public R visitLogicalNegate(LogicalNegate negate, C context) {
        return visit(negate, context);
    }

    public R visitLogicalExcept(LogicalExcept except, C context) {
        return visit(except, context);
    }

    public R visitLogicalOpaque(LogicalOpaque opaque, C context) {
        return visit(opaque, context);
    }

    // *******************************
    // binding scopes
    // *******************************

    public R visitLogicalLet(LogicalLet let, C context) {
        return visit(let, context);
    }

    public R visitLogicalLetRec(LogicalLetRec letRec, C context) {
        return visit(letRec, context);
    }
}
