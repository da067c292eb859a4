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

package org.apache.letrec.planner.rules.rewrite;

import org.apache.letrec.planner.jobs.JobContext;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalDistinct;
import org.apache.letrec.planner.trees.plans.logical.LogicalExcept;
import org.apache.letrec.planner.trees.plans.logical.LogicalNegate;
import org.apache.letrec.planner.trees.plans.logical.LogicalThreshold;
import org.apache.letrec.planner.trees.plans.logical.LogicalUnion;
import org.apache.letrec.planner.trees.plans.visitor.CustomRewriter;
import org.apache.letrec.planner.trees.plans.visitor.DefaultPlanRewriter;

/**
 * Lower set difference into threshold over a signed union.
 *
 * <pre>
 * ExceptAll(l, r)  =>  Threshold(Union(l, Negate(r)))
 * Except(l, r)     =>  Threshold(Union(Distinct(l), Negate(Distinct(r))))
 * </pre>
 */
public class RewriteExceptToThreshold extends DefaultPlanRewriter<Void> implements CustomRewriter {

    @Override
    public Plan rewriteRoot(Plan plan, JobContext jobContext) {
        return plan.accept(this, null);
    }

    @Override
    public Plan visit(Plan plan, Void context) {
        if (!plan.containsType(LogicalExcept.class)) {
            return plan;
        }
        return visitChildren(this, plan, context);
    }

    @Override
    public Plan visitLogicalExcept(LogicalExcept except, Void context) {
        except = visitChildren(this, except, context);
        Plan left = except.left();
        Plan right = except.right();
        if (!except.isAll()) {
            left = new LogicalDistinct(left);
            right = new LogicalDistinct(right);
        }
        return new LogicalThreshold(new LogicalUnion(left, new LogicalNegate(right)));
    }
}
