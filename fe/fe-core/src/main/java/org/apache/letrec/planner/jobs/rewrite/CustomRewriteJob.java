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

package org.apache.letrec.planner.jobs.rewrite;

import org.apache.letrec.planner.NormalizationContext;
import org.apache.letrec.planner.PlanProcess;
import org.apache.letrec.planner.jobs.JobContext;
import org.apache.letrec.planner.rules.RuleType;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.visitor.CustomRewriter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Custom rewrite the plan.
 * Just pass the plan node to the 'CustomRewriter', and the 'CustomRewriter' rule will handle it.
 */
public class CustomRewriteJob implements RewriteJob {
    private static final Logger LOG = LogManager.getLogger(CustomRewriteJob.class);

    private final RuleType ruleType;
    private final Supplier<CustomRewriter> customRewriter;

    public CustomRewriteJob(Supplier<CustomRewriter> rewriter, RuleType ruleType) {
        this.ruleType = Objects.requireNonNull(ruleType, "ruleType cannot be null");
        this.customRewriter = Objects.requireNonNull(rewriter, "customRewriter cannot be null");
    }

    /**
     * 执行自定义重写作业。
     * 规则被禁用时直接返回；计划发生变化（结构不相等）时设置 rewritten 标志，
     * 执行器据此决定是否再次执行本作业。
     */
    @Override
    public void execute(JobContext context) {
        if (context.getDisableRules().get(ruleType.type())) {
            return;
        }
        NormalizationContext normalizationContext = context.getNormalizationContext();
        Plan root = normalizationContext.getRewritePlan();
        Plan rewrittenRoot = customRewriter.get().rewriteRoot(root, context);
        if (rewrittenRoot == null) {
            return;
        }

        if (!root.equals(rewrittenRoot)) {
            if (normalizationContext.showPlanProcess()) {
                normalizationContext.addPlanProcess(
                        new PlanProcess(ruleType.name(), root.treeString(), rewrittenRoot.treeString()));
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("rule {} changed the plan", ruleType);
            }
            normalizationContext.ruleSetApplied(ruleType);
            context.setRewritten(true);
        }
        normalizationContext.setRewritePlan(rewrittenRoot);
    }

    @Override
    public boolean isOnce() {
        return false;
    }

    public RuleType getRuleType() {
        return ruleType;
    }
}
