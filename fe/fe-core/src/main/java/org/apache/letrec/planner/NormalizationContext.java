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

package org.apache.letrec.planner;

import org.apache.letrec.planner.jobs.JobContext;
import org.apache.letrec.planner.rules.RuleType;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.qe.SessionVariable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * State of one normalization run: the plan being rewritten and what happened to it.
 * Created per run and never shared between runs.
 */
public class NormalizationContext {

    private final SessionVariable sessionVariable;
    private final JobContext currentJobContext;
    private final List<PlanProcess> planProcesses = Lists.newArrayList();
    private final Set<RuleType> appliedRules = Sets.newLinkedHashSet();
    private Plan rewritePlan;

    public NormalizationContext(Plan plan, SessionVariable sessionVariable) {
        this.rewritePlan = Objects.requireNonNull(plan, "plan can not be null");
        this.sessionVariable = Objects.requireNonNull(sessionVariable, "sessionVariable can not be null");
        this.currentJobContext = new JobContext(this, sessionVariable.getDisableNormalizationRuleBitSet());
    }

    public Plan getRewritePlan() {
        return rewritePlan;
    }

    public void setRewritePlan(Plan plan) {
        this.rewritePlan = Objects.requireNonNull(plan, "plan can not be null");
    }

    public SessionVariable getSessionVariable() {
        return sessionVariable;
    }

    public JobContext getCurrentJobContext() {
        return currentJobContext;
    }

    public boolean showPlanProcess() {
        return sessionVariable.isShowPlanProcess();
    }

    public void addPlanProcess(PlanProcess planProcess) {
        planProcesses.add(planProcess);
    }

    public List<PlanProcess> getPlanProcesses() {
        return ImmutableList.copyOf(planProcesses);
    }

    public void ruleSetApplied(RuleType ruleType) {
        appliedRules.add(ruleType);
    }

    public Set<RuleType> getAppliedRules() {
        return appliedRules;
    }
}
