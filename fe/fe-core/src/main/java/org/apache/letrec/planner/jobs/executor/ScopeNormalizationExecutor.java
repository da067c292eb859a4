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

package org.apache.letrec.planner.jobs.executor;

import org.apache.letrec.planner.NormalizationContext;
import org.apache.letrec.planner.jobs.rewrite.RewriteJob;
import org.apache.letrec.planner.rules.RuleType;
import org.apache.letrec.planner.rules.rewrite.NormalizeBindingScopes;
import org.apache.letrec.planner.rules.rewrite.RewriteExceptToThreshold;
import org.apache.letrec.planner.trees.plans.logical.LogicalExcept;

import java.util.List;

/**
 * Jobs of a normalization run: lower set difference, then normalize binding scopes to a fixpoint.
 */
public class ScopeNormalizationExecutor extends AbstractBatchJobExecutor {

    private static final List<RewriteJob> NORMALIZATION_JOBS = jobs(
            topic("Set difference lowering",
                    context -> context.getRewritePlan().containsType(LogicalExcept.class),
                    custom(RuleType.REWRITE_EXCEPT_TO_THRESHOLD, RewriteExceptToThreshold::new)
            ),
            topic("Binding scope normalization",
                    custom(RuleType.NORMALIZE_BINDING_SCOPES, NormalizeBindingScopes::new)
            )
    );

    public ScopeNormalizationExecutor(NormalizationContext normalizationContext) {
        super(normalizationContext);
    }

    @Override
    public List<RewriteJob> getJobs() {
        return NORMALIZATION_JOBS;
    }
}
