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

import org.apache.letrec.planner.jobs.executor.ScopeNormalizationExecutor;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.qe.SessionVariable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Entrance of binding scope normalization.
 *
 * <pre>
 * Plan normalized = new ScopeNormalizer().normalize(plan);
 * </pre>
 *
 * An instance only carries options; every call is an independent run, so one instance may be
 * used from several threads as long as its {@link SessionVariable} is not changed meanwhile.
 */
public class ScopeNormalizer {
    private static final Logger LOG = LogManager.getLogger(ScopeNormalizer.class);

    private final SessionVariable sessionVariable;

    public ScopeNormalizer() {
        this(new SessionVariable());
    }

    public ScopeNormalizer(SessionVariable sessionVariable) {
        this.sessionVariable = Objects.requireNonNull(sessionVariable, "sessionVariable can not be null");
    }

    public SessionVariable getSessionVariable() {
        return sessionVariable;
    }

    /** normalize the plan, the input is not modified */
    public Plan normalize(Plan plan) {
        return normalizeWithContext(plan).getRewritePlan();
    }

    /**
     * normalize the plan and return the whole run context: final plan, applied rules and plan processes.
     */
    public NormalizationContext normalizeWithContext(Plan plan) {
        NormalizationContext context = new NormalizationContext(plan, sessionVariable);
        new ScopeNormalizationExecutor(context).execute();
        if (LOG.isDebugEnabled()) {
            LOG.debug("normalized plan, applied rules {}:\n{}",
                    context.getAppliedRules(), context.getRewritePlan().treeString());
        }
        return context;
    }
}
