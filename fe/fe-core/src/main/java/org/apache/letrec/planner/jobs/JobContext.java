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

package org.apache.letrec.planner.jobs;

import org.apache.letrec.planner.NormalizationContext;

import java.util.BitSet;

/**
 * Context for one job execution: the run it belongs to and whether the last execution changed the plan.
 */
public class JobContext {

    protected final NormalizationContext normalizationContext;
    protected final BitSet disableRules;
    protected boolean rewritten = false;

    public JobContext(NormalizationContext normalizationContext, BitSet disableRules) {
        this.normalizationContext = normalizationContext;
        this.disableRules = disableRules;
    }

    public NormalizationContext getNormalizationContext() {
        return normalizationContext;
    }

    public BitSet getDisableRules() {
        return disableRules;
    }

    public boolean isRewritten() {
        return rewritten;
    }

    public void setRewritten(boolean rewritten) {
        this.rewritten = rewritten;
    }
}
