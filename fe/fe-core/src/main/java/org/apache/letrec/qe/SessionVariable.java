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

package org.apache.letrec.qe;

import org.apache.letrec.common.Config;
import org.apache.letrec.planner.rules.RuleType;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * Options of one normalization run. Starts from {@link Config} and may be changed before the run.
 */
public class SessionVariable {
    private static final Logger LOG = LogManager.getLogger(SessionVariable.class);

    private int maxFixpointIterations = Config.max_scope_normalization_iterations;

    private boolean enableNestedScopeHoisting = Config.enable_nested_scope_hoisting;

    private List<String> disableNormalizationRules = ImmutableList.copyOf(Config.disable_normalization_rules);

    private boolean showPlanProcess = Config.show_normalization_process;

    public int getMaxFixpointIterations() {
        return maxFixpointIterations;
    }

    public SessionVariable setMaxFixpointIterations(int maxFixpointIterations) {
        this.maxFixpointIterations = maxFixpointIterations;
        return this;
    }

    public boolean isEnableNestedScopeHoisting() {
        return enableNestedScopeHoisting;
    }

    public SessionVariable setEnableNestedScopeHoisting(boolean enableNestedScopeHoisting) {
        this.enableNestedScopeHoisting = enableNestedScopeHoisting;
        return this;
    }

    public List<String> getDisableNormalizationRules() {
        return disableNormalizationRules;
    }

    public SessionVariable setDisableNormalizationRules(String... rules) {
        this.disableNormalizationRules = ImmutableList.copyOf(rules);
        return this;
    }

    public boolean isShowPlanProcess() {
        return showPlanProcess;
    }

    public SessionVariable setShowPlanProcess(boolean showPlanProcess) {
        this.showPlanProcess = showPlanProcess;
        return this;
    }

    /**
     * Disabled rules as a bitset over {@link RuleType#type()}. Unknown names are ignored.
     */
    public BitSet getDisableNormalizationRuleBitSet() {
        BitSet bitSet = new BitSet();
        for (String ruleName : disableNormalizationRules) {
            String upperName = ruleName.trim().toUpperCase(Locale.ROOT);
            boolean known = Arrays.stream(RuleType.values()).anyMatch(r -> r.name().equals(upperName));
            if (known) {
                bitSet.set(RuleType.valueOf(upperName).type());
            } else {
                LOG.warn("ignore unknown normalization rule: {}", ruleName);
            }
        }
        return bitSet;
    }
}
