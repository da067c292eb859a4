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

package org.apache.letrec.planner.rules.rewrite.scope;

import org.apache.letrec.common.IdGenerator;
import org.apache.letrec.planner.analyzer.Scope;
import org.apache.letrec.planner.trees.plans.BindingScope;
import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.qe.SessionVariable;

import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;

/**
 * One pass of scope normalization. The whole plan is the top region,
 * the value of every recursive binding is a nested region normalized on its own.
 * Owns the id generator of the pass, so ids are unique across all regions of the pass.
 */
public class RegionNormalizer {
    private static final Logger LOG = LogManager.getLogger(RegionNormalizer.class);

    private final IdGenerator<CTEId> idGenerator = CTEId.createGenerator();
    private final Set<CTEId> declaredIds;
    private final boolean enableNestedScopeHoisting;
    private final int maxIterations;

    public RegionNormalizer(Plan root, SessionVariable sessionVariable) {
        this.declaredIds = collectDeclaredIds(root);
        this.enableNestedScopeHoisting = sessionVariable.isEnableNestedScopeHoisting();
        this.maxIterations = sessionVariable.getMaxFixpointIterations();
    }

    /**
     * flatten, canonicalize, analyze and rebuild one region.
     *
     * @param scope bindings visible around the region, they are external to it
     */
    public Plan normalizeRegion(Plan region, Scope scope) {
        BindingTable table = new BindingTable();
        ScopeFlattener flattener = new ScopeFlattener(this, table);
        Plan body = region.accept(flattener, scope);
        int flattened = table.size();

        body = new BindingCanonicalizer(table, maxIterations).canonicalize(body);
        ReferenceGraph graph = ReferenceGraphBuilder.build(table, body);
        List<BindingComponent> components = new RecursionAnalyzer(graph, table).analyze();

        if (LOG.isDebugEnabled()) {
            LOG.debug("region at depth {}: {} binding(s) flattened, {} hoisted, {} left in {} component(s)",
                    scope.getDepth(), flattened, flattener.getHoistedBindings(), table.size(), components.size());
        }
        return ScopeRebuilder.rebuild(components, graph, body);
    }

    CTEId nextId() {
        return idGenerator.getNextId();
    }

    boolean isDeclared(CTEId originalId) {
        return declaredIds.contains(originalId);
    }

    boolean isNestedScopeHoistingEnabled() {
        return enableNestedScopeHoisting;
    }

    private static Set<CTEId> collectDeclaredIds(Plan root) {
        ImmutableSet.Builder<CTEId> ids = ImmutableSet.builder();
        root.foreach(node -> {
            if (node instanceof BindingScope) {
                ids.addAll(((BindingScope) node).getCteIds());
            }
        });
        return ids.build();
    }
}
