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

import org.apache.letrec.planner.exceptions.AnalysisException;
import org.apache.letrec.planner.exceptions.AnalysisException.ErrorCode;
import org.apache.letrec.planner.memo.BindingMemo;
import org.apache.letrec.planner.rules.rewrite.SimplifyTrivialOperators;
import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.Set;

/**
 * Reduce the bindings of a region until nothing changes:
 * <ol>
 *   <li>rewrite every reference to its representative and simplify trivial operators</li>
 *   <li>drop bindings the region body can not reach</li>
 *   <li>inline aliases, a binding whose value is a single reference to another binding</li>
 *   <li>unify bindings with structurally equal values, the later one into the earlier</li>
 * </ol>
 * A cycle is only dropped as a whole: as long as anything reachable references one member,
 * every member of the cycle is reachable too.
 */
public class BindingCanonicalizer {
    private static final Logger LOG = LogManager.getLogger(BindingCanonicalizer.class);

    private final BindingTable table;
    private final int maxIterations;
    private final BindingRedirects redirects = new BindingRedirects();

    private int deadBindings = 0;
    private int inlinedAliases = 0;
    private int unifiedDuplicates = 0;

    public BindingCanonicalizer(BindingTable table, int maxIterations) {
        this.table = table;
        this.maxIterations = maxIterations;
    }

    /**
     * Canonicalize the table in place.
     *
     * @return the region body with references rewritten to surviving bindings
     */
    public Plan canonicalize(Plan body) {
        int iterations = 0;
        boolean changed;
        do {
            if (iterations++ >= maxIterations) {
                throw new AnalysisException(ErrorCode.FIXPOINT_NOT_CONVERGED,
                        "binding canonicalization did not converge in " + maxIterations + " iterations");
            }
            body = rewriteReferences(body);
            changed = removeDeadBindings(body);
            changed |= inlineAliases();
            changed |= unifyDuplicates();
        } while (changed);

        if (LOG.isDebugEnabled()) {
            LOG.debug("canonicalized region in {} iteration(s): {} dead, {} alias(es) inlined, "
                    + "{} duplicate(s) unified, {} binding(s) left",
                    iterations, deadBindings, inlinedAliases, unifiedDuplicates, table.size());
        }
        return body;
    }

    private Plan rewriteReferences(Plan body) {
        for (Binding binding : table) {
            binding.setValue(SimplifyTrivialOperators.simplify(redirects.apply(binding.getValue())));
        }
        return SimplifyTrivialOperators.simplify(redirects.apply(body));
    }

    private boolean removeDeadBindings(Plan body) {
        Set<CTEId> live = ReferenceGraphBuilder.build(table, body).reachableFromRoot();
        boolean changed = false;
        for (Binding binding : table) {
            if (!live.contains(binding.getId())) {
                table.remove(binding.getId());
                deadBindings++;
                changed = true;
            }
        }
        return changed;
    }

    private boolean inlineAliases() {
        boolean changed = false;
        for (Binding binding : table) {
            if (!(binding.getValue() instanceof LogicalGet)) {
                continue;
            }
            CTEId target = redirects.find(((LogicalGet) binding.getValue()).getCteId());
            // x = Get x is kept, it is the empty least fixpoint
            if (target.equals(binding.getId())) {
                continue;
            }
            redirects.redirect(binding.getId(), target);
            table.remove(binding.getId());
            inlinedAliases++;
            changed = true;
        }
        return changed;
    }

    private boolean unifyDuplicates() {
        BindingMemo memo = new BindingMemo();
        boolean changed = false;
        for (Binding binding : table) {
            Plan canonicalValue = redirects.apply(binding.getValue());
            Optional<CTEId> owner = memo.copyIn(binding.getId(), canonicalValue);
            if (owner.isPresent()) {
                redirects.redirect(binding.getId(), owner.get());
                table.remove(binding.getId());
                unifiedDuplicates++;
                changed = true;
            }
        }
        return changed;
    }
}
