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

import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalLet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLetRec;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Wrap the region body in scopes, outermost first in component order.
 * A non-recursive component becomes a {@link LogicalLet}. A recursive component joins the
 * outermost {@link LogicalLetRec} that lies below every scope it depends on and whose members
 * it does not reference; otherwise it opens a new one. Unrelated recursive definitions therefore
 * share one scope even when non-recursive bindings are discovered between them, and none of
 * them iterates differently.
 */
public class ScopeRebuilder {

    private ScopeRebuilder() {
    }

    public static Plan rebuild(List<BindingComponent> components, ReferenceGraph graph, Plan body) {
        List<List<BindingComponent>> groups = Lists.newArrayList();
        Map<CTEId, Integer> groupOf = Maps.newHashMap();
        for (BindingComponent component : components) {
            // component order is topological, so dependencies are already placed
            int lowestAllowed = 0;
            for (CTEId member : component.getIds()) {
                for (CTEId reference : graph.getReferences(member)) {
                    Integer dependency = groupOf.get(reference);
                    if (dependency != null) {
                        lowestAllowed = Math.max(lowestAllowed, dependency + 1);
                    }
                }
            }
            int target = -1;
            if (component.isRecursive()) {
                for (int i = lowestAllowed; i < groups.size(); i++) {
                    if (groups.get(i).get(0).isRecursive()) {
                        target = i;
                        break;
                    }
                }
            }
            if (target < 0) {
                target = groups.size();
                groups.add(Lists.newArrayList());
            }
            groups.get(target).add(component);
            for (CTEId member : component.getIds()) {
                groupOf.put(member, target);
            }
        }

        Plan result = body;
        for (int i = groups.size() - 1; i >= 0; i--) {
            List<BindingComponent> group = groups.get(i);
            if (group.get(0).isRecursive()) {
                ImmutableList.Builder<CTEId> ids = ImmutableList.builder();
                ImmutableList.Builder<Plan> values = ImmutableList.builder();
                for (BindingComponent component : group) {
                    for (Binding member : component.getMembers()) {
                        ids.add(member.getId());
                        values.add(member.getValue());
                    }
                }
                result = new LogicalLetRec(ids.build(), values.build(), result);
            } else {
                Binding binding = group.get(0).getMembers().get(0);
                result = new LogicalLet(binding.getId(), binding.getValue(), result);
            }
        }
        return result;
    }
}
