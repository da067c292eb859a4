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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Split the bindings of a region into strongly connected components and order them
 * so that every component comes after the components it references.
 *
 * 步骤1：Tarjan 算法计算强连通分量，成员数大于 1 或存在自环的分量是递归分量
 * 步骤2：在分量的凝聚图（无环）上做 Kahn 拓扑排序，依赖先于使用者；
 *       多个分量同时就绪时，按首个成员的发现顺序选择，保证结果确定
 */
public class RecursionAnalyzer {
    private static final Logger LOG = LogManager.getLogger(RecursionAnalyzer.class);

    private final ReferenceGraph graph;
    private final BindingTable table;

    // tarjan state
    private final Map<CTEId, Integer> index = Maps.newHashMap();
    private final Map<CTEId, Integer> lowLink = Maps.newHashMap();
    private final Deque<CTEId> stack = new ArrayDeque<>();
    private final Set<CTEId> onStack = Sets.newHashSet();
    private final List<List<CTEId>> sccs = Lists.newArrayList();
    private int nextIndex = 0;

    public RecursionAnalyzer(ReferenceGraph graph, BindingTable table) {
        this.graph = graph;
        this.table = table;
    }

    /**
     * @return components in dependency order, each binding marked recursive or not
     */
    public List<BindingComponent> analyze() {
        for (CTEId id : graph.getNodes()) {
            if (!index.containsKey(id)) {
                strongConnect(id);
            }
        }

        Map<CTEId, BindingComponent> componentOf = Maps.newHashMap();
        List<BindingComponent> components = Lists.newArrayListWithCapacity(sccs.size());
        for (List<CTEId> scc : sccs) {
            List<Binding> members = Lists.newArrayListWithCapacity(scc.size());
            for (CTEId id : scc) {
                members.add(table.getOrThrow(id));
            }
            members.sort(Comparator.comparingInt(Binding::getDiscoveryOrder));
            boolean recursive = members.size() > 1 || graph.hasSelfLoop(scc.get(0));
            for (Binding member : members) {
                member.setRecursive(recursive);
            }
            BindingComponent component = new BindingComponent(members, recursive);
            components.add(component);
            for (CTEId id : scc) {
                componentOf.put(id, component);
            }
        }

        List<BindingComponent> ordered = topologicalSort(components, componentOf);
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} binding(s) form {} component(s): {}", table.size(), ordered.size(), ordered);
        }
        return ordered;
    }

    private void strongConnect(CTEId id) {
        index.put(id, nextIndex);
        lowLink.put(id, nextIndex);
        nextIndex++;
        stack.push(id);
        onStack.add(id);

        for (CTEId target : graph.getReferences(id)) {
            if (!index.containsKey(target)) {
                strongConnect(target);
                lowLink.put(id, Math.min(lowLink.get(id), lowLink.get(target)));
            } else if (onStack.contains(target)) {
                lowLink.put(id, Math.min(lowLink.get(id), index.get(target)));
            }
        }

        if (lowLink.get(id).equals(index.get(id))) {
            List<CTEId> scc = Lists.newArrayList();
            CTEId member;
            do {
                member = stack.pop();
                onStack.remove(member);
                scc.add(member);
            } while (!member.equals(id));
            sccs.add(scc);
        }
    }

    private List<BindingComponent> topologicalSort(List<BindingComponent> components,
            Map<CTEId, BindingComponent> componentOf) {
        Map<BindingComponent, Set<BindingComponent>> dependencies = Maps.newHashMap();
        Map<BindingComponent, List<BindingComponent>> dependents = Maps.newHashMap();
        for (BindingComponent component : components) {
            dependencies.put(component, Sets.newHashSet());
            dependents.put(component, Lists.newArrayList());
        }
        for (BindingComponent component : components) {
            for (CTEId member : component.getIds()) {
                for (CTEId target : graph.getReferences(member)) {
                    BindingComponent dependency = componentOf.get(target);
                    if (dependency != component && dependencies.get(component).add(dependency)) {
                        dependents.get(dependency).add(component);
                    }
                }
            }
        }

        PriorityQueue<BindingComponent> ready = new PriorityQueue<>(
                Comparator.comparingInt(BindingComponent::getFirstDiscoveryOrder));
        Map<BindingComponent, Integer> waiting = Maps.newHashMap();
        for (BindingComponent component : components) {
            int count = dependencies.get(component).size();
            waiting.put(component, count);
            if (count == 0) {
                ready.add(component);
            }
        }

        ImmutableList.Builder<BindingComponent> ordered = ImmutableList.builderWithExpectedSize(components.size());
        int emitted = 0;
        while (!ready.isEmpty()) {
            BindingComponent next = ready.poll();
            ordered.add(next);
            emitted++;
            for (BindingComponent dependent : dependents.get(next)) {
                int left = waiting.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent);
                }
            }
        }
        Preconditions.checkState(emitted == components.size(), "condensation graph has a cycle");
        return ordered.build();
    }
}
