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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Direct references between the bindings of one region.
 * An edge (from, to) means the value of {@code from} contains a {@code Get to}; multiplicities are collapsed.
 * References to bindings outside the region are kept apart as external: they are fixed inputs.
 */
public class ReferenceGraph {

    private final Set<CTEId> nodes = Sets.newLinkedHashSet();
    private final SetMultimap<CTEId, CTEId> edges = LinkedHashMultimap.create();
    private final SetMultimap<CTEId, CTEId> externalReferences = LinkedHashMultimap.create();
    private final Set<CTEId> rootReferences = Sets.newLinkedHashSet();

    void addNode(CTEId id) {
        nodes.add(id);
    }

    void addEdge(CTEId from, CTEId to) {
        edges.put(from, to);
    }

    void addExternalReference(CTEId from, CTEId to) {
        externalReferences.put(from, to);
    }

    void addRootReference(CTEId to) {
        rootReferences.add(to);
    }

    /** nodes in discovery order */
    public Set<CTEId> getNodes() {
        return nodes;
    }

    public Set<CTEId> getReferences(CTEId from) {
        return edges.get(from);
    }

    public boolean hasSelfLoop(CTEId id) {
        return edges.containsEntry(id, id);
    }

    public Set<CTEId> getExternalReferences(CTEId from) {
        return externalReferences.get(from);
    }

    /** bindings referenced directly by the region body */
    public Set<CTEId> getRootReferences() {
        return rootReferences;
    }

    public int edgeCount() {
        return edges.size();
    }

    /** bindings transitively reachable from the region body */
    public Set<CTEId> reachableFromRoot() {
        Set<CTEId> reached = Sets.newLinkedHashSet();
        Deque<CTEId> queue = new ArrayDeque<>(rootReferences);
        while (!queue.isEmpty()) {
            CTEId current = queue.poll();
            if (reached.add(current)) {
                queue.addAll(edges.get(current));
            }
        }
        return ImmutableSet.copyOf(reached);
    }
}
