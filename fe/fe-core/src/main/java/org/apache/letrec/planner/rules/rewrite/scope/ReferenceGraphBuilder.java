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

/**
 * Build the {@link ReferenceGraph} of a region from its binding table and body.
 * References bound inside a value (nested scopes kept in a recursive binding) are not edges.
 */
public class ReferenceGraphBuilder {

    private ReferenceGraphBuilder() {
    }

    public static ReferenceGraph build(BindingTable table, Plan body) {
        ReferenceGraph graph = new ReferenceGraph();
        for (Binding binding : table) {
            graph.addNode(binding.getId());
        }
        for (Binding binding : table) {
            for (CTEId target : FreeReferences.of(binding.getValue())) {
                if (table.contains(target)) {
                    graph.addEdge(binding.getId(), target);
                } else {
                    graph.addExternalReference(binding.getId(), target);
                }
            }
        }
        for (CTEId target : FreeReferences.of(body)) {
            if (table.contains(target)) {
                graph.addRootReference(target);
            }
        }
        return graph;
    }
}
