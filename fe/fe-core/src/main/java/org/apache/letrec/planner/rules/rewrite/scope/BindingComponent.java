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

import java.util.List;

/**
 * A strongly connected component of the reference graph, members in discovery order.
 * Recursive when it has more than one member or its only member references itself.
 */
public class BindingComponent {

    private final List<Binding> members;
    private final boolean recursive;

    public BindingComponent(List<Binding> members, boolean recursive) {
        Preconditions.checkArgument(!members.isEmpty(), "empty component");
        this.members = ImmutableList.copyOf(members);
        this.recursive = recursive;
    }

    public List<Binding> getMembers() {
        return members;
    }

    public List<CTEId> getIds() {
        return members.stream().map(Binding::getId).collect(ImmutableList.toImmutableList());
    }

    public boolean isRecursive() {
        return recursive;
    }

    /** the discovery order of the first member, used to break ties between ready components */
    public int getFirstDiscoveryOrder() {
        return members.get(0).getDiscoveryOrder();
    }

    @Override
    public String toString() {
        return (recursive ? "Recursive" : "NonRecursive") + members;
    }
}
