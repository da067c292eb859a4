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
import com.google.common.collect.Maps;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flat table of all bindings of one normalization region, iterated in discovery order.
 */
public class BindingTable implements Iterable<Binding> {

    private final Map<CTEId, Binding> bindings = Maps.newLinkedHashMap();
    private int nextDiscoveryOrder = 0;

    /** add a binding whose value is set later */
    public Binding register(CTEId id, int scopeDepth) {
        Preconditions.checkState(!bindings.containsKey(id), "binding %s registered twice", id);
        Binding binding = new Binding(id, scopeDepth, nextDiscoveryOrder++);
        bindings.put(id, binding);
        return binding;
    }

    public boolean contains(CTEId id) {
        return bindings.containsKey(id);
    }

    public Binding getOrThrow(CTEId id) {
        Binding binding = bindings.get(id);
        Preconditions.checkState(binding != null, "binding %s is not in the table", id);
        return binding;
    }

    public void remove(CTEId id) {
        Preconditions.checkState(bindings.remove(id) != null, "binding %s is not in the table", id);
    }

    /** snapshot in discovery order, safe to iterate while removing */
    public List<Binding> getBindings() {
        return ImmutableList.copyOf(bindings.values());
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public Iterator<Binding> iterator() {
        return getBindings().iterator();
    }
}
