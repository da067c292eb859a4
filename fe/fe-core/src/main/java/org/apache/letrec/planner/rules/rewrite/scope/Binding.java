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

import java.util.Objects;

/**
 * One entry of the {@link BindingTable}: a binding lifted out of its lexical position.
 * The value is replaced in place while the canonicalizer works on it.
 */
public class Binding {

    private final CTEId id;
    private final int scopeDepth;
    private final int discoveryOrder;
    private Plan value;
    private boolean recursive;

    Binding(CTEId id, int scopeDepth, int discoveryOrder) {
        this.id = Objects.requireNonNull(id, "id can not be null");
        this.scopeDepth = scopeDepth;
        this.discoveryOrder = discoveryOrder;
    }

    public CTEId getId() {
        return id;
    }

    /**
     * Depth of the scope chain where the binding was declared in the input.
     * Diagnostic only: placement of the rebuilt scopes depends on the reference graph alone.
     */
    public int getScopeDepth() {
        return scopeDepth;
    }

    public int getDiscoveryOrder() {
        return discoveryOrder;
    }

    public Plan getValue() {
        return value;
    }

    public void setValue(Plan value) {
        this.value = Objects.requireNonNull(value, "value can not be null");
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    @Override
    public String toString() {
        return (recursive ? "rec " : "") + id + "@" + discoveryOrder + "/d" + scopeDepth;
    }
}
