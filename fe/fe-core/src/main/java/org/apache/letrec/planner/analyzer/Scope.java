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

package org.apache.letrec.planner.analyzer;

import org.apache.letrec.planner.trees.plans.CTEId;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 绑定的词法作用域。
 *
 * bindings: 当前层级声明的绑定，键为输入计划中的原始 id，值为本轮规范化分配的新 id。
 * outerScope: 外层作用域，解析不到的 id 继续向外查找。
 *
 * 示例：
 * let a = ... in letrec b = (... Get a ... Get b ...) in Get b
 *
 * 当分析 b 的值时：
 * bindings: b -> l1;
 * outerScope:
 *      bindings: a -> l0;
 *      outerScope: Optional.empty();
 */
public class Scope {

    private final Optional<Scope> outerScope;

    private final Map<CTEId, CTEId> bindings;

    private final int depth;

    public Scope(Optional<Scope> outerScope, Map<CTEId, CTEId> bindings) {
        this.outerScope = Objects.requireNonNull(outerScope, "outerScope can not be null");
        this.bindings = ImmutableMap.copyOf(Objects.requireNonNull(bindings, "bindings can not be null"));
        this.depth = outerScope.map(s -> s.depth + 1).orElse(0);
    }

    public static Scope root() {
        return new Scope(Optional.empty(), ImmutableMap.of());
    }

    public Scope withBindings(Map<CTEId, CTEId> innerBindings) {
        return new Scope(Optional.of(this), innerBindings);
    }

    public Optional<Scope> getOuterScope() {
        return outerScope;
    }

    public Map<CTEId, CTEId> getBindings() {
        return bindings;
    }

    /** nesting depth, 0 for the root */
    public int getDepth() {
        return depth;
    }

    /** find the new id of an original id, innermost declaration first */
    public Optional<CTEId> resolve(CTEId originalId) {
        Scope scope = this;
        while (true) {
            CTEId found = scope.bindings.get(originalId);
            if (found != null) {
                return Optional.of(found);
            }
            if (!scope.outerScope.isPresent()) {
                return Optional.empty();
            }
            scope = scope.outerScope.get();
        }
    }
}
