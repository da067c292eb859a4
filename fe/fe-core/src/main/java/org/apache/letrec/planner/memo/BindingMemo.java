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

package org.apache.letrec.planner.memo;

import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;

import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Optional;

/**
 * Hash-consing table of binding values: the first binding that registers a value owns it,
 * later bindings with a structurally equal value are reported as duplicates of the owner.
 */
public class BindingMemo {

    private final Map<Plan, CTEId> valueToOwner = Maps.newHashMap();

    /**
     * 把绑定值登记到 memo 中。
     *
     * @return 已经拥有结构相同的值的绑定；如果是第一次出现，返回 empty 并登记为 owner
     */
    public Optional<CTEId> copyIn(CTEId id, Plan canonicalValue) {
        CTEId owner = valueToOwner.putIfAbsent(canonicalValue, id);
        if (owner == null || owner.equals(id)) {
            return Optional.empty();
        }
        return Optional.of(owner);
    }

    public int size() {
        return valueToOwner.size();
    }
}
