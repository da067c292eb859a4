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

package org.apache.letrec.planner.trees.plans;

import org.apache.letrec.planner.trees.AbstractTreeNode;

import com.google.common.base.Suppliers;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Abstract class for all concrete plan node.
 */
public abstract class AbstractPlan extends AbstractTreeNode<Plan> implements Plan {

    protected final PlanType type;

    /** 哈希码的懒加载缓存，哈希一致化（hash-consing）会反复用到 */
    private final Supplier<Integer> hashCodeCache = Suppliers.memoize(this::computeHashCode);

    protected AbstractPlan(PlanType type, Plan... children) {
        super(children);
        this.type = Objects.requireNonNull(type, "type can not be null");
    }

    protected AbstractPlan(PlanType type, List<Plan> children) {
        super(children);
        this.type = Objects.requireNonNull(type, "type can not be null");
    }

    @Override
    public PlanType getType() {
        return type;
    }

    @Override
    public final int hashCode() {
        return hashCodeCache.get();
    }

    /** hash of local fields and children, computed once */
    protected abstract int computeHashCode();

    /** cheap rejection before the deep comparison */
    protected boolean sameShape(AbstractPlan other) {
        return hashCode() == other.hashCode() && arity() == other.arity();
    }

    @Override
    public String toString() {
        return treeString();
    }
}
