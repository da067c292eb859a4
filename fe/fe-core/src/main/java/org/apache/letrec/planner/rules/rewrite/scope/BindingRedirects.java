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
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;
import org.apache.letrec.planner.trees.plans.visitor.DefaultPlanRewriter;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Union-find over binding ids. A removed binding points at the binding that replaces it,
 * {@link #find} follows the chain to the surviving representative.
 */
public class BindingRedirects extends DefaultPlanRewriter<Void> {

    private final Map<CTEId, CTEId> parent = Maps.newHashMap();

    /** the surviving binding that stands for the given id */
    public CTEId find(CTEId id) {
        CTEId root = id;
        while (parent.containsKey(root)) {
            root = parent.get(root);
        }
        // path compression
        CTEId current = id;
        while (!current.equals(root)) {
            CTEId next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    /** every reference to {@code removed} is answered by {@code survivor} from now on */
    public void redirect(CTEId removed, CTEId survivor) {
        CTEId from = find(removed);
        CTEId to = find(survivor);
        Preconditions.checkState(!from.equals(to), "redirecting %s to itself", removed);
        parent.put(from, to);
    }

    /** rewrite every reference in the plan to its representative */
    public Plan apply(Plan plan) {
        if (parent.isEmpty()) {
            return plan;
        }
        return plan.accept(this, null);
    }

    @Override
    public Plan visit(Plan plan, Void context) {
        if (!plan.containsType(LogicalGet.class)) {
            return plan;
        }
        return visitChildren(this, plan, context);
    }

    @Override
    public Plan visitLogicalGet(LogicalGet get, Void context) {
        return get.withCteId(find(get.getCteId()));
    }
}
