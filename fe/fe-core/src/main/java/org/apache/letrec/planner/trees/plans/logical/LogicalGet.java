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

package org.apache.letrec.planner.trees.plans.logical;

import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.PlanType;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

import java.util.Objects;

/**
 * Use site of a binding: reads the current value of the CTE with the given id.
 */
public class LogicalGet extends LogicalLeaf {

    private final CTEId cteId;

    public LogicalGet(CTEId cteId) {
        super(PlanType.LOGICAL_GET);
        this.cteId = Objects.requireNonNull(cteId, "cteId can not be null");
    }

    public CTEId getCteId() {
        return cteId;
    }

    public LogicalGet withCteId(CTEId newId) {
        return newId.equals(cteId) ? this : new LogicalGet(newId);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalGet(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return cteId.equals(((LogicalGet) o).cteId);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, cteId);
    }
}
