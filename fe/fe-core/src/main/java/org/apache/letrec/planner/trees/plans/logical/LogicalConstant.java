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

import org.apache.letrec.planner.trees.plans.PlanType;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A literal collection of rows. Every row is counted once, duplicated rows are listed twice.
 */
public class LogicalConstant extends LogicalLeaf {

    private final List<List<Object>> rows;

    /** rows must not contain null values */
    public LogicalConstant(List<? extends List<?>> rows) {
        super(PlanType.LOGICAL_CONSTANT);
        ImmutableList.Builder<List<Object>> builder = ImmutableList.builderWithExpectedSize(rows.size());
        for (List<?> row : rows) {
            builder.add(ImmutableList.copyOf(row));
        }
        this.rows = builder.build();
    }

    public static LogicalConstant empty() {
        return new LogicalConstant(ImmutableList.of());
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalConstant(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return rows.equals(((LogicalConstant) o).rows);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, rows);
    }
}
