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

import java.util.Objects;

/**
 * Read of a base relation. Base relations are fixed inputs for the normalizer.
 */
public class LogicalTableScan extends LogicalLeaf {

    private final String tableName;

    public LogicalTableScan(String tableName) {
        super(PlanType.LOGICAL_TABLE_SCAN);
        this.tableName = Objects.requireNonNull(tableName, "tableName can not be null");
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalTableScan(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return tableName.equals(((LogicalTableScan) o).tableName);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(type, tableName);
    }
}
