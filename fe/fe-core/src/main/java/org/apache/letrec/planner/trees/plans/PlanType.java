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

/**
 * Types for all Plan in the normalizer.
 * Closed set: every pass that matches on plans must handle all of them.
 */
public enum PlanType {
    LOGICAL_GET,
    LOGICAL_TABLE_SCAN,
    LOGICAL_CONSTANT,
    LOGICAL_PROJECT,
    LOGICAL_MAP,
    LOGICAL_FILTER,
    LOGICAL_UNION,
    LOGICAL_DISTINCT,
    LOGICAL_AGGREGATE,
    LOGICAL_THRESHOLD,
    LOGICAL_NEGATE,
    LOGICAL_EXCEPT,
    LOGICAL_OPAQUE,
    LOGICAL_LET,
    LOGICAL_LET_REC
}
