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

import org.apache.letrec.common.Id;
import org.apache.letrec.common.IdGenerator;

/**
 * Id of a binding (a CTE). Only meaningful inside one plan, and only stable within one normalization run.
 */
public class CTEId extends Id<CTEId> {

    public CTEId(int id) {
        super(id);
    }

    /**
     * Should be only called by the normalization run that owns the ids.
     */
    public static IdGenerator<CTEId> createGenerator() {
        return new IdGenerator<CTEId>() {
            @Override
            public CTEId getNextId() {
                return new CTEId(nextId++);
            }
        };
    }

    @Override
    public String toString() {
        return "l" + id;
    }
}
