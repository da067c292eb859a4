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

package org.apache.letrec.planner.trees;

import java.util.BitSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assign a dense id to every tree node class, and cache for each class the bitset of
 * itself plus all of its super classes and interfaces.
 * Used by {@link TreeNode#containsType(Class[])} to check a whole subtree in O(1).
 */
public class SuperClassId {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();
    private static final Map<Class<?>, Integer> CLASS_TO_ID = new ConcurrentHashMap<>();
    private static final Map<Class<?>, BitSet> CLASS_TO_SUPER_IDS = new ConcurrentHashMap<>();

    private SuperClassId() {
    }

    public static int getClassId(Class<?> clazz) {
        return CLASS_TO_ID.computeIfAbsent(clazz, c -> NEXT_ID.getAndIncrement());
    }

    /** the returned bitset is shared, callers must not modify it */
    public static BitSet getSuperClassIds(Class<?> clazz) {
        return CLASS_TO_SUPER_IDS.computeIfAbsent(clazz, SuperClassId::computeSuperClassIds);
    }

    private static BitSet computeSuperClassIds(Class<?> clazz) {
        BitSet bitSet = new BitSet();
        addClassAndSupers(clazz, bitSet);
        return bitSet;
    }

    private static void addClassAndSupers(Class<?> clazz, BitSet bitSet) {
        if (clazz == null || clazz == Object.class) {
            return;
        }
        bitSet.set(getClassId(clazz));
        addClassAndSupers(clazz.getSuperclass(), bitSet);
        for (Class<?> anInterface : clazz.getInterfaces()) {
            addClassAndSupers(anInterface, bitSet);
        }
    }
}
