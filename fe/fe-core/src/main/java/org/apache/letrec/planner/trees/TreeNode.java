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

import com.google.common.collect.ImmutableList;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * interface for all node in the plan tree.
 *
 * @param <NODE_TYPE> either {@link org.apache.letrec.planner.trees.plans.Plan} or a future expression type
 */
public interface TreeNode<NODE_TYPE extends TreeNode<NODE_TYPE>> {

    List<NODE_TYPE> children();

    NODE_TYPE child(int index);

    int arity();

    NODE_TYPE withChildren(List<NODE_TYPE> children);

    default NODE_TYPE withChildren(NODE_TYPE... children) {
        return withChildren(ImmutableList.copyOf(children));
    }

    BitSet getAllChildrenTypes();

    BitSet getSuperClassTypes();

    /**
     * 判断子树中是否包含任意一种给定类型的节点。
     * 只读取构造时缓存的类型位图，不会遍历整棵树。
     */
    default boolean containsType(Class<?>... types) {
        BitSet allTypes = getAllChildrenTypes();
        for (Class<?> type : types) {
            if (allTypes.get(SuperClassId.getClassId(type))) {
                return true;
            }
        }
        return false;
    }

    /** pre-order traversal, without recursion so deep plans do not blow the stack */
    default void foreach(Consumer<TreeNode<NODE_TYPE>> func) {
        Deque<TreeNode<NODE_TYPE>> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TreeNode<NODE_TYPE> current = stack.pop();
            func.accept(current);
            List<NODE_TYPE> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    default boolean anyMatch(Predicate<TreeNode<NODE_TYPE>> predicate) {
        Deque<TreeNode<NODE_TYPE>> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TreeNode<NODE_TYPE> current = stack.pop();
            if (predicate.test(current)) {
                return true;
            }
            for (NODE_TYPE child : current.children()) {
                stack.push(child);
            }
        }
        return false;
    }

    /** collect matched nodes in pre-order, duplicates removed */
    default <T> Set<T> collect(Predicate<TreeNode<NODE_TYPE>> predicate) {
        Set<T> result = new LinkedHashSet<>();
        foreach(node -> {
            if (predicate.test(node)) {
                result.add((T) node);
            }
        });
        return result;
    }
}
