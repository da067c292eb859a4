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

import org.apache.letrec.planner.util.Utils;

import java.util.BitSet;
import java.util.List;

/**
 * 树节点的抽象基类。
 * 提供不可变的子节点列表，以及子树类型位图的缓存。
 *
 * @param <NODE_TYPE> 节点类型，必须是 TreeNode 的子类型
 */
public abstract class AbstractTreeNode<NODE_TYPE extends TreeNode<NODE_TYPE>>
        implements TreeNode<NODE_TYPE> {

    /** 类型位图，缓存了所有子节点及其自身的类型信息，用于快速类型检查 */
    protected final BitSet containsTypes;

    protected final List<NODE_TYPE> children;

    protected AbstractTreeNode(NODE_TYPE... children) {
        this(Utils.fastToImmutableList(children));
    }

    /**
     * 构造函数：使用列表参数。
     * 合并所有子节点的类型位图，并加上当前节点自身的类型。
     */
    protected AbstractTreeNode(List<NODE_TYPE> children) {
        this.children = Utils.fastToImmutableList(children);

        this.containsTypes = new BitSet();
        for (NODE_TYPE child : this.children) {
            containsTypes.or(child.getAllChildrenTypes());
        }
        containsTypes.or(getSuperClassTypes());
    }

    @Override
    public NODE_TYPE child(int index) {
        return children.get(index);
    }

    @Override
    public List<NODE_TYPE> children() {
        return children;
    }

    @Override
    public BitSet getAllChildrenTypes() {
        return containsTypes;
    }

    @Override
    public int arity() {
        return children.size();
    }

    @Override
    public BitSet getSuperClassTypes() {
        return SuperClassId.getSuperClassIds(getClass());
    }
}
