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

package org.apache.letrec.planner.rules.rewrite;

import org.apache.letrec.planner.analyzer.Scope;
import org.apache.letrec.planner.jobs.JobContext;
import org.apache.letrec.planner.rules.rewrite.scope.CteIdRenumberer;
import org.apache.letrec.planner.rules.rewrite.scope.RegionNormalizer;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.visitor.CustomRewriter;

/**
 * One pass of binding scope normalization over the whole plan.
 *
 * 每一轮：
 * 1. 以整棵树为顶层区域，展平所有绑定（递归绑定的值作为内层区域先行规范化）
 * 2. 规范化绑定值：重定向、别名内联、哈希一致化、删除死绑定，直到没有变化
 * 3. 计算强连通分量并按依赖顺序重建作用域
 * 4. 按先序重新编号，得到从 0 开始连续的 id
 *
 * 由于每一轮都重新编号，连续两轮输出结构相等即表示收敛，这由执行器的不动点循环判断。
 */
public class NormalizeBindingScopes implements CustomRewriter {

    @Override
    public Plan rewriteRoot(Plan plan, JobContext jobContext) {
        RegionNormalizer regionNormalizer = new RegionNormalizer(plan,
                jobContext.getNormalizationContext().getSessionVariable());
        Plan normalized = regionNormalizer.normalizeRegion(plan, Scope.root());
        return CteIdRenumberer.renumber(normalized);
    }
}
