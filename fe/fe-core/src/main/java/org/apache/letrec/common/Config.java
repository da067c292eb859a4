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

package org.apache.letrec.common;

/**
 * Process wide defaults. Per run overrides live in {@link org.apache.letrec.qe.SessionVariable}.
 */
public class Config extends ConfigBase {

    @ConfField(mutable = true, description = {
            "每个重写作业以及绑定规范化内部循环允许的最大迭代次数，超过后报告内部错误。",
            "Max iterations of every rewrite job and of the canonicalizer loop before "
                    + "the run fails as not converged."})
    public static int max_scope_normalization_iterations = 100;

    @ConfField(mutable = true, description = {
            "是否把递归绑定内部不依赖外层递归组的作用域提升到外层。",
            "Whether scopes nested in a recursive binding that do not depend on the "
                    + "enclosing recursive group are hoisted out of it."})
    public static boolean enable_nested_scope_hoisting = true;

    @ConfField(mutable = true, description = {"禁用的规范化规则名称。",
            "Names of normalization rules that are skipped."})
    public static String[] disable_normalization_rules = {};

    @ConfField(mutable = true, description = {"是否记录每个规则改写前后的计划。",
            "Whether the plan before and after every applied rule is recorded."})
    public static boolean show_normalization_process = false;
}
