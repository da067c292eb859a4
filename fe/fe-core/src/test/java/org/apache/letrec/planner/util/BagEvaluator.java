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

package org.apache.letrec.planner.util;

import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalAggregate;
import org.apache.letrec.planner.trees.plans.logical.LogicalConstant;
import org.apache.letrec.planner.trees.plans.logical.LogicalDistinct;
import org.apache.letrec.planner.trees.plans.logical.LogicalExcept;
import org.apache.letrec.planner.trees.plans.logical.LogicalFilter;
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLetRec;
import org.apache.letrec.planner.trees.plans.logical.LogicalMap;
import org.apache.letrec.planner.trees.plans.logical.LogicalNegate;
import org.apache.letrec.planner.trees.plans.logical.LogicalProject;
import org.apache.letrec.planner.trees.plans.logical.LogicalTableScan;
import org.apache.letrec.planner.trees.plans.logical.LogicalThreshold;
import org.apache.letrec.planner.trees.plans.logical.LogicalUnion;
import org.apache.letrec.planner.trees.plans.visitor.PlanVisitor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reference evaluator over signed multisets: a bag maps a row to its count, counts may be negative.
 * Recursive groups iterate all members together from empty bags until none of them changes.
 * Filter predicates and map scalars are looked up by their text.
 */
public class BagEvaluator extends PlanVisitor<Map<List<Object>, Integer>, Map<CTEId, Map<List<Object>, Integer>>> {

    private static final int MAX_ROUNDS = 1000;

    private final Map<String, Map<List<Object>, Integer>> tables = Maps.newHashMap();
    private final Map<String, Predicate<List<Object>>> predicates = Maps.newHashMap();
    private final Map<String, Function<List<Object>, Object>> scalars = Maps.newHashMap();

    public BagEvaluator withTable(String name, List<?>... rows) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        for (List<?> row : rows) {
            bag.merge(ImmutableList.copyOf(row), 1, Integer::sum);
        }
        tables.put(name, bag);
        return this;
    }

    public BagEvaluator withPredicate(String text, Predicate<List<Object>> predicate) {
        predicates.put(text, predicate);
        return this;
    }

    public BagEvaluator withScalar(String text, Function<List<Object>, Object> scalar) {
        scalars.put(text, scalar);
        return this;
    }

    public Map<List<Object>, Integer> evaluate(Plan plan) {
        return plan.accept(this, ImmutableMap.of());
    }

    @Override
    public Map<List<Object>, Integer> visit(Plan plan, Map<CTEId, Map<List<Object>, Integer>> env) {
        throw new UnsupportedOperationException("can not evaluate " + plan.getType());
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalGet(LogicalGet get, Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = env.get(get.getCteId());
        Preconditions.checkState(bag != null, "unbound %s", get.getCteId());
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalTableScan(LogicalTableScan scan,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = tables.get(scan.getTableName());
        Preconditions.checkState(bag != null, "unknown table %s", scan.getTableName());
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalConstant(LogicalConstant constant,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        for (List<Object> row : constant.getRows()) {
            add(bag, row, 1);
        }
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalProject(LogicalProject project,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        for (Map.Entry<List<Object>, Integer> entry : project.child().accept(this, env).entrySet()) {
            ImmutableList.Builder<Object> row = ImmutableList.builder();
            for (Integer column : project.getOutputs()) {
                row.add(entry.getKey().get(column));
            }
            add(bag, row.build(), entry.getValue());
        }
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalMap(LogicalMap map, Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        for (Map.Entry<List<Object>, Integer> entry : map.child().accept(this, env).entrySet()) {
            ImmutableList.Builder<Object> row = ImmutableList.builder().addAll(entry.getKey());
            for (String scalar : map.getScalars()) {
                row.add(lookup(scalars, scalar).apply(entry.getKey()));
            }
            add(bag, row.build(), entry.getValue());
        }
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalFilter(LogicalFilter filter,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        for (Map.Entry<List<Object>, Integer> entry : filter.child().accept(this, env).entrySet()) {
            boolean keep = true;
            for (String predicate : filter.getPredicates()) {
                keep &= lookup(predicates, predicate).test(entry.getKey());
            }
            if (keep) {
                add(bag, entry.getKey(), entry.getValue());
            }
        }
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalUnion(LogicalUnion union,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        for (Plan input : union.getInputs()) {
            input.accept(this, env).forEach((row, count) -> add(bag, row, count));
        }
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalDistinct(LogicalDistinct distinct,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        distinct.child().accept(this, env).forEach((row, count) -> {
            if (count > 0) {
                bag.put(row, 1);
            }
        });
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalAggregate(LogicalAggregate aggregate,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Preconditions.checkState(aggregate.getAggregates().equals(ImmutableList.of("count(*)")),
                "only count(*) is supported");
        Map<List<Object>, Integer> counts = Maps.newHashMap();
        aggregate.child().accept(this, env).forEach((row, count) -> {
            ImmutableList.Builder<Object> key = ImmutableList.builder();
            for (Integer column : aggregate.getGroupKeys()) {
                key.add(row.get(column));
            }
            counts.merge(key.build(), count, Integer::sum);
        });
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        counts.forEach((key, count) -> {
            if (count != 0) {
                add(bag, ImmutableList.builder().addAll(key).add(count).build(), 1);
            }
        });
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalThreshold(LogicalThreshold threshold,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        threshold.child().accept(this, env).forEach((row, count) -> {
            if (count > 0) {
                bag.put(row, count);
            }
        });
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalNegate(LogicalNegate negate,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        negate.child().accept(this, env).forEach((row, count) -> bag.put(row, -count));
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalExcept(LogicalExcept except,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> left = except.left().accept(this, env);
        Map<List<Object>, Integer> right = except.right().accept(this, env);
        Map<List<Object>, Integer> bag = Maps.newHashMap();
        left.forEach((row, count) -> {
            if (count > 0) {
                add(bag, row, except.isAll() ? count : 1);
            }
        });
        right.forEach((row, count) -> {
            if (count > 0) {
                add(bag, row, except.isAll() ? -count : -1);
            }
        });
        bag.values().removeIf(count -> count < 0);
        return bag;
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalLet(LogicalLet let, Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<List<Object>, Integer> value = let.getValue().accept(this, env);
        return let.getBody().accept(this, extend(env, ImmutableMap.of(let.getCteId(), value)));
    }

    @Override
    public Map<List<Object>, Integer> visitLogicalLetRec(LogicalLetRec letRec,
            Map<CTEId, Map<List<Object>, Integer>> env) {
        Map<CTEId, Map<List<Object>, Integer>> current = Maps.newHashMap();
        for (CTEId id : letRec.getCteIds()) {
            current.put(id, ImmutableMap.of());
        }
        for (int round = 0; ; round++) {
            Preconditions.checkState(round < MAX_ROUNDS, "recursive group does not converge");
            Map<CTEId, Map<List<Object>, Integer>> inner = extend(env, current);
            Map<CTEId, Map<List<Object>, Integer>> next = Maps.newHashMap();
            for (int i = 0; i < letRec.getCteIds().size(); i++) {
                next.put(letRec.getCteIds().get(i), letRec.getBindingValues().get(i).accept(this, inner));
            }
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        return letRec.getBody().accept(this, extend(env, current));
    }

    private static Map<CTEId, Map<List<Object>, Integer>> extend(Map<CTEId, Map<List<Object>, Integer>> env,
            Map<CTEId, Map<List<Object>, Integer>> bindings) {
        Map<CTEId, Map<List<Object>, Integer>> result = Maps.newHashMap(env);
        result.putAll(bindings);
        return result;
    }

    private static void add(Map<List<Object>, Integer> bag, List<Object> row, int count) {
        int merged = bag.getOrDefault(row, 0) + count;
        if (merged == 0) {
            bag.remove(row);
        } else {
            bag.put(row, merged);
        }
    }

    private static <T> T lookup(Map<String, T> functions, String text) {
        T function = functions.get(text);
        Preconditions.checkState(function != null, "no function registered for '%s'", text);
        return function;
    }
}
