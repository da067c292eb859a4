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

package org.apache.letrec.planner.trees.plans.visitor;

import org.apache.letrec.planner.trees.plans.BindingScope;
import org.apache.letrec.planner.trees.plans.CTEId;
import org.apache.letrec.planner.trees.plans.Plan;
import org.apache.letrec.planner.trees.plans.logical.LogicalAggregate;
import org.apache.letrec.planner.trees.plans.logical.LogicalConstant;
import org.apache.letrec.planner.trees.plans.logical.LogicalExcept;
import org.apache.letrec.planner.trees.plans.logical.LogicalFilter;
import org.apache.letrec.planner.trees.plans.logical.LogicalGet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLet;
import org.apache.letrec.planner.trees.plans.logical.LogicalLetRec;
import org.apache.letrec.planner.trees.plans.logical.LogicalMap;
import org.apache.letrec.planner.trees.plans.logical.LogicalOpaque;
import org.apache.letrec.planner.trees.plans.logical.LogicalProject;
import org.apache.letrec.planner.trees.plans.logical.LogicalTableScan;
import org.apache.letrec.planner.util.Utils;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Render a plan as indented text, the format used by explain output and test fixtures.
 *
 * <pre>
 * Return
 *   Get l0
 * With Mutually Recursive
 *   cte l0 =
 *     Distinct
 *       Union
 *         Get l0
 *         Constant
 *           - (1)
 * </pre>
 *
 * 连续嵌套的绑定作用域被视为一条链：先输出 Return 及链末端的 body，
 * 然后按从内到外的顺序，每段同类作用域输出一个 With / With Mutually Recursive 块，
 * 块内成员按 id 逆序输出。
 */
public class ExplainPlanPrinter extends PlanVisitor<Void, Integer> {

    private static final String INDENT = "  ";

    private final StringBuilder builder = new StringBuilder();

    private ExplainPlanPrinter() {
    }

    public static String print(Plan plan) {
        ExplainPlanPrinter printer = new ExplainPlanPrinter();
        plan.accept(printer, 0);
        return StringUtils.stripEnd(printer.builder.toString(), "\n");
    }

    @Override
    public Void visit(Plan plan, Integer indent) {
        line(indent, label(plan));
        for (Plan child : plan.children()) {
            child.accept(this, indent + 1);
        }
        return null;
    }

    @Override
    public Void visitLogicalConstant(LogicalConstant constant, Integer indent) {
        if (constant.isEmpty()) {
            line(indent, "Constant <empty>");
            return null;
        }
        line(indent, "Constant");
        for (List<Object> row : constant.getRows()) {
            line(indent + 1, "- " + Utils.toTuple(row));
        }
        return null;
    }

    @Override
    public Void visitLogicalLet(LogicalLet let, Integer indent) {
        return printScopeChain(let, indent);
    }

    @Override
    public Void visitLogicalLetRec(LogicalLetRec letRec, Integer indent) {
        return printScopeChain(letRec, indent);
    }

    private Void printScopeChain(BindingScope outermost, int indent) {
        List<BindingScope> chain = Lists.newArrayList();
        Plan current = outermost;
        while (current instanceof BindingScope) {
            chain.add((BindingScope) current);
            current = ((BindingScope) current).getBody();
        }
        line(indent, "Return");
        current.accept(this, indent + 1);

        int end = chain.size();
        while (end > 0) {
            boolean recursive = chain.get(end - 1).isRecursive();
            int start = end - 1;
            while (start > 0 && chain.get(start - 1).isRecursive() == recursive) {
                start--;
            }
            // non-recursive scopes get their own "With" block, same layout as recursive ones (DESIGN.md, decision 8)
            line(indent, recursive ? "With Mutually Recursive" : "With");
            List<Map.Entry<CTEId, Plan>> members = Lists.newArrayList();
            for (BindingScope scope : chain.subList(start, end)) {
                for (int i = 0; i < scope.getCteIds().size(); i++) {
                    members.add(Maps.immutableEntry(scope.getCteIds().get(i), scope.getBindingValues().get(i)));
                }
            }
            members.sort(Map.Entry.<CTEId, Plan>comparingByKey().reversed());
            for (Map.Entry<CTEId, Plan> member : members) {
                line(indent + 1, "cte " + member.getKey() + " =");
                member.getValue().accept(this, indent + 2);
            }
            end = start;
        }
        return null;
    }

    private void line(int indent, String text) {
        builder.append(StringUtils.repeat(INDENT, indent)).append(text).append('\n');
    }

    private static String label(Plan plan) {
        switch (plan.getType()) {
            case LOGICAL_GET:
                return "Get " + ((LogicalGet) plan).getCteId();
            case LOGICAL_TABLE_SCAN:
                return "ReadStorage " + ((LogicalTableScan) plan).getTableName();
            case LOGICAL_PROJECT:
                return "Project " + Utils.toTuple(Lists.transform(((LogicalProject) plan).getOutputs(), c -> "#" + c));
            case LOGICAL_MAP:
                return "Map " + Utils.toTuple(((LogicalMap) plan).getScalars());
            case LOGICAL_FILTER:
                List<String> predicates = ((LogicalFilter) plan).getPredicates();
                return predicates.isEmpty() ? "Filter" : "Filter " + StringUtils.join(predicates, " AND ");
            case LOGICAL_UNION:
                return "Union";
            case LOGICAL_DISTINCT:
                return "Distinct";
            case LOGICAL_AGGREGATE:
                LogicalAggregate aggregate = (LogicalAggregate) plan;
                return "Reduce group_by=[" + Utils.columnRefs(aggregate.getGroupKeys())
                        + "] aggregates=[" + StringUtils.join(aggregate.getAggregates(), ", ") + "]";
            case LOGICAL_THRESHOLD:
                return "Threshold";
            case LOGICAL_NEGATE:
                return "Negate";
            case LOGICAL_EXCEPT:
                return ((LogicalExcept) plan).isAll() ? "ExceptAll" : "Except";
            case LOGICAL_OPAQUE:
                LogicalOpaque opaque = (LogicalOpaque) plan;
                return opaque.getArguments().isEmpty()
                        ? opaque.getOperator()
                        : opaque.getOperator() + " " + opaque.getArguments();
            default:
                throw new IllegalArgumentException("no label for " + plan.getType());
        }
    }
}
