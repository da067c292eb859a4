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

package org.apache.letrec.planner.rules.rewrite.scope;

import static org.apache.letrec.planner.util.PlanConstructor.distinct;
import static org.apache.letrec.planner.util.PlanConstructor.get;
import static org.apache.letrec.planner.util.PlanConstructor.id;
import static org.apache.letrec.planner.util.PlanConstructor.let;
import static org.apache.letrec.planner.util.PlanConstructor.letRec;
import static org.apache.letrec.planner.util.PlanConstructor.scan;
import static org.apache.letrec.planner.util.PlanConstructor.union;

import org.apache.letrec.planner.trees.plans.Plan;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class RecursionAnalyzerTest {

    private final Plan valueA = distinct(union(scan("t"), get(1)));
    private final Plan valueB = distinct(get(0));
    private final Plan valueC = distinct(union(scan("u"), get(2)));
    private final Plan valueD = union(get(0), scan("v"));
    private final Plan valueE = scan("w");
    private final Plan body = union(get(3), get(2), get(4));

    private BindingTable fiveBindings() {
        BindingTable table = new BindingTable();
        table.register(id(0), 0).setValue(valueA);
        table.register(id(1), 0).setValue(valueB);
        table.register(id(2), 0).setValue(valueC);
        table.register(id(3), 0).setValue(valueD);
        table.register(id(4), 0).setValue(valueE);
        return table;
    }

    @Test
    public void testComponentsInDependencyOrder() {
        BindingTable table = fiveBindings();
        List<BindingComponent> components =
                new RecursionAnalyzer(ReferenceGraphBuilder.build(table, body), table).analyze();

        Assertions.assertEquals(4, components.size());
        Assertions.assertEquals(ImmutableList.of(id(0), id(1)), components.get(0).getIds());
        Assertions.assertEquals(ImmutableList.of(id(2)), components.get(1).getIds());
        Assertions.assertEquals(ImmutableList.of(id(3)), components.get(2).getIds());
        Assertions.assertEquals(ImmutableList.of(id(4)), components.get(3).getIds());

        Assertions.assertTrue(components.get(0).isRecursive());
        Assertions.assertTrue(components.get(1).isRecursive());
        Assertions.assertFalse(components.get(2).isRecursive());
        Assertions.assertFalse(components.get(3).isRecursive());
        Assertions.assertTrue(table.getOrThrow(id(1)).isRecursive());
        Assertions.assertFalse(table.getOrThrow(id(3)).isRecursive());
    }

    @Test
    public void testDependencyComesFirstEvenWhenDiscoveredLater() {
        BindingTable table = new BindingTable();
        table.register(id(0), 0).setValue(union(get(1), scan("t")));
        table.register(id(1), 0).setValue(scan("u"));
        List<BindingComponent> components =
                new RecursionAnalyzer(ReferenceGraphBuilder.build(table, get(0)), table).analyze();

        Assertions.assertEquals(ImmutableList.of(id(1)), components.get(0).getIds());
        Assertions.assertEquals(ImmutableList.of(id(0)), components.get(1).getIds());
    }

    @Test
    public void testRebuildMergesIndependentRecursiveComponents() {
        BindingTable table = fiveBindings();
        ReferenceGraph graph = ReferenceGraphBuilder.build(table, body);
        List<BindingComponent> components = new RecursionAnalyzer(graph, table).analyze();

        Plan rebuilt = ScopeRebuilder.rebuild(components, graph, body);

        Plan expected = letRec(ImmutableList.of(0, 1, 2), ImmutableList.of(valueA, valueB, valueC),
                let(3, valueD, let(4, valueE, body)));
        Assertions.assertEquals(expected, rebuilt);
    }

    @Test
    public void testRebuildKeepsDependentRecursiveComponentsApart() {
        BindingTable table = new BindingTable();
        Plan x = distinct(union(scan("t"), get(0)));
        Plan y = distinct(union(get(0), get(1)));
        table.register(id(0), 0).setValue(x);
        table.register(id(1), 0).setValue(y);
        ReferenceGraph graph = ReferenceGraphBuilder.build(table, get(1));
        List<BindingComponent> components = new RecursionAnalyzer(graph, table).analyze();

        Assertions.assertEquals(letRec(0, x, letRec(1, y, get(1))), ScopeRebuilder.rebuild(components, graph, get(1)));
    }

    @Test
    public void testRebuildMergesAcrossNonRecursiveBinding() {
        BindingTable table = new BindingTable();
        Plan a = distinct(union(scan("t"), get(0)));
        Plan m = scan("u");
        Plan b = distinct(union(scan("v"), get(2)));
        table.register(id(0), 0).setValue(a);
        table.register(id(1), 0).setValue(m);
        table.register(id(2), 0).setValue(b);
        Plan regionBody = union(get(0), get(1), get(2));
        ReferenceGraph graph = ReferenceGraphBuilder.build(table, regionBody);
        List<BindingComponent> components = new RecursionAnalyzer(graph, table).analyze();

        Plan expected = letRec(ImmutableList.of(0, 2), ImmutableList.of(a, b), let(1, m, regionBody));
        Assertions.assertEquals(expected, ScopeRebuilder.rebuild(components, graph, regionBody));
    }

    @Test
    public void testRebuildPlacesRecursionBelowItsDependency() {
        BindingTable table = new BindingTable();
        Plan a = distinct(union(scan("t"), get(0)));
        Plan m = scan("u");
        Plan b = distinct(union(get(1), get(2)));
        table.register(id(0), 0).setValue(a);
        table.register(id(1), 0).setValue(m);
        table.register(id(2), 0).setValue(b);
        Plan regionBody = union(get(0), get(2));
        ReferenceGraph graph = ReferenceGraphBuilder.build(table, regionBody);
        List<BindingComponent> components = new RecursionAnalyzer(graph, table).analyze();

        Plan expected = letRec(0, a, let(1, m, letRec(2, b, regionBody)));
        Assertions.assertEquals(expected, ScopeRebuilder.rebuild(components, graph, regionBody));
    }
}
