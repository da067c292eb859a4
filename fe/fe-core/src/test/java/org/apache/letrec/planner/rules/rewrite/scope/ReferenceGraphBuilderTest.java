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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ReferenceGraphBuilderTest {

    @Test
    public void testEdgesAreCollapsedAndExternalsKeptApart() {
        BindingTable table = new BindingTable();
        table.register(id(0), 0).setValue(union(get(1), get(1), get(0)));
        table.register(id(1), 0).setValue(union(scan("t"), get(7)));
        table.register(id(2), 0).setValue(scan("dead"));

        ReferenceGraph graph = ReferenceGraphBuilder.build(table, distinct(get(0)));

        Assertions.assertEquals(ImmutableList.of(id(0), id(1), id(2)), ImmutableList.copyOf(graph.getNodes()));
        Assertions.assertEquals(ImmutableSet.of(id(1), id(0)), graph.getReferences(id(0)));
        Assertions.assertEquals(2, graph.edgeCount());
        Assertions.assertTrue(graph.hasSelfLoop(id(0)));
        Assertions.assertFalse(graph.hasSelfLoop(id(1)));
        Assertions.assertTrue(graph.getReferences(id(1)).isEmpty());
        Assertions.assertEquals(ImmutableSet.of(id(7)), graph.getExternalReferences(id(1)));
        Assertions.assertEquals(ImmutableSet.of(id(0)), graph.getRootReferences());
        Assertions.assertEquals(ImmutableSet.of(id(0), id(1)), graph.reachableFromRoot());
    }

    @Test
    public void testIdsBoundInsideValueAreNotReferences() {
        BindingTable table = new BindingTable();
        table.register(id(0), 0).setValue(scan("t"));
        table.register(id(1), 0).setValue(letRec(5, union(get(5), get(0)), let(6, get(5), get(6))));

        ReferenceGraph graph = ReferenceGraphBuilder.build(table, get(1));

        Assertions.assertEquals(ImmutableSet.of(id(0)), graph.getReferences(id(1)));
        Assertions.assertTrue(graph.getExternalReferences(id(1)).isEmpty());
    }

    @Test
    public void testFreeReferencesInFirstUseOrder() {
        Assertions.assertEquals(ImmutableList.of(id(4), id(2)),
                ImmutableList.copyOf(FreeReferences.of(union(get(4), letRec(3, union(get(3), get(2)), get(4))))));
        Assertions.assertEquals(ImmutableSet.of(id(1)),
                FreeReferences.ofBindingValues(letRec(0, union(get(0), get(1)), get(0))));
        Assertions.assertEquals(ImmutableSet.of(id(0)),
                FreeReferences.ofBindingValues(let(0, union(get(0), scan("t")), get(0))));
    }
}
