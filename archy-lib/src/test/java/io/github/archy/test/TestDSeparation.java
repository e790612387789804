///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 2026 by the Archy contributors.                             //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package io.github.archy.test;

import io.github.archy.graph.CausalGraph;
import io.github.archy.graph.DSeparation;
import io.github.archy.graph.Edge;
import io.github.archy.graph.GraphUtils;
import io.github.archy.search.IndTestDSep;
import io.github.archy.search.IndependenceTest;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

/**
 * Tests d-separation on the chain, fork and collider, plus the boundary cases.
 */
public class TestDSeparation {

    private static CausalGraph graph(String... pairs) {
        List<Edge> edges = new ArrayList<>();

        for (int i = 0; i < pairs.length; i += 2) {
            edges.add(new Edge(pairs[i], pairs[i + 1]));
        }

        return new CausalGraph(edges);
    }

    private static Set<String> set(String... names) {
        return new LinkedHashSet<>(Arrays.asList(names));
    }

    @Test
    public void testChain() {
        CausalGraph graph = graph("A", "B", "B", "C");

        assertFalse(graph.isDSeparated(set("A"), set("C"), set()));
        assertTrue(graph.isDSeparated(set("A"), set("C"), set("B")));
    }

    @Test
    public void testCollider() {
        CausalGraph graph = graph("A", "C", "B", "C");

        assertTrue(graph.isDSeparated(set("A"), set("B"), set()));
        assertFalse(graph.isDSeparated(set("A"), set("B"), set("C")));
    }

    @Test
    public void testConditioningOnColliderDescendant() {
        CausalGraph graph = graph("A", "C", "B", "C", "C", "D");

        assertTrue(graph.isDSeparated(set("A"), set("B"), set()));
        assertFalse(graph.isDSeparated(set("A"), set("B"), set("D")));
    }

    @Test
    public void testConfounder() {
        CausalGraph graph = graph("U", "A", "U", "B");

        assertFalse(graph.isDSeparated(set("A"), set("B"), set()));
        assertTrue(graph.isDSeparated(set("A"), set("B"), set("U")));
    }

    @Test
    public void testMBias() {
        CausalGraph graph = graph("U1", "X", "U1", "M", "U2", "M", "U2", "Y");

        assertTrue(graph.isDSeparated(set("X"), set("Y"), set()));
        assertFalse(graph.isDSeparated(set("X"), set("Y"), set("M")));
        assertTrue(graph.isDSeparated(set("X"), set("Y"), set("M", "U1")));
    }

    @Test
    public void testEmptySetsAreSeparated() {
        CausalGraph graph = graph("A", "B");

        assertTrue(graph.isDSeparated(set(), set("B"), set()));
        assertTrue(graph.isDSeparated(set("A"), set(), set()));
    }

    @Test
    public void testUnknownNodesAreIsolated() {
        CausalGraph graph = graph("A", "B");

        assertTrue(graph.isDSeparated(set("A"), set("Q"), set()));
        assertTrue(graph.isDSeparated(set("Q"), set("R"), set("S")));
    }

    @Test
    public void testOverlappingSets() {
        CausalGraph graph = graph("A", "B");

        assertFalse(graph.isDSeparated(set("A"), set("A"), set()));
        assertTrue(graph.isDSeparated(set("A"), set("B"), set("A")));
    }

    @Test
    public void testNodesOutsideAncestralSetIgnored() {
        // A and B share only a descendant that is not conditioned on.
        CausalGraph graph = graph("A", "C", "B", "C", "C", "D", "E", "D");

        assertTrue(graph.isDSeparated(set("A"), set("B"), set("E")));
    }

    @Test
    public void testSymmetry() {
        CausalGraph graph = graph("A", "B", "A", "C", "B", "D", "C", "D", "D", "E", "F", "C");
        List<String> nodes = graph.getNodes();

        for (String x : nodes) {
            for (String y : nodes) {
                if (x.equals(y)) continue;

                for (String z : nodes) {
                    assertEquals(graph.isDSeparated(set(x), set(y), set(z)),
                            graph.isDSeparated(set(y), set(x), set(z)));
                }

                assertEquals(graph.isDSeparated(set(x), set(y), set()),
                        graph.isDSeparated(set(y), set(x), set()));
            }
        }
    }

    @Test
    public void testMoralizeMarriesParents() {
        CausalGraph graph = graph("A", "C", "B", "C");
        Map<String, Set<String>> moral = GraphUtils.moralize(graph, set("A", "B", "C"));

        assertTrue(moral.get("A").contains("B"));
        assertTrue(moral.get("B").contains("A"));
        assertEquals(set("A", "B"), moral.get("C"));

        Map<String, Set<String>> withoutChild = GraphUtils.moralize(graph, set("A", "B"));
        assertTrue(withoutChild.get("A").isEmpty());
    }

    @Test
    public void testIndTestDSep() {
        CausalGraph graph = graph("A", "B", "B", "C");
        IndependenceTest test = new IndTestDSep(graph);

        assertTrue(test.isIndependent("A", "C", set("B")));
        assertTrue(test.isDependent(set("A"), set("C"), set()));
        assertEquals(graph.getNodes(), test.getVariables());
        assertEquals(DSeparation.isDSeparated(graph, set("A"), set("C"), set()),
                test.isIndependent(set("A"), set("C"), set()));
    }
}
