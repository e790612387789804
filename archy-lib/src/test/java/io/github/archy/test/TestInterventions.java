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
import io.github.archy.graph.Edge;
import io.github.archy.intervention.Intervention;
import io.github.archy.intervention.InterventionView;
import io.github.archy.intervention.Interventions;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

/**
 * Tests graph surgery for the do-operator.
 */
public class TestInterventions {

    private CausalGraph chain() {
        return new CausalGraph(Arrays.asList(new Edge("X", "Y"), new Edge("Y", "Z")));
    }

    @Test
    public void testInterventionCutsIncomingEdges() {
        CausalGraph graph = chain();
        InterventionView view = Interventions.applyIntervention(graph, "Y");

        assertTrue(view.getParents("Y").isEmpty());
        assertEquals(Collections.singletonList(new Edge("Y", "Z")), view.getEdges());
        assertEquals(Collections.singleton("Z"), view.getChildren("Y"));
        assertTrue(view.getChildren("X").isEmpty());
        assertEquals(graph.getNodes(), view.getNodes());
    }

    @Test
    public void testSourceGraphUnchanged() {
        CausalGraph graph = chain();
        Map<String, Object> before = graph.toDict();
        InterventionView view = Interventions.applyIntervention(graph, "Y", "Z");

        assertEquals(before, graph.toDict());
        assertSame(graph, view.getOriginalGraph());
    }

    @Test
    public void testEveryNodeHasNoParentsAfterIntervention() {
        CausalGraph graph = new CausalGraph(Arrays.asList(
                new Edge("U", "X"), new Edge("U", "Y"), new Edge("X", "Y"), new Edge("W", "X")));

        for (String node : graph.getNodes()) {
            assertTrue(Interventions.applyIntervention(graph, node).getParents(node).isEmpty());
        }
    }

    @Test
    public void testUnknownVariableIsNoOp() {
        CausalGraph graph = chain();
        InterventionView view = Interventions.applyIntervention(graph, "Q");

        assertEquals(graph.getEdges(), view.getEdges());
        assertEquals(graph.getNodes(), view.getNodes());
        assertFalse(view.containsNode("Q"));
        assertEquals(Collections.singleton("Q"), view.getInterventions());
    }

    @Test
    public void testInterveningOnAllNodesLeavesNoEdges() {
        CausalGraph graph = chain();
        InterventionView view = Interventions.applyIntervention(graph, graph.getNodes());

        assertTrue(view.getEdges().isEmpty());
        assertEquals(3, view.getNumNodes());
    }

    @Test
    public void testViewIsSnapshot() {
        CausalGraph graph = chain();
        InterventionView view = Interventions.applyIntervention(graph, "Z");
        graph.addEdge("X", "W");

        assertFalse(view.containsNode("W"));
        assertFalse(view.containsEdge("X", "W"));
    }

    @Test
    public void testNestedViews() {
        CausalGraph graph = chain();
        InterventionView first = Interventions.applyIntervention(graph, "Y");
        InterventionView second = Interventions.applyIntervention(first, "Z");

        assertTrue(second.getEdges().isEmpty());
        assertTrue(first.containsEdge("Y", "Z"));
    }

    @Test
    public void testInterventionValues() {
        List<Intervention> interventions = Arrays.asList(new Intervention("X", 2.0), new Intervention("Z"));

        assertEquals("do(X=2.0)", interventions.get(0).toString());
        assertEquals("do(Z)", interventions.get(1).toString());

        InterventionView view = Interventions.applyInterventions(chain(), interventions);
        assertEquals(new LinkedHashSet<>(Arrays.asList("X", "Z")), view.getInterventions());
        assertEquals("InterventionView(interventions=[X, Z])", view.toString());
        assertTrue(view.getEdges().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testValuesRequireValue() {
        Interventions.values(Collections.singletonList(new Intervention("X")));
    }
}
