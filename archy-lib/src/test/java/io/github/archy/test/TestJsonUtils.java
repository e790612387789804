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
import io.github.archy.graph.CycleException;
import io.github.archy.graph.Edge;
import io.github.archy.intervention.Interventions;
import io.github.archy.util.JsonUtils;
import org.json.JSONObject;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Tests the JSON form used to pass graphs between processes.
 */
public class TestJsonUtils {

    @Test
    public void testRoundTrip() {
        CausalGraph graph = new CausalGraph(Arrays.asList(new Edge("Age", "Treatment"), new Edge("Age", "Outcome")));
        graph.addNode("Isolated");

        String json = JsonUtils.graphToJson(graph);
        CausalGraph parsed = JsonUtils.parseJSONObjectToCausalGraph(json);

        assertEquals(graph, parsed);
        assertEquals(graph.toDict(), parsed.toDict());
    }

    @Test
    public void testWrittenForm() {
        CausalGraph graph = new CausalGraph(Collections.singletonList(new Edge("X", "Y")));

        assertEquals("{\"nodes\":[\"X\",\"Y\"],\"edges\":[[\"X\",\"Y\"]]}", JsonUtils.graphToJson(graph));
    }

    @Test
    public void testInterventionViewSerializes() {
        CausalGraph graph = new CausalGraph(Arrays.asList(new Edge("X", "Y"), new Edge("Y", "Z")));
        String json = JsonUtils.graphToJson(Interventions.applyIntervention(graph, "Y"));

        assertEquals("{\"nodes\":[\"X\",\"Y\",\"Z\"],\"edges\":[[\"Y\",\"Z\"]]}", json);
    }

    @Test
    public void testWrappedGraph() {
        String json = "{\"graph\": {\"nodes\": [\"A\"], \"edges\": [[\"B\", \"C\"]]}}";
        CausalGraph graph = JsonUtils.parseJSONObjectToCausalGraph(json);

        assertEquals(Arrays.asList("A", "B", "C"), graph.getNodes());
        assertTrue(graph.containsEdge("B", "C"));
    }

    @Test
    public void testMissingSectionsAreEmpty() {
        CausalGraph graph = JsonUtils.parseJSONObjectToCausalGraph(new JSONObject());

        assertTrue(graph.getNodes().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        JsonUtils.parseJSONObjectToCausalGraph("{\"edges\": [[\"A\"");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEdgeMustBePair() {
        JsonUtils.parseJSONObjectToCausalGraph("{\"edges\": [[\"A\", \"B\", \"C\"]]}");
    }

    @Test(expected = CycleException.class)
    public void testCyclicEdges() {
        JsonUtils.parseJSONObjectToCausalGraph("{\"edges\": [[\"A\", \"B\"], [\"B\", \"A\"]]}");
    }
}
