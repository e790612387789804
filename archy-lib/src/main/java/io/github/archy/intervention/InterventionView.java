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

package io.github.archy.intervention;

import io.github.archy.graph.Edge;
import io.github.archy.graph.Graph;

import java.util.*;

/**
 * The mutilated graph for a set of do-interventions: the source graph's nodes, and its edges
 * minus every edge into an intervened variable. Read-only. The edge set is copied at
 * construction, so later changes to the source graph are not reflected here.
 */
public final class InterventionView implements Graph {

    private final Graph originalGraph;
    private final Set<String> interventions;
    private final List<String> nodes;
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, Set<String>> parents = new HashMap<>();
    private final Map<String, Set<String>> children = new HashMap<>();

    InterventionView(Graph originalGraph, Collection<String> interventions) {
        this.originalGraph = originalGraph;
        this.interventions = Collections.unmodifiableSet(new LinkedHashSet<>(interventions));
        this.nodes = Collections.unmodifiableList(new ArrayList<>(originalGraph.getNodes()));

        for (String node : nodes) {
            parents.put(node, new LinkedHashSet<>());
            children.put(node, new LinkedHashSet<>());
        }

        for (Edge edge : originalGraph.getEdges()) {
            if (this.interventions.contains(edge.getChild())) continue;
            edges.add(edge);
            parents.get(edge.getChild()).add(edge.getParent());
            children.get(edge.getParent()).add(edge.getChild());
        }
    }

    public Graph getOriginalGraph() {
        return originalGraph;
    }

    /**
     * @return the intervened variable names, including any that are not nodes of the graph.
     */
    public Set<String> getInterventions() {
        return interventions;
    }

    @Override
    public List<String> getNodes() {
        return nodes;
    }

    @Override
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    @Override
    public Set<String> getParents(String node) {
        Set<String> set = parents.get(node);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    @Override
    public Set<String> getChildren(String node) {
        Set<String> set = children.get(node);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    @Override
    public boolean containsNode(String node) {
        return parents.containsKey(node);
    }

    @Override
    public boolean containsEdge(String parent, String child) {
        return getChildren(parent).contains(child);
    }

    @Override
    public String toString() {
        List<String> sorted = new ArrayList<>(interventions);
        Collections.sort(sorted);
        return "InterventionView(interventions=" + sorted + ")";
    }
}
