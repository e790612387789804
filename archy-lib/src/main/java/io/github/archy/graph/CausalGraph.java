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

package io.github.archy.graph;

import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * A causal directed acyclic graph over named variables.
 * <p>
 * The graph is acyclic at all times. An edge is only inserted after checking, on the graph as it
 * stands, that the child does not already reach the parent; a rejected edge leaves nodes and edges
 * untouched. Adding an edge adds its endpoints as nodes if they are not there yet. Isolated nodes
 * are allowed.
 * <p>
 * Nodes and edges enumerate in insertion order. Instances are not safe for concurrent mutation;
 * take a {@link #copy()} to hand a snapshot to other threads.
 */
public final class CausalGraph implements Graph {

    private static final Logger LOGGER = LogManager.getLogger(CausalGraph.class);

    private final Set<String> nodes = new LinkedHashSet<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Map<String, Set<String>> parents = new HashMap<>();
    private final Map<String, Set<String>> children = new HashMap<>();

    //================================CONSTRUCTORS==========================//

    /**
     * Constructs an empty graph.
     */
    public CausalGraph() {
    }

    /**
     * Constructs a graph from an edge list, adding edges in order.
     *
     * @throws CycleException at the first edge that would close a cycle.
     */
    public CausalGraph(Collection<Edge> edges) {
        for (Edge edge : edges) {
            addEdge(edge.getParent(), edge.getChild());
        }
    }

    /**
     * Rebuilds a graph from the map produced by {@link #toDict()}. Nodes are added first, in listed
     * order, so isolated nodes survive; edge endpoints missing from the node list are added
     * implicitly.
     *
     * @throws IllegalArgumentException if nodes or edges is not a list, or an edge entry is not a
     *                                  [parent, child] pair.
     * @throws CycleException           if the edges contain a cycle.
     */
    public static CausalGraph fromDict(Map<String, ?> dict) {
        CausalGraph graph = new CausalGraph();
        Collection<?> nodes = section(dict, "nodes");
        Collection<?> edges = section(dict, "edges");

        for (Object node : nodes) {
            graph.addNode(String.valueOf(node));
        }

        for (Object edge : edges) {
            if (!(edge instanceof List) || ((List<?>) edge).size() != 2) {
                throw new IllegalArgumentException("Edge must be a [parent, child] pair: " + edge);
            }

            List<?> pair = (List<?>) edge;
            graph.addEdge(String.valueOf(pair.get(0)), String.valueOf(pair.get(1)));
        }

        return graph;
    }

    private static Collection<?> section(Map<String, ?> dict, String key) {
        Object value = dict.get(key);

        if (value == null) {
            return Collections.emptyList();
        }

        if (!(value instanceof Collection)) {
            throw new IllegalArgumentException("\"" + key + "\" must be a list: " + value);
        }

        return (Collection<?>) value;
    }

    /**
     * @return a deep copy sharing no state with this graph.
     */
    public CausalGraph copy() {
        CausalGraph copy = new CausalGraph();
        copy.nodes.addAll(nodes);
        copy.edges.addAll(edges);

        for (Map.Entry<String, Set<String>> entry : parents.entrySet()) {
            copy.parents.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }

        for (Map.Entry<String, Set<String>> entry : children.entrySet()) {
            copy.children.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }

        return copy;
    }

    //================================MUTATION==============================//

    /**
     * Adds an isolated node.
     *
     * @return true if the node was added, false if it was already there.
     */
    public boolean addNode(String node) {
        Validate.notBlank(node, "Node name may not be blank.");

        if (!nodes.add(node)) {
            return false;
        }

        parents.put(node, new LinkedHashSet<>());
        children.put(node, new LinkedHashSet<>());
        return true;
    }

    /**
     * Adds parent --> child, adding either endpoint as a node if absent.
     *
     * @return true if the edge was added, false if it was already there.
     * @throws CycleException if child is parent or child already reaches parent; the graph is unchanged.
     */
    public boolean addEdge(String parent, String child) {
        Validate.notBlank(parent, "Parent name may not be blank.");
        Validate.notBlank(child, "Child name may not be blank.");

        if (containsEdge(parent, child)) {
            return false;
        }

        if (parent.equals(child) || GraphUtils.existsDirectedPath(this, child, parent)) {
            LOGGER.debug("Rejected {} --> {}: would create a cycle", parent, child);
            throw new CycleException(parent, child);
        }

        addNode(parent);
        addNode(child);
        edges.add(new Edge(parent, child));
        parents.get(child).add(parent);
        children.get(parent).add(child);
        return true;
    }

    /**
     * Removes parent --> child. The endpoints stay in the graph.
     *
     * @throws EdgeNotFoundException if there is no such edge.
     */
    public void removeEdge(String parent, String child) {
        if (!containsEdge(parent, child)) {
            throw new EdgeNotFoundException(parent, child);
        }

        edges.remove(new Edge(parent, child));
        parents.get(child).remove(parent);
        children.get(parent).remove(child);
    }

    /**
     * Removes a node together with every edge into or out of it.
     *
     * @throws UnknownNodeException if the node is not in the graph.
     */
    public void removeNode(String node) {
        if (!containsNode(node)) {
            throw new UnknownNodeException(node);
        }

        for (String parent : new ArrayList<>(parents.get(node))) {
            removeEdge(parent, node);
        }

        for (String child : new ArrayList<>(children.get(node))) {
            removeEdge(node, child);
        }

        nodes.remove(node);
        parents.remove(node);
        children.remove(node);
    }

    //================================QUERIES===============================//

    @Override
    public List<String> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    @Override
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(new ArrayList<>(edges));
    }

    @Override
    public Set<String> getParents(String node) {
        Set<String> set = parents.get(node);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }

    @Override
    public Set<String> getChildren(String node) {
        Set<String> set = children.get(node);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }

    @Override
    public boolean containsNode(String node) {
        return nodes.contains(node);
    }

    @Override
    public boolean containsEdge(String parent, String child) {
        Set<String> set = children.get(parent);
        return set != null && set.contains(child);
    }

    public Set<String> getAncestors(String node) {
        return GraphUtils.getAncestors(this, node);
    }

    public Set<String> getDescendants(String node) {
        return GraphUtils.getDescendants(this, node);
    }

    public List<String> getTopologicalOrder() {
        return GraphUtils.getTopologicalOrder(this);
    }

    /**
     * @return true iff x and y are d-separated given z in this graph.
     * @see DSeparation
     */
    public boolean isDSeparated(Set<String> x, Set<String> y, Set<String> z) {
        return DSeparation.isDSeparated(this, x, y, z);
    }

    /**
     * @return all backdoor paths from treatment to outcome.
     * @see GraphUtils#getBackdoorPaths(Graph, String, String, int)
     */
    public List<List<String>> getBackdoorPaths(String treatment, String outcome) {
        return GraphUtils.getBackdoorPaths(this, treatment, outcome, -1);
    }

    /**
     * @return <code>{nodes: [..], edges: [[parent, child], ..]}</code>; the exact inverse of
     * {@link #fromDict(Map)}.
     */
    public Map<String, Object> toDict() {
        return GraphUtils.toDict(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CausalGraph)) return false;
        CausalGraph other = (CausalGraph) o;
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "CausalGraph(nodes=" + nodes.size() + ", edges=" + edges.size() + ")";
    }
}
