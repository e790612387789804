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

import java.util.*;

/**
 * Basic graph algorithms shared by the graph classes and the search engines: ancestor and
 * descendant closure, moralization, undirected path enumeration and path blocking.
 * <p>
 * All methods are read-only over the graph passed in. Unknown nodes are treated as isolated.
 */
public final class GraphUtils {

    private GraphUtils() {
    }

    //==============================CLOSURES==============================//

    /**
     * @return every node from which <code>node</code> can be reached by a directed path, not including
     * <code>node</code> itself.
     */
    public static Set<String> getAncestors(Graph graph, String node) {
        Set<String> ancestors = closure(graph, Collections.singleton(node), true);
        ancestors.remove(node);
        return ancestors;
    }

    /**
     * @return every node reachable from <code>node</code> by a directed path, not including <code>node</code>
     * itself.
     */
    public static Set<String> getDescendants(Graph graph, String node) {
        Set<String> descendants = closure(graph, Collections.singleton(node), false);
        descendants.remove(node);
        return descendants;
    }

    /**
     * @return the given nodes together with all of their ancestors. Nodes not in the graph are kept
     * (as isolated nodes).
     */
    public static Set<String> getAncestralSet(Graph graph, Collection<String> nodes) {
        return closure(graph, nodes, true);
    }

    /**
     * @return true iff there is a directed path from <code>from</code> to <code>to</code> of length at least
     * one.
     */
    public static boolean existsDirectedPath(Graph graph, String from, String to) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(from);

        while (!stack.isEmpty()) {
            String current = stack.pop();

            for (String child : graph.getChildren(current)) {
                if (child.equals(to)) {
                    return true;
                }

                if (visited.add(child)) {
                    stack.push(child);
                }
            }
        }

        return false;
    }

    private static Set<String> closure(Graph graph, Collection<String> start, boolean upward) {
        Set<String> reached = new LinkedHashSet<>(start);
        Deque<String> queue = new ArrayDeque<>(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            Set<String> next = upward ? graph.getParents(current) : graph.getChildren(current);

            for (String node : next) {
                if (reached.add(node)) {
                    queue.add(node);
                }
            }
        }

        return reached;
    }

    //==============================MORALIZATION==========================//

    /**
     * Builds the moral graph of the subgraph induced by <code>nodes</code>: each directed edge inside the
     * set becomes an undirected one, and every pair of parents sharing a child inside the set is joined.
     *
     * @param nodes the node set to induce on; should be ancestrally closed for d-separation.
     * @return undirected adjacency, with an entry (possibly empty) for every node in the set.
     */
    public static Map<String, Set<String>> moralize(Graph graph, Set<String> nodes) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();

        for (String node : nodes) {
            adjacency.put(node, new LinkedHashSet<>());
        }

        for (String child : nodes) {
            List<String> parents = new ArrayList<>();

            for (String parent : graph.getParents(child)) {
                if (nodes.contains(parent)) {
                    parents.add(parent);
                }
            }

            for (String parent : parents) {
                connect(adjacency, parent, child);
            }

            for (int i = 0; i < parents.size(); i++) {
                for (int j = i + 1; j < parents.size(); j++) {
                    connect(adjacency, parents.get(i), parents.get(j));
                }
            }
        }

        return adjacency;
    }

    private static void connect(Map<String, Set<String>> adjacency, String a, String b) {
        adjacency.get(a).add(b);
        adjacency.get(b).add(a);
    }

    //==============================PATHS=================================//

    /**
     * @return parents and children of the node, parents first.
     */
    public static Set<String> getAdjacentNodes(Graph graph, String node) {
        Set<String> adjacent = new LinkedHashSet<>(graph.getParents(node));
        adjacent.addAll(graph.getChildren(node));
        return adjacent;
    }

    /**
     * Enumerates the simple paths between two nodes in the skeleton of the graph, ignoring edge
     * direction.
     *
     * @param maxLength maximum number of edges on a path, or -1 for no bound.
     * @return each path as a node list from <code>from</code> to <code>to</code>; empty if either node is
     * unknown or the two are the same node.
     */
    public static List<List<String>> allUndirectedPaths(Graph graph, String from, String to, int maxLength) {
        List<List<String>> paths = new ArrayList<>();

        if (!graph.containsNode(from) || !graph.containsNode(to) || from.equals(to)) {
            return paths;
        }

        LinkedList<String> path = new LinkedList<>();
        path.add(from);
        collectPaths(graph, to, maxLength, path, new HashSet<>(path), paths);
        return paths;
    }

    private static void collectPaths(Graph graph, String to, int maxLength, LinkedList<String> path,
                                     Set<String> onPath, List<List<String>> paths) {
        if (maxLength != -1 && path.size() > maxLength) {
            return;
        }

        for (String next : getAdjacentNodes(graph, path.getLast())) {
            if (onPath.contains(next)) continue;

            if (next.equals(to)) {
                List<String> found = new ArrayList<>(path);
                found.add(next);
                paths.add(found);
                continue;
            }

            path.addLast(next);
            onPath.add(next);
            collectPaths(graph, to, maxLength, path, onPath, paths);
            onPath.remove(next);
            path.removeLast();
        }
    }

    /**
     * Finds the backdoor paths from treatment to outcome: simple paths in the skeleton whose first edge
     * points into the treatment.
     *
     * @param maxLength maximum number of edges on a path, or -1 for no bound.
     */
    public static List<List<String>> getBackdoorPaths(Graph graph, String treatment, String outcome, int maxLength) {
        List<List<String>> backdoor = new ArrayList<>();
        Set<String> parents = graph.getParents(treatment);

        for (List<String> path : allUndirectedPaths(graph, treatment, outcome, maxLength)) {
            if (parents.contains(path.get(1))) {
                backdoor.add(path);
            }
        }

        return backdoor;
    }

    /**
     * @return a copy of the graph without the edges out of the given node, the graph in which every
     * path from that node to another is a backdoor path.
     */
    public static CausalGraph removeOutgoingEdges(Graph graph, String node) {
        CausalGraph result = new CausalGraph();

        for (String n : graph.getNodes()) {
            result.addNode(n);
        }

        for (Edge edge : graph.getEdges()) {
            if (!edge.getParent().equals(node)) {
                result.addEdge(edge.getParent(), edge.getChild());
            }
        }

        return result;
    }

    /**
     * @return true iff the node is a collider on the path at the given interior position, that is, both
     * of its neighbors on the path point into it.
     */
    public static boolean isCollider(Graph graph, List<String> path, int index) {
        if (index <= 0 || index >= path.size() - 1) {
            return false;
        }

        Set<String> parents = graph.getParents(path.get(index));
        return parents.contains(path.get(index - 1)) && parents.contains(path.get(index + 1));
    }

    /**
     * Standard path blocking. A path is blocked by Z iff some interior node is a non-collider in Z, or is
     * a collider that is neither in Z nor has a descendant in Z.
     */
    public static boolean isBlocked(Graph graph, List<String> path, Set<String> z) {
        for (int i = 1; i < path.size() - 1; i++) {
            String node = path.get(i);

            if (isCollider(graph, path, i)) {
                if (!z.contains(node) && Collections.disjoint(getDescendants(graph, node), z)) {
                    return true;
                }
            } else if (z.contains(node)) {
                return true;
            }
        }

        return false;
    }

    //==============================ORDERING & SERIALIZATION==============//

    /**
     * @return the nodes in an order where every parent precedes its children. Ties are broken by
     * insertion order, so the result is deterministic.
     */
    public static List<String> getTopologicalOrder(Graph graph) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();

        for (String node : graph.getNodes()) {
            inDegree.put(node, graph.getParents(node).size());
        }

        List<String> order = new ArrayList<>();
        Deque<String> ready = new ArrayDeque<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) ready.add(entry.getKey());
        }

        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);

            for (String child : graph.getChildren(node)) {
                int remaining = inDegree.get(child) - 1;
                inDegree.put(child, remaining);
                if (remaining == 0) ready.add(child);
            }
        }

        return order;
    }

    /**
     * @return <code>{nodes: [..], edges: [[parent, child], ..]}</code> for any graph view.
     */
    public static Map<String, Object> toDict(Graph graph) {
        List<List<String>> edges = new ArrayList<>();

        for (Edge edge : graph.getEdges()) {
            edges.add(edge.toList());
        }

        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("nodes", new ArrayList<>(graph.getNodes()));
        dict.put("edges", edges);
        return dict;
    }
}
