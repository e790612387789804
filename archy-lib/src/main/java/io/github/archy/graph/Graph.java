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

import java.util.List;
import java.util.Set;

/**
 * Read-only view of a directed graph over named variables. Implemented by the mutable
 * {@link CausalGraph} and by derived views such as intervened graphs, so that the search
 * engines can run over either without caring which one they were handed.
 * <p>
 * Node and edge enumeration order is insertion order and is stable for the life of the view.
 */
public interface Graph {

    /**
     * @return the nodes of the graph, in insertion order.
     */
    List<String> getNodes();

    /**
     * @return the directed edges of the graph, in insertion order.
     */
    List<Edge> getEdges();

    /**
     * @return the direct predecessors of the given node; empty if the node is unknown or has none.
     */
    Set<String> getParents(String node);

    /**
     * @return the direct successors of the given node; empty if the node is unknown or has none.
     */
    Set<String> getChildren(String node);

    boolean containsNode(String node);

    boolean containsEdge(String parent, String child);

    default int getNumNodes() {
        return getNodes().size();
    }

    default int getNumEdges() {
        return getEdges().size();
    }
}
