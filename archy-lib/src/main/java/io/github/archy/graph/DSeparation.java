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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Decides d-separation by moralization (Lauritzen et al. 1990). X and Y are d-separated given Z
 * iff they are disconnected, once Z is deleted, in the moral graph of the ancestral set of
 * X ∪ Y ∪ Z.
 * <p>
 * Nodes not in the graph are treated as isolated. The sets may overlap; a node in Z is removed
 * before the connectivity check, and a node in both X and Y that is not in Z connects them.
 */
public final class DSeparation {

    private static final Logger LOGGER = LogManager.getLogger(DSeparation.class);

    private DSeparation() {
    }

    /**
     * @return true iff x and y are d-separated given z in the graph; true if x or y is empty.
     */
    public static boolean isDSeparated(Graph graph, Collection<String> x, Collection<String> y,
                                       Collection<String> z) {
        return isDSeparated(graph, x, y, z, false);
    }

    public static boolean isDSeparated(Graph graph, Collection<String> x, Collection<String> y,
                                       Collection<String> z, boolean verbose) {
        if (x.isEmpty() || y.isEmpty()) {
            return true;
        }

        Set<String> all = new LinkedHashSet<>(x);
        all.addAll(y);
        all.addAll(z);

        Set<String> ancestral = GraphUtils.getAncestralSet(graph, all);
        Map<String, Set<String>> moral = GraphUtils.moralize(graph, ancestral);

        if (verbose) {
            LOGGER.debug("Moral graph over {} ancestral nodes for {} _||_ {} | {}", ancestral.size(), x, y, z);
        }

        Set<String> blocked = new HashSet<>(z);
        Set<String> targets = new HashSet<>(y);
        targets.removeAll(blocked);

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();

        for (String node : x) {
            if (!blocked.contains(node) && visited.add(node)) {
                queue.add(node);
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();

            if (targets.contains(current)) {
                if (verbose) {
                    LOGGER.debug("Connected at {}", current);
                }

                return false;
            }

            for (String neighbor : moral.get(current)) {
                if (!blocked.contains(neighbor) && visited.add(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }

        return true;
    }
}
