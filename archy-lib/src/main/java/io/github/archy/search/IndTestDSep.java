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

package io.github.archy.search;

import io.github.archy.graph.DSeparation;
import io.github.archy.graph.Graph;

import java.util.List;
import java.util.Set;

/**
 * Checks independence facts by d-separation in a known graph, in place of a statistical test on
 * data. The graph may be any view, for instance a mutilated graph from an intervention.
 */
public final class IndTestDSep implements IndependenceTest {

    private final Graph graph;
    private boolean verbose = false;

    public IndTestDSep(Graph graph) {
        if (graph == null) {
            throw new NullPointerException("Graph is null.");
        }

        this.graph = graph;
    }

    @Override
    public boolean isIndependent(Set<String> x, Set<String> y, Set<String> z) {
        return DSeparation.isDSeparated(graph, x, y, z, verbose);
    }

    @Override
    public List<String> getVariables() {
        return graph.getNodes();
    }

    public Graph getGraph() {
        return graph;
    }

    @Override
    public boolean isVerbose() {
        return verbose;
    }

    @Override
    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public String toString() {
        return "D-separation";
    }
}
