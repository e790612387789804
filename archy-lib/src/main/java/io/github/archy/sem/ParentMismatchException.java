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

package io.github.archy.sem;

import io.github.archy.graph.CausalModelException;

import java.util.Set;

/**
 * Thrown when a structural equation declares parents other than the ones the graph gives its
 * variable.
 */
public class ParentMismatchException extends CausalModelException {

    private final String variable;
    private final Set<String> declaredParents;
    private final Set<String> graphParents;

    public ParentMismatchException(String variable, Set<String> declaredParents, Set<String> graphParents) {
        super("Equation parents " + declaredParents + " don't match graph parents " + graphParents
                + " for variable " + variable);
        this.variable = variable;
        this.declaredParents = declaredParents;
        this.graphParents = graphParents;
    }

    public String getVariable() {
        return variable;
    }

    public Set<String> getDeclaredParents() {
        return declaredParents;
    }

    public Set<String> getGraphParents() {
        return graphParents;
    }
}
