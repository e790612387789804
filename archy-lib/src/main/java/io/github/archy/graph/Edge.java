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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A directed edge parent --> child. Immutable; equality is by endpoint names.
 */
public final class Edge {

    private final String parent;
    private final String child;

    public Edge(String parent, String child) {
        Validate.notBlank(parent, "Parent name may not be blank.");
        Validate.notBlank(child, "Child name may not be blank.");
        this.parent = parent;
        this.child = child;
    }

    public String getParent() {
        return parent;
    }

    public String getChild() {
        return child;
    }

    /**
     * @return the edge as a two-element [parent, child] list, the form used for serialization.
     */
    public List<String> toList() {
        return Arrays.asList(parent, child);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return parent.equals(edge.parent) && child.equals(edge.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, child);
    }

    @Override
    public String toString() {
        return parent + " --> " + child;
    }
}
