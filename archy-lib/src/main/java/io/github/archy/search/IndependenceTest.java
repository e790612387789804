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

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Interface implemented by classes that decide conditional independence facts.
 */
public interface IndependenceTest {

    /**
     * @return true iff the variable sets x and y are independent conditional on z.
     */
    boolean isIndependent(Set<String> x, Set<String> y, Set<String> z);

    /**
     * @return true iff x _||_ y | z.
     */
    default boolean isIndependent(String x, String y, Set<String> z) {
        return isIndependent(Collections.singleton(x), Collections.singleton(y), z);
    }

    default boolean isDependent(Set<String> x, Set<String> y, Set<String> z) {
        return !isIndependent(x, y, z);
    }

    /**
     * @return the variables the test knows about.
     */
    List<String> getVariables();

    boolean isVerbose();

    void setVerbose(boolean verbose);
}
