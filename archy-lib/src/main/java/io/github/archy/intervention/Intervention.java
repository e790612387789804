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

import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * A do-intervention on one variable, optionally with the value it is set to. Without a value it
 * only names the variable for graph surgery.
 */
public final class Intervention {

    private final String variable;
    private final Double value;

    public Intervention(String variable) {
        this(variable, null);
    }

    public Intervention(String variable, Double value) {
        Validate.notBlank(variable, "Intervention variable may not be blank.");
        this.variable = variable;
        this.value = value;
    }

    public String getVariable() {
        return variable;
    }

    /**
     * @return the value the variable is fixed to, or null if none was given.
     */
    public Double getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Intervention)) return false;
        Intervention that = (Intervention) o;
        return variable.equals(that.variable) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value);
    }

    @Override
    public String toString() {
        return value == null ? "do(" + variable + ")" : "do(" + variable + "=" + value + ")";
    }
}
