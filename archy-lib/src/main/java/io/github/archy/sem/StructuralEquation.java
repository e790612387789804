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

import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A structural equation v = f(pa(v), u) for one variable. An equation without a function returns its
 * error term.
 */
public final class StructuralEquation {

    private final String variable;
    private final List<String> parents;
    private final StructuralFunction function;
    private final String errorDistribution;

    public StructuralEquation(String variable, List<String> parents, StructuralFunction function) {
        this(variable, parents, function, null);
    }

    /**
     * @param function          may be null, in which case the equation returns its error term.
     * @param errorDistribution descriptive label for the error term, e.g. "normal"; may be null.
     */
    public StructuralEquation(String variable, List<String> parents, StructuralFunction function,
                              String errorDistribution) {
        Validate.notBlank(variable, "Variable name may not be blank.");
        Validate.noNullElements(parents, "Parent names may not be null.");
        this.variable = variable;
        this.parents = Collections.unmodifiableList(new ArrayList<>(parents));
        this.function = function;
        this.errorDistribution = errorDistribution;
    }

    public double evaluate(double[] parentValues, double error) {
        if (parentValues.length != parents.size()) {
            throw new IllegalArgumentException("Expected " + parents.size() + " parent values for "
                    + variable + ", got " + parentValues.length);
        }

        return function == null ? error : function.evaluate(parentValues, error);
    }

    /**
     * Evaluates with parent values looked up by name; parents missing from the map take
     * <code>missingValue</code>.
     */
    public double evaluate(Map<String, Double> values, double error, double missingValue) {
        double[] parentValues = new double[parents.size()];

        for (int i = 0; i < parents.size(); i++) {
            Double value = values.get(parents.get(i));
            parentValues[i] = value == null ? missingValue : value;
        }

        return evaluate(parentValues, error);
    }

    public String getVariable() {
        return variable;
    }

    public List<String> getParents() {
        return parents;
    }

    public StructuralFunction getFunction() {
        return function;
    }

    public boolean hasFunction() {
        return function != null;
    }

    public String getErrorDistribution() {
        return errorDistribution;
    }

    @Override
    public String toString() {
        return variable + " := f(" + String.join(", ", parents) + (parents.isEmpty() ? "" : ", ")
                + "U_" + variable + ")";
    }
}
