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

import io.github.archy.graph.Graph;

import java.util.*;

/**
 * Graph surgery for the do-operator. Intervening on a variable cuts it off from its former
 * parents; nothing else changes. The source graph is never modified.
 */
public final class Interventions {

    private Interventions() {
    }

    /**
     * Intervening on names that are not in the graph is legal and changes nothing. Intervening on
     * every node gives an edgeless graph over the same nodes.
     */
    public static InterventionView applyIntervention(Graph graph, Collection<String> interventionSet) {
        return new InterventionView(graph, interventionSet);
    }

    public static InterventionView applyIntervention(Graph graph, String... variables) {
        return applyIntervention(graph, Arrays.asList(variables));
    }

    public static InterventionView applyInterventions(Graph graph, List<Intervention> interventions) {
        return applyIntervention(graph, variables(interventions));
    }

    public static Set<String> variables(List<Intervention> interventions) {
        Set<String> variables = new LinkedHashSet<>();

        for (Intervention intervention : interventions) {
            variables.add(intervention.getVariable());
        }

        return variables;
    }

    /**
     * @return variable to value for each intervention; a later intervention on the same variable wins.
     * @throws IllegalArgumentException if an intervention has no value.
     */
    public static Map<String, Double> values(List<Intervention> interventions) {
        Map<String, Double> values = new LinkedHashMap<>();

        for (Intervention intervention : interventions) {
            if (!intervention.hasValue()) {
                throw new IllegalArgumentException("Intervention has no value: " + intervention);
            }

            values.put(intervention.getVariable(), intervention.getValue());
        }

        return values;
    }
}
