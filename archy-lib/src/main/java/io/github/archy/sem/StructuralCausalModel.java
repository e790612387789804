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

import io.github.archy.graph.CausalGraph;
import io.github.archy.intervention.Intervention;
import io.github.archy.intervention.Interventions;
import io.github.archy.util.Parameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * A structural causal model: a causal graph plus at most one structural equation per variable.
 * Counterfactuals are computed by abduction, action and prediction.
 * <p>
 * Abduction here is deliberately partial. An error term is recovered as
 * u = observed(v) - f(observed parents, 0) only when v has an equation and v and all of its parents
 * are observed, which is exact for additive errors. Every other error term takes the
 * <code>defaultErrorTerm</code> parameter (0 unless configured).
 * <p>
 * Prediction evaluates the query's equation on the working values of its parents, the evidence
 * overlaid with the intervention, and does not recompute the parents. An observed mediator keeps its
 * observed value; an unobserved parent takes <code>missingValue</code>.
 */
public class StructuralCausalModel {

    private static final Logger LOGGER = LogManager.getLogger(StructuralCausalModel.class);

    private final CausalGraph graph;
    private final Map<String, StructuralEquation> equations = new LinkedHashMap<>();
    private final double defaultErrorTerm;
    private final double missingValue;
    private boolean verbose;

    public StructuralCausalModel(CausalGraph graph) {
        this(graph, new Parameters());
    }

    public StructuralCausalModel(CausalGraph graph, Parameters parameters) {
        if (graph == null) {
            throw new NullPointerException("Graph is null.");
        }

        this.graph = graph;
        this.defaultErrorTerm = parameters.getDouble(Parameters.DEFAULT_ERROR_TERM);
        this.missingValue = parameters.getDouble(Parameters.MISSING_VALUE);
        this.verbose = parameters.getBoolean(Parameters.VERBOSE);
    }

    /**
     * Registers an equation, replacing any earlier one for the same variable.
     *
     * @throws ParentMismatchException if the declared parents, as a set, differ from the variable's
     *                                 parents in the graph.
     */
    public void addEquation(StructuralEquation equation) {
        Set<String> declared = new LinkedHashSet<>(equation.getParents());
        Set<String> actual = graph.getParents(equation.getVariable());

        if (!declared.equals(actual)) {
            LOGGER.debug("Rejected equation for {}: declared {}, graph {}", equation.getVariable(), declared, actual);
            throw new ParentMismatchException(equation.getVariable(), declared, actual);
        }

        equations.put(equation.getVariable(), equation);
    }

    /**
     * What would <code>queryVariable</code> have been had the intervention held, given what was observed?
     *
     * @param intervention     variable to forced value; wins over the evidence on shared keys.
     * @param factualEvidence  observed values in the factual world.
     * @param queryVariable    the variable to predict.
     * @return the counterfactual value; <code>missingValue</code> for a variable the model knows
     * nothing about.
     */
    public double computeCounterfactual(Map<String, Double> intervention, Map<String, Double> factualEvidence,
                                        String queryVariable) {
        Map<String, Double> forced = present(intervention);
        Map<String, Double> errors = abduceErrors(factualEvidence);

        Map<String, Double> working = present(factualEvidence);
        working.putAll(forced);

        double value = predict(queryVariable, forced, working, errors);

        if (verbose) {
            LOGGER.debug("{} under {} given {} = {}", queryVariable, intervention, factualEvidence, value);
        }

        return value;
    }

    /**
     * @throws IllegalArgumentException if some intervention carries no value.
     */
    public double computeCounterfactual(List<Intervention> interventions, Map<String, Double> factualEvidence,
                                        String queryVariable) {
        return computeCounterfactual(Interventions.values(interventions), factualEvidence, queryVariable);
    }

    /**
     * The abduction step: one error term per graph node and per equation variable.
     */
    public Map<String, Double> abduceErrors(Map<String, Double> evidence) {
        Map<String, Double> observed = present(evidence);
        Set<String> variables = new LinkedHashSet<>(graph.getNodes());
        variables.addAll(equations.keySet());

        Map<String, Double> errors = new LinkedHashMap<>();

        for (String variable : variables) {
            errors.put(variable, abduceError(variable, observed));
        }

        if (verbose) {
            LOGGER.debug("Abduced error terms {}", errors);
        }

        return errors;
    }

    private double abduceError(String variable, Map<String, Double> evidence) {
        StructuralEquation equation = equations.get(variable);

        if (equation == null || !evidence.containsKey(variable)
                || !evidence.keySet().containsAll(equation.getParents())) {
            return defaultErrorTerm;
        }

        return evidence.get(variable) - equation.evaluate(evidence, 0.0, missingValue);
    }

    /**
     * An intervened variable keeps its forced value. Otherwise a variable with an equation is evaluated
     * once, on its parents' working values and its abduced error; one without an equation resolves
     * to its working value, else its abduced error.
     */
    private double predict(String variable, Map<String, Double> intervention, Map<String, Double> working,
                           Map<String, Double> errors) {
        if (intervention.containsKey(variable)) {
            return intervention.get(variable);
        }

        StructuralEquation equation = equations.get(variable);

        if (equation == null) {
            Double observed = working.get(variable);
            Double error = errors.get(variable);
            return observed != null ? observed : error != null ? error : missingValue;
        }

        return equation.evaluate(working, errors.getOrDefault(variable, defaultErrorTerm), missingValue);
    }

    // Null values count as unobserved.
    private static Map<String, Double> present(Map<String, Double> values) {
        Map<String, Double> present = new HashMap<>();

        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getValue() != null) {
                present.put(entry.getKey(), entry.getValue());
            }
        }

        return present;
    }

    public CausalGraph getGraph() {
        return graph;
    }

    public StructuralEquation getEquation(String variable) {
        return equations.get(variable);
    }

    public Map<String, StructuralEquation> getEquations() {
        return Collections.unmodifiableMap(equations);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public String toString() {
        return "StructuralCausalModel(graph=" + graph + ", equations=" + equations.size() + ")";
    }
}
