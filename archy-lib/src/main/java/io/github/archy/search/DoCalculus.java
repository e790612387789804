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
import io.github.archy.graph.GraphUtils;
import io.github.archy.intervention.Interventions;
import io.github.archy.util.Parameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * The three rules of Pearl's do-calculus. Each rule builds the mutilated graph it calls for and
 * asks whether (Y _||_ Z | X, W) holds there by d-separation:
 * <ul>
 * <li>Rule 1, insertion/deletion of observations: P(y | do(x), z, w) = P(y | do(x), w), tested in the
 * graph with X intervened.</li>
 * <li>Rule 2, action/observation exchange: P(y | do(x), do(z), w) = P(y | do(x), z, w), tested in the
 * graph with X intervened; edges into Z stay.</li>
 * <li>Rule 3, insertion/deletion of actions: P(y | do(x), do(z), w) = P(y | do(x), w), tested in the
 * graph with X and Z intervened.</li>
 * </ul>
 * A rule that cannot be checked, because a variable is not in the graph or Y, Z and the
 * conditioning set overlap, does not apply; no rule throws.
 * <p>
 * {@link #isIdentifiable(Set, Set, Set)} is a backdoor-criterion check only. It does not run the
 * ID algorithm and so answers false for effects that are identifiable by other means, such as the
 * front-door criterion.
 */
public class DoCalculus {

    private static final Logger LOGGER = LogManager.getLogger(DoCalculus.class);

    private final Graph graph;
    private final int maxPathLength;
    private boolean verbose;

    public DoCalculus(Graph graph) {
        this(graph, new Parameters());
    }

    public DoCalculus(Graph graph, Parameters parameters) {
        if (graph == null) {
            throw new NullPointerException("Graph is null.");
        }

        this.graph = graph;
        this.maxPathLength = parameters.getInt(Parameters.MAX_PATH_LENGTH);
        this.verbose = parameters.getBoolean(Parameters.VERBOSE);
    }

    //==============================RULES=================================//

    public boolean rule1(Set<String> y, Set<String> z, Set<String> w, Set<String> x) {
        return check(1, x, y, z, w, x);
    }

    public boolean rule2(Set<String> y, Set<String> z, Set<String> w, Set<String> x) {
        return check(2, x, y, z, w, x);
    }

    public boolean rule3(Set<String> y, Set<String> z, Set<String> w, Set<String> x) {
        Set<String> intervened = new LinkedHashSet<>(x);
        intervened.addAll(z);
        return check(3, intervened, y, z, w, x);
    }

    /**
     * Applies the rule with the given number.
     *
     * @throws IllegalArgumentException if the rule is not 1, 2 or 3.
     */
    public boolean applies(int rule, Set<String> y, Set<String> z, Set<String> w, Set<String> x) {
        switch (rule) {
            case 1:
                return rule1(y, z, w, x);
            case 2:
                return rule2(y, z, w, x);
            case 3:
                return rule3(y, z, w, x);
            default:
                throw new IllegalArgumentException("Not a do-calculus rule: " + rule);
        }
    }

    private boolean check(int rule, Set<String> intervened, Set<String> y, Set<String> z,
                          Set<String> w, Set<String> x) {
        Set<String> conditioning = new LinkedHashSet<>(w);
        conditioning.addAll(x);

        if (!allKnown(y) || !allKnown(z) || !allKnown(conditioning)) {
            if (verbose) LOGGER.debug("Rule {} does not apply: unknown variable", rule);
            return false;
        }

        if (!Collections.disjoint(y, z) || !Collections.disjoint(y, conditioning)
                || !Collections.disjoint(z, conditioning)) {
            if (verbose) LOGGER.debug("Rule {} does not apply: overlapping sets", rule);
            return false;
        }

        IndTestDSep test = new IndTestDSep(Interventions.applyIntervention(graph, intervened));
        test.setVerbose(verbose);
        boolean applies = test.isIndependent(y, z, conditioning);

        if (verbose) {
            LOGGER.debug("Rule {}: {} _||_ {} | {} after do({}): {}", rule, y, z, conditioning, intervened, applies);
        }

        return applies;
    }

    private boolean allKnown(Set<String> nodes) {
        for (String node : nodes) {
            if (!graph.containsNode(node)) {
                return false;
            }
        }

        return true;
    }

    //==============================BACKDOOR==============================//

    /**
     * @return the backdoor paths from treatment to outcome, each as a node list starting at the
     * treatment; empty if either is unknown. Paths longer than the <code>maxPathLength</code>
     * parameter are not reported.
     */
    public List<List<String>> getBackdoorPaths(String treatment, String outcome) {
        return GraphUtils.getBackdoorPaths(graph, treatment, outcome, maxPathLength);
    }

    /**
     * Conservative identifiability pre-check for P(y | do(x)) by the backdoor criterion: true iff, for
     * every x in X and y in Y, z contains no descendant of x and blocks every backdoor path from x to y.
     * The paths are not enumerated: x and y are tested for d-separation given z in the graph with the
     * edges out of x removed.
     * Empty X or Y is trivially identifiable; unknown variables are not.
     *
     * @param z the adjustment set; may be null for none.
     */
    public boolean isIdentifiable(Set<String> y, Set<String> x, Set<String> z) {
        Set<String> adjustment = z == null ? Collections.emptySet() : z;

        if (!allKnown(y) || !allKnown(x) || !allKnown(adjustment)) {
            return false;
        }

        for (String treatment : x) {
            if (!Collections.disjoint(GraphUtils.getDescendants(graph, treatment), adjustment)) {
                if (verbose) LOGGER.debug("{} contains a descendant of {}", adjustment, treatment);
                return false;
            }

            Graph backdoorGraph = GraphUtils.removeOutgoingEdges(graph, treatment);

            for (String outcome : y) {
                if (outcome.equals(treatment)) {
                    continue;
                }

                Set<String> conditioning = new HashSet<>(adjustment);
                conditioning.remove(treatment);
                conditioning.remove(outcome);

                if (!DSeparation.isDSeparated(backdoorGraph, Collections.singleton(treatment),
                        Collections.singleton(outcome), conditioning)) {
                    if (verbose) LOGGER.debug("A backdoor path from {} to {} is open given {}", treatment, outcome, adjustment);
                    return false;
                }
            }
        }

        return true;
    }

    public Graph getGraph() {
        return graph;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }
}
