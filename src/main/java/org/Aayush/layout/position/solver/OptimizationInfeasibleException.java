package org.Aayush.layout.position.solver;

import org.Aayush.layout.graph.LayoutException;

/**
 * The solver returned no feasible assignment.
 */
public final class OptimizationInfeasibleException extends LayoutException {
    public static final String REASON_INFEASIBLE = "OPTIMIZATION_INFEASIBLE";

    public OptimizationInfeasibleException(String message) {
        super(REASON_INFEASIBLE, message);
    }
}
