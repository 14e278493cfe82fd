package org.Aayush.layout.position.solver;

import org.Aayush.layout.graph.LayoutException;

/**
 * The solver exhausted its time or iteration budget without a usable assignment.
 */
public final class OptimizationTimeoutException extends LayoutException {
    public static final String REASON_TIMEOUT = "OPTIMIZATION_TIMEOUT";

    public OptimizationTimeoutException(String message) {
        super(REASON_TIMEOUT, message);
    }
}
