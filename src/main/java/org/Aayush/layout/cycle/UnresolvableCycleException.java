package org.Aayush.layout.cycle;

import org.Aayush.layout.graph.LayoutException;

/**
 * Raised when cycle removal exceeds its iteration bound. Indicates a defect, not bad input.
 */
public final class UnresolvableCycleException extends LayoutException {
    public static final String REASON_SAFETY_BOUND_EXCEEDED = "CYCLE_SAFETY_BOUND_EXCEEDED";

    public UnresolvableCycleException(String message) {
        super(REASON_SAFETY_BOUND_EXCEEDED, message);
    }
}
