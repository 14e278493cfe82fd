package org.Aayush.layout.position;

import org.Aayush.layout.graph.LayoutWarning;

import java.util.List;

/**
 * Result of a vertical positioning run.
 *
 * @param requested strategy asked for.
 * @param effective strategy whose positions ended up in the graph.
 * @param warnings non-fatal diagnostics (disconnected layers, solver fallback).
 */
public record PositioningOutcome(VerticalPositioning requested, VerticalPositioning effective, List<LayoutWarning> warnings) {

    public PositioningOutcome {
        warnings = List.copyOf(warnings);
    }

    /**
     * Returns whether the solver failed and heuristic positions were used instead.
     */
    public boolean degraded() {
        return requested != effective;
    }
}
