package org.Aayush.layout.graph;

import java.util.Objects;

/**
 * Non-fatal layout diagnostic surfaced to the caller next to a best-effort layout.
 *
 * @param kind warning category.
 * @param subject node id, layer number or mode name the warning is about.
 * @param message human readable detail.
 */
public record LayoutWarning(Kind kind, String subject, String message) {

    public LayoutWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Warning categories.
     *
     * <p>{@code IMBALANCED_NODE}: inflow and outflow of a node differ beyond tolerance.</p>
     * <p>{@code DISCONNECTED_LAYER}: a layer has no incident edges and was centered, or
     * edgeless nodes of a linked layer were placed outside the positioning model.</p>
     * <p>{@code OPTIMIZATION_FALLBACK}: the solver failed and heuristic positions were used.</p>
     */
    public enum Kind {
        IMBALANCED_NODE,
        DISCONNECTED_LAYER,
        OPTIMIZATION_FALLBACK
    }
}
