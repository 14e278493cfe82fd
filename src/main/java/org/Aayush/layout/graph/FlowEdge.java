package org.Aayush.layout.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable directed edge of a {@link FlowGraph}.
 *
 * <p>{@code attributes} is an opaque pass-through bag (coloring keys and the like); no
 * layout stage reads it. Edge ids are assigned by the owning graph and stay stable for
 * the lifetime of the edge, including removal and later restoration.</p>
 *
 * @param id graph-assigned edge id (insertion order).
 * @param source source node id.
 * @param target target node id.
 * @param value flow magnitude.
 * @param attributes optional extra attributes, never {@code null}.
 * @param backward whether the edge was restored after cycle removal.
 * @param dummyChainSegment whether the edge was synthesized to route through dummy nodes.
 */
public record FlowEdge(
        int id,
        String source,
        String target,
        double value,
        Map<String, Object> attributes,
        boolean backward,
        boolean dummyChainSegment
) {
    public FlowEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Returns a copy of this edge with the backward flag set as requested.
     */
    public FlowEdge withBackward(boolean backward) {
        return new FlowEdge(id, source, target, value, attributes, backward, dummyChainSegment);
    }

    /**
     * Returns whether source and target are the same node.
     */
    public boolean isSelfLoop() {
        return source.equals(target);
    }
}
