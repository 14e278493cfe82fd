package org.Aayush.layout.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.layout.crossing.CrossingReduction;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.LayoutWarning;
import org.Aayush.layout.layer.DummyChain;
import org.Aayush.layout.position.VerticalPositioning;

import java.util.List;

/**
 * Fully attributed layout handed to rendering.
 */
@Value
@Builder
public class LayoutResult {
    /** Laid-out copy of the input graph, backward edges restored. */
    FlowGraph graph;

    /** Edges removed to break cycles, in removal order, as restored (flagged backward). */
    @Singular
    List<FlowEdge> backwardEdges;

    @Singular
    List<DummyChain> dummyChains;

    int maxLayer;

    /** Sweep history; its crossing count predates any reordering by the positioner. */
    CrossingReduction crossingReduction;

    /** Crossings between adjacent layers in the final order, backward edges excluded. */
    long finalCrossings;

    VerticalPositioning requestedPositioning;

    VerticalPositioning effectivePositioning;

    @Singular
    List<LayoutWarning> warnings;

    /**
     * Returns whether the optimizing positioner failed and heuristic positions were used.
     */
    public boolean degraded() {
        return requestedPositioning != effectivePositioning;
    }
}
