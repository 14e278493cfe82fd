package org.Aayush.layout.cycle;

import org.Aayush.layout.graph.FlowEdge;

import java.util.List;

/**
 * Outcome of {@link CycleResolver#resolve}.
 *
 * @param removedEdges edges taken out of the graph, in removal order.
 */
public record CycleRemoval(List<FlowEdge> removedEdges) {

    public CycleRemoval {
        removedEdges = List.copyOf(removedEdges);
    }

    /**
     * Returns whether the input graph was already acyclic.
     */
    public boolean wasAcyclic() {
        return removedEdges.isEmpty();
    }
}
