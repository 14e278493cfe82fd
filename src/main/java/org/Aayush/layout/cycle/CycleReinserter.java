package org.Aayush.layout.cycle;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Puts edges removed by {@link CycleResolver} back into a laid-out graph.
 *
 * <p>Restored edges keep their id, endpoints, value and attributes and are flagged
 * backward. Layers and positions are left untouched; the graph may be cyclic again.</p>
 */
@Slf4j
@UtilityClass
public class CycleReinserter {

    /**
     * Restores the removed edges in removal order.
     *
     * @param graph laid-out graph, mutated in place.
     * @param removal output of the cycle resolver for the same graph.
     * @return restored edges as stored in the graph (backward flag set).
     */
    public static List<FlowEdge> reinsert(FlowGraph graph, CycleRemoval removal) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(removal, "removal");
        List<FlowEdge> restored = new ArrayList<>(removal.removedEdges().size());
        for (FlowEdge edge : removal.removedEdges()) {
            restored.add(graph.restoreEdge(edge.withBackward(true)));
        }
        if (!restored.isEmpty()) {
            log.debug("Restored {} backward edge(s)", restored.size());
        }
        return restored;
    }
}
