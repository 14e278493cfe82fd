package org.Aayush.layout.core;

import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Plain layered drawing of a graph whose edge values are ignored.
 *
 * <p>Every edge is given value 1 before the pipeline runs, so node sizes reflect
 * degree instead of flow.</p>
 */
public final class ThinLayout {
    private final SugiyamaLayout layout;

    public ThinLayout(SugiyamaLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /**
     * Lays out a unit-valued copy of {@code input}.
     *
     * @return placement per node id, dummy nodes included, in node insertion order.
     */
    public Map<String, NodePlacement> place(FlowGraph input, LayoutConfig config) {
        Objects.requireNonNull(input, "input");
        FlowGraph thin = new FlowGraph();
        for (FlowNode node : input.nodes()) {
            thin.addNode(node.id(), input.nodeAttributes(node.id()));
        }
        for (FlowEdge edge : input.edges()) {
            thin.addEdge(edge.source(), edge.target(), 1.0d, edge.attributes());
        }

        FlowGraph laidOut = layout.layout(thin, config).getGraph();
        Map<String, NodePlacement> placements = new LinkedHashMap<>();
        for (FlowNode node : laidOut.nodes()) {
            placements.put(node.id(), new NodePlacement(node.layer(), node.y()));
        }
        return placements;
    }
}
