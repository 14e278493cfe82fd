package org.Aayush.layout.layer;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;
import org.Aayush.layout.graph.InvalidGraphException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits edges spanning several layers into chains of one-layer segments.
 *
 * <p>Each intermediate layer gets one dummy node. Chain segments carry the original
 * value and attributes, so flow through the chain equals the replaced edge. Dummy ids
 * depend only on the endpoints and the chain index, plus an ordinal for parallel edges
 * after the first, so reruns on the same input produce the same ids. A {@code ~n} suffix
 * is appended when the graph already holds a node with the generated id.</p>
 */
@Slf4j
@UtilityClass
public class DummyNodeInserter {
    static final String DUMMY_PREFIX = "dummy(";

    /**
     * Replaces every forward edge with a layer span above 1.
     *
     * @param graph layered graph, mutated in place.
     * @return replaced edges with their chains, in edge order.
     * @throws InvalidGraphException when an endpoint has no layer or an edge does not point
     * to a higher layer.
     */
    public static List<DummyChain> insert(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        List<DummyChain> chains = new ArrayList<>();
        Object2IntOpenHashMap<String> parallelOrdinals = new Object2IntOpenHashMap<>();
        int dummyCount = 0;

        for (FlowEdge edge : graph.edges()) {
            if (edge.backward()) {
                continue;
            }
            int span = span(graph, edge);
            if (span == 1) {
                continue;
            }
            String pairKey = edge.source() + "\u0000" + edge.target();
            int ordinal = parallelOrdinals.addTo(pairKey, 1);

            graph.removeEdge(edge.id());
            int sourceLayer = graph.node(edge.source()).layer();
            List<String> dummyIds = new ArrayList<>(span - 1);
            List<FlowEdge> segments = new ArrayList<>(span);
            String previous = edge.source();
            for (int chainIndex = 0; chainIndex < span - 1; chainIndex++) {
                String dummyId = freeId(graph, dummyId(edge, ordinal, chainIndex));
                graph.addDummyNode(dummyId);
                graph.assignLayer(dummyId, sourceLayer + chainIndex + 1);
                segments.add(graph.addChainSegment(previous, dummyId, edge.value(), edge.attributes()));
                dummyIds.add(dummyId);
                previous = dummyId;
            }
            segments.add(graph.addChainSegment(previous, edge.target(), edge.value(), edge.attributes()));
            chains.add(new DummyChain(edge, dummyIds, segments));
            dummyCount += dummyIds.size();
        }
        if (dummyCount > 0) {
            log.debug("Inserted {} dummy node(s) for {} multi-layer edge(s)", dummyCount, chains.size());
        }
        return chains;
    }

    /**
     * Builds the deterministic dummy id for one chain position.
     */
    static String dummyId(FlowEdge edge, int parallelOrdinal, int chainIndex) {
        StringBuilder id = new StringBuilder(DUMMY_PREFIX)
                .append(edge.source())
                .append("->")
                .append(edge.target());
        if (parallelOrdinal > 0) {
            id.append('#').append(parallelOrdinal);
        }
        return id.append(")[").append(chainIndex).append(']').toString();
    }

    // a real node may already carry the generated id
    private static String freeId(FlowGraph graph, String candidate) {
        String id = candidate;
        for (int suffix = 1; graph.containsNode(id); suffix++) {
            id = candidate + "~" + suffix;
        }
        return id;
    }

    private static int span(FlowGraph graph, FlowEdge edge) {
        FlowNode source = graph.node(edge.source());
        FlowNode target = graph.node(edge.target());
        if (!source.hasLayer() || !target.hasLayer()) {
            throw new InvalidGraphException(
                    InvalidGraphException.REASON_LAYER_REQUIRED,
                    "edge " + edge.source() + " -> " + edge.target() + " has an endpoint without layer"
            );
        }
        int span = target.layer() - source.layer();
        if (span < 1) {
            throw new InvalidGraphException(
                    InvalidGraphException.REASON_LAYER_ORDER_VIOLATION,
                    "edge " + edge.source() + " -> " + edge.target() + " goes from layer "
                            + source.layer() + " to layer " + target.layer()
            );
        }
        return span;
    }
}
