package org.Aayush.layout.crossing;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import lombok.experimental.UtilityClass;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Counts crossing edge pairs between adjacent layers from current vertical positions.
 *
 * <p>Two edges between layers {@code l} and {@code l + 1} cross when their source order
 * and target order disagree strictly; edges sharing an endpoint never cross. Backward
 * edges and edges not spanning exactly one layer are ignored.</p>
 */
@UtilityClass
public class CrossingCounter {

    /**
     * Returns the total number of crossing edge pairs over all adjacent layer pairs.
     */
    public static long count(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Int2ObjectOpenHashMap<List<int[]>> byLayer = new Int2ObjectOpenHashMap<>();
        for (FlowEdge edge : graph.edges()) {
            if (edge.backward()) {
                continue;
            }
            FlowNode source = graph.node(edge.source());
            FlowNode target = graph.node(edge.target());
            if (!source.hasLayer() || target.layer() != source.layer() + 1) {
                continue;
            }
            byLayer.computeIfAbsent(source.layer(), layer -> new ArrayList<>())
                    .add(new int[]{source.verticalPosition(), target.verticalPosition()});
        }
        long crossings = 0L;
        for (List<int[]> segments : byLayer.values()) {
            crossings += countPairs(segments);
        }
        return crossings;
    }

    private static long countPairs(List<int[]> segments) {
        long crossings = 0L;
        for (int i = 0; i < segments.size(); i++) {
            int[] a = segments.get(i);
            for (int j = i + 1; j < segments.size(); j++) {
                int[] b = segments.get(j);
                if (Integer.signum(b[0] - a[0]) * Integer.signum(b[1] - a[1]) < 0) {
                    crossings++;
                }
            }
        }
        return crossings;
    }
}
