package org.Aayush.layout.layer;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;
import org.Aayush.layout.graph.InvalidGraphException;

import java.util.Objects;

/**
 * Longest-path layer assignment for an acyclic flow graph.
 *
 * <p>Edges flagged backward are ignored. Every other edge {@code (u, v)} ends with
 * {@code layer(v) > layer(u)}; isolated nodes always land on layer 0.</p>
 */
@Slf4j
@UtilityClass
public class LayerAssigner {

    /**
     * Assigns a layer to every node.
     *
     * @param graph acyclic graph, mutated in place.
     * @param alignment push direction.
     * @param justify whether pure sources go to layer 0 and pure sinks to the last layer.
     * @return highest assigned layer (0 for an empty or edgeless graph).
     * @throws InvalidGraphException with {@code CYCLIC_GRAPH} when the graph still has a cycle.
     */
    public static int assign(FlowGraph graph, LayerAlignment alignment, boolean justify) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(alignment, "alignment");
        int nodeCount = graph.nodeCount();
        if (nodeCount == 0) {
            return 0;
        }

        IntList order = topologicalOrder(graph);
        int[] layers = alignment == LayerAlignment.LEFT
                ? longestPathFromSources(graph, order)
                : longestPathToSinks(graph, order);

        int maxLayer = 0;
        for (int layer : layers) {
            maxLayer = Math.max(maxLayer, layer);
        }
        if (justify) {
            justifyTerminals(graph, layers, maxLayer);
        }
        for (int i = 0; i < nodeCount; i++) {
            FlowNode node = graph.nodeAt(i);
            graph.assignLayer(node.id(), forwardDegree(graph, i) == 0 ? 0 : layers[i]);
        }
        log.debug("Assigned {} nodes to {} layers ({}, justify={})", nodeCount, maxLayer + 1, alignment, justify);
        return maxLayer;
    }

    private static int[] longestPathFromSources(FlowGraph graph, IntList order) {
        int[] layers = new int[graph.nodeCount()];
        for (int i = 0; i < order.size(); i++) {
            int node = order.getInt(i);
            IntList incoming = graph.inEdgeIds(node);
            for (int k = 0; k < incoming.size(); k++) {
                FlowEdge edge = graph.edge(incoming.getInt(k));
                if (!edge.backward()) {
                    layers[node] = Math.max(layers[node], layers[graph.indexOf(edge.source())] + 1);
                }
            }
        }
        return layers;
    }

    private static int[] longestPathToSinks(FlowGraph graph, IntList order) {
        int[] height = new int[graph.nodeCount()];
        int maxHeight = 0;
        for (int i = order.size() - 1; i >= 0; i--) {
            int node = order.getInt(i);
            IntList outgoing = graph.outEdgeIds(node);
            for (int k = 0; k < outgoing.size(); k++) {
                FlowEdge edge = graph.edge(outgoing.getInt(k));
                if (!edge.backward()) {
                    height[node] = Math.max(height[node], height[graph.indexOf(edge.target())] + 1);
                }
            }
            maxHeight = Math.max(maxHeight, height[node]);
        }
        int[] layers = new int[height.length];
        for (int node = 0; node < height.length; node++) {
            layers[node] = maxHeight - height[node];
        }
        return layers;
    }

    /**
     * Moves pure sources to layer 0 and pure sinks to {@code maxLayer} when no incident
     * edge would end up pointing to a lower or equal layer.
     */
    private static void justifyTerminals(FlowGraph graph, int[] layers, int maxLayer) {
        for (int node = 0; node < layers.length; node++) {
            int in = forwardInDegree(graph, node);
            int out = forwardOutDegree(graph, node);
            if (in == 0 && out > 0) {
                moveIfOrdered(graph, layers, node, 0);
            } else if (out == 0 && in > 0) {
                moveIfOrdered(graph, layers, node, maxLayer);
            }
        }
    }

    private static void moveIfOrdered(FlowGraph graph, int[] layers, int node, int candidate) {
        IntList incoming = graph.inEdgeIds(node);
        for (int k = 0; k < incoming.size(); k++) {
            FlowEdge edge = graph.edge(incoming.getInt(k));
            if (!edge.backward() && layers[graph.indexOf(edge.source())] >= candidate) {
                return;
            }
        }
        IntList outgoing = graph.outEdgeIds(node);
        for (int k = 0; k < outgoing.size(); k++) {
            FlowEdge edge = graph.edge(outgoing.getInt(k));
            if (!edge.backward() && layers[graph.indexOf(edge.target())] <= candidate) {
                return;
            }
        }
        layers[node] = candidate;
    }

    /**
     * Kahn topological order; ready nodes are released in index order.
     */
    private static IntList topologicalOrder(FlowGraph graph) {
        int nodeCount = graph.nodeCount();
        int[] remaining = new int[nodeCount];
        for (int node = 0; node < nodeCount; node++) {
            remaining[node] = forwardInDegree(graph, node);
        }
        IntArrayList order = new IntArrayList(nodeCount);
        for (int node = 0; node < nodeCount; node++) {
            if (remaining[node] == 0) {
                order.add(node);
            }
        }
        for (int head = 0; head < order.size(); head++) {
            IntList outgoing = graph.outEdgeIds(order.getInt(head));
            for (int k = 0; k < outgoing.size(); k++) {
                FlowEdge edge = graph.edge(outgoing.getInt(k));
                if (edge.backward()) {
                    continue;
                }
                int target = graph.indexOf(edge.target());
                if (--remaining[target] == 0) {
                    order.add(target);
                }
            }
        }
        if (order.size() != nodeCount) {
            throw new InvalidGraphException(
                    InvalidGraphException.REASON_CYCLIC_GRAPH,
                    "layer assignment needs an acyclic graph; " + (nodeCount - order.size()) + " node(s) sit on cycles"
            );
        }
        return order;
    }

    private static int forwardDegree(FlowGraph graph, int node) {
        return forwardInDegree(graph, node) + forwardOutDegree(graph, node);
    }

    private static int forwardInDegree(FlowGraph graph, int node) {
        return countForward(graph, graph.inEdgeIds(node));
    }

    private static int forwardOutDegree(FlowGraph graph, int node) {
        return countForward(graph, graph.outEdgeIds(node));
    }

    private static int countForward(FlowGraph graph, IntList edgeIds) {
        int count = 0;
        for (int k = 0; k < edgeIds.size(); k++) {
            if (!graph.edge(edgeIds.getInt(k)).backward()) {
                count++;
            }
        }
        return count;
    }
}
