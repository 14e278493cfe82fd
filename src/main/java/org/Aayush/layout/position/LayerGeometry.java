package org.Aayush.layout.position;

import lombok.experimental.UtilityClass;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Node spacing shared by all positioning strategies.
 *
 * <p>Two neighbours in a layer keep their centers at least
 * {@code max(a.maxValue + b.maxValue + nodeGap, floor)} apart, which leaves a visible gap
 * of half their combined size between the two boxes. The floor keeps zero-size nodes
 * strictly ordered.</p>
 */
@UtilityClass
class LayerGeometry {
    private static final double FLOOR_RATIO = 1e-3d;

    /**
     * Minimum center distance for zero-size neighbours.
     */
    static double separationFloor(FlowGraph graph) {
        double maxHeight = 0.0d;
        for (FlowNode node : graph.nodes()) {
            maxHeight = Math.max(maxHeight, node.maxValue());
        }
        return maxHeight > 0.0d ? maxHeight * FLOOR_RATIO : 1.0d;
    }

    static double separation(FlowNode upper, FlowNode lower, double nodeGap, double floor) {
        return Math.max(upper.maxValue() + lower.maxValue() + nodeGap, floor);
    }

    /**
     * Stacks a layer from {@code top = 0}: the first center sits at half its size, each
     * next center one separation further.
     *
     * @return centers followed by the bottom edge of the stack as last element.
     */
    static double[] stack(List<FlowNode> layerNodes, double nodeGap, double floor) {
        double[] centers = new double[layerNodes.size() + 1];
        if (layerNodes.isEmpty()) {
            return centers;
        }
        centers[0] = layerNodes.get(0).maxValue() / 2.0d;
        for (int i = 1; i < layerNodes.size(); i++) {
            centers[i] = centers[i - 1] + separation(layerNodes.get(i - 1), layerNodes.get(i), nodeGap, floor);
        }
        FlowNode last = layerNodes.get(layerNodes.size() - 1);
        centers[layerNodes.size()] = centers[layerNodes.size() - 1] + last.maxValue() / 2.0d;
        return centers;
    }

    /**
     * Returns whether no node of the layer has a forward edge.
     */
    static boolean isDisconnected(FlowGraph graph, List<FlowNode> layerNodes) {
        for (FlowNode node : layerNodes) {
            if (!isIsolated(graph, node)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether the node has no forward edge in either direction.
     */
    static boolean isIsolated(FlowGraph graph, FlowNode node) {
        return !hasForwardEdge(graph.inEdges(node.id())) && !hasForwardEdge(graph.outEdges(node.id()));
    }

    /**
     * Returns the nodes of the layer that have at least one forward edge, in order.
     */
    static List<FlowNode> linkedNodes(FlowGraph graph, List<FlowNode> layerNodes) {
        List<FlowNode> linked = new ArrayList<>(layerNodes.size());
        for (FlowNode node : layerNodes) {
            if (!isIsolated(graph, node)) {
                linked.add(node);
            }
        }
        return linked;
    }

    /**
     * Returns the nodes of the layer without any forward edge, in order.
     */
    static List<FlowNode> isolatedNodes(FlowGraph graph, List<FlowNode> layerNodes) {
        List<FlowNode> isolated = new ArrayList<>();
        for (FlowNode node : layerNodes) {
            if (isIsolated(graph, node)) {
                isolated.add(node);
            }
        }
        return isolated;
    }

    /**
     * Renumbers vertical positions by y; the previous position breaks ties.
     */
    static void rankByY(FlowGraph graph, List<FlowNode> layerNodes) {
        List<FlowNode> ranked = new ArrayList<>(layerNodes);
        ranked.sort(Comparator.comparingDouble((FlowNode node) -> node.y()).thenComparingInt(node -> node.verticalPosition()));
        for (int i = 0; i < ranked.size(); i++) {
            graph.assignVerticalPosition(ranked.get(i).id(), i);
        }
    }

    private static boolean hasForwardEdge(List<FlowEdge> edges) {
        for (FlowEdge edge : edges) {
            if (!edge.backward()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Stacks edgeless nodes below the lowest linked node of their layer.
     *
     * @param linked positioned nodes of the layer; not empty.
     * @param isolated nodes to place, in their current order.
     */
    static void placeBelow(FlowGraph graph, List<FlowNode> linked, List<FlowNode> isolated, double nodeGap, double floor) {
        FlowNode previous = linked.get(0);
        for (FlowNode node : linked) {
            if (node.y() > previous.y()) {
                previous = node;
            }
        }
        for (FlowNode node : isolated) {
            graph.assignY(node.id(), previous.y() + separation(previous, node, nodeGap, floor));
            previous = node;
        }
    }

    /**
     * Writes a stacked layer centered on {@code center}.
     */
    static void placeCentered(FlowGraph graph, List<FlowNode> layerNodes, double nodeGap, double floor, double center) {
        double[] stacked = stack(layerNodes, nodeGap, floor);
        double offset = center - stacked[layerNodes.size()] / 2.0d;
        for (int i = 0; i < layerNodes.size(); i++) {
            graph.assignY(layerNodes.get(i).id(), stacked[i] + offset);
        }
    }
}
