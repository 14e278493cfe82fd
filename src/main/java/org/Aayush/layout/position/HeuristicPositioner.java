package org.Aayush.layout.position;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;
import org.Aayush.layout.graph.LayoutWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Direct y assignment from the within-layer order.
 *
 * <p>Nodes with a forward edge are stacked downward from {@code y = 0}; edgeless nodes
 * sharing their layer follow below them. Layers without any edge are centered on the
 * middle of the tallest stack. Both cases are reported.</p>
 */
@Slf4j
@UtilityClass
public class HeuristicPositioner {

    /**
     * Assigns y to every node from its vertical position.
     *
     * @param graph graph with a permutation of vertical positions per layer; mutated in place.
     * @param nodeGap extra space between neighbouring nodes.
     * @return one {@code DISCONNECTED_LAYER} warning per layer holding edgeless nodes.
     */
    public static List<LayoutWarning> assign(FlowGraph graph, double nodeGap) {
        Objects.requireNonNull(graph, "graph");
        double floor = LayerGeometry.separationFloor(graph);
        double tallest = 0.0d;
        List<List<FlowNode>> disconnected = new ArrayList<>();
        List<LayoutWarning> warnings = new ArrayList<>();

        for (int layer : graph.layers()) {
            List<FlowNode> layerNodes = graph.layerNodes(layer);
            List<FlowNode> linked = LayerGeometry.linkedNodes(graph, layerNodes);
            if (linked.isEmpty()) {
                disconnected.add(layerNodes);
                continue;
            }
            double[] stacked = LayerGeometry.stack(linked, nodeGap, floor);
            for (int i = 0; i < linked.size(); i++) {
                graph.assignY(linked.get(i).id(), stacked[i]);
            }
            tallest = Math.max(tallest, stacked[linked.size()]);
            if (linked.size() < layerNodes.size()) {
                warnings.add(placeIsolated(graph, layerNodes, linked, nodeGap, floor));
            }
        }

        for (List<FlowNode> layerNodes : disconnected) {
            double center = tallest > 0.0d
                    ? tallest / 2.0d
                    : LayerGeometry.stack(layerNodes, nodeGap, floor)[layerNodes.size()] / 2.0d;
            LayerGeometry.placeCentered(graph, layerNodes, nodeGap, floor, center);
            warnings.add(disconnectedLayerWarning(layerNodes));
        }
        return warnings;
    }

    static LayoutWarning disconnectedLayerWarning(List<FlowNode> layerNodes) {
        int layer = layerNodes.get(0).layer();
        log.warn("Layer {} has no edges; its {} node(s) were centered", layer, layerNodes.size());
        return new LayoutWarning(LayoutWarning.Kind.DISCONNECTED_LAYER, Integer.toString(layer),
                "layer " + layer + " has no edges; its " + layerNodes.size() + " node(s) were centered");
    }

    /**
     * Moves the edgeless nodes of a partly linked layer below its positioned nodes and
     * renumbers the layer.
     */
    static LayoutWarning placeIsolated(FlowGraph graph, List<FlowNode> layerNodes, List<FlowNode> linked, double nodeGap, double floor) {
        List<FlowNode> isolated = LayerGeometry.isolatedNodes(graph, layerNodes);
        LayerGeometry.placeBelow(graph, linked, isolated, nodeGap, floor);
        LayerGeometry.rankByY(graph, layerNodes);

        int layer = layerNodes.get(0).layer();
        List<String> ids = new ArrayList<>(isolated.size());
        for (FlowNode node : isolated) {
            ids.add(node.id());
        }
        log.warn("Layer {} holds edgeless node(s) {}; they were placed below its linked nodes", layer, ids);
        return new LayoutWarning(LayoutWarning.Kind.DISCONNECTED_LAYER, Integer.toString(layer),
                "layer " + layer + " holds edgeless node(s) " + ids + "; they were placed below its linked nodes");
    }
}
