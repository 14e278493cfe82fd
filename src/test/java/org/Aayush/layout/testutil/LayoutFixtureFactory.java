package org.Aayush.layout.testutil;

import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared example graphs for layout tests.
 *
 * <p>Trees use heap numbering: node {@code i} has children {@code b*i+1 .. b*i+b}. Leaf
 * {@code i} carries value {@code i}, inner nodes the sum of their leaves, and each edge
 * the value of its child.</p>
 */
public final class LayoutFixtureFactory {

    private LayoutFixtureFactory() {
    }

    /**
     * Balanced tree, branching factor 2, height 3: 15 nodes, 14 edges.
     */
    public static FlowGraph balancedTree() {
        return balancedTree(2, 3);
    }

    public static FlowGraph balancedTree(int branchingFactor, int height) {
        int nodeCount = 0;
        int levelSize = 1;
        for (int level = 0; level <= height; level++) {
            nodeCount += levelSize;
            levelSize *= branchingFactor;
        }
        int firstLeaf = nodeCount - levelSize / branchingFactor;
        double[] values = new double[nodeCount];
        for (int node = nodeCount - 1; node >= 0; node--) {
            if (node >= firstLeaf) {
                values[node] = node;
            } else {
                for (int c = 1; c <= branchingFactor; c++) {
                    values[node] += values[branchingFactor * node + c];
                }
            }
        }

        FlowGraph graph = new FlowGraph();
        for (int node = 0; node < nodeCount; node++) {
            graph.addNode(Integer.toString(node));
        }
        for (int node = 0; node < firstLeaf; node++) {
            for (int c = 1; c <= branchingFactor; c++) {
                int child = branchingFactor * node + c;
                graph.addEdge(Integer.toString(node), Integer.toString(child), values[child]);
            }
        }
        return graph;
    }

    /**
     * Balanced tree mirrored over its leaves: the leaves flow on into a reversed copy
     * of the inner nodes ({@code mirror_<id>}).
     */
    public static FlowGraph siameseBalancedTree() {
        FlowGraph tree = balancedTree();
        FlowGraph graph = tree.copy();
        for (FlowEdge edge : tree.edges()) {
            String source = mirror(tree, edge.target());
            String target = mirror(tree, edge.source());
            graph.ensureNode(source);
            graph.ensureNode(target);
            graph.addEdge(source, target, edge.value());
        }
        return graph;
    }

    private static String mirror(FlowGraph tree, String id) {
        return tree.outEdges(id).isEmpty() ? id : "mirror_" + id;
    }

    /**
     * Balanced tree plus edge {@code 2 -> 4} of value 20, propagated to {@code 0 -> 2}
     * and to the first out-edge of {@code 4}.
     */
    public static FlowGraph balancedTreeWithCrossEdge() {
        Map<String, Double> adjusted = new LinkedHashMap<>();
        adjusted.put("0->2", 20.0d);
        adjusted.put("4->9", 20.0d);
        FlowGraph graph = rebuildWithAdjustments(balancedTree(), adjusted);
        graph.addEdge("2", "4", 20.0d);
        return graph;
    }

    /**
     * Balanced tree plus the back edge {@code 4 -> 1} of value 5, with {@code 0 -> 1} and
     * {@code 4 -> 10} reduced by 5 so flow stays balanced.
     */
    public static FlowGraph treeWithSimpleCycle() {
        Map<String, Double> adjusted = new LinkedHashMap<>();
        adjusted.put("0->1", -5.0d);
        adjusted.put("4->10", -5.0d);
        FlowGraph graph = rebuildWithAdjustments(balancedTree(), adjusted);
        graph.addEdge("4", "1", 5.0d);
        return graph;
    }

    /**
     * Balanced tree plus the self-loop {@code 4 -> 4}.
     */
    public static FlowGraph treeWithSelfLoop() {
        FlowGraph graph = balancedTree();
        graph.addEdge("4", "4", 2.0d);
        return graph;
    }

    /**
     * Real nodes chained with unit edges: {@code chain("a", "b", "c")}
     * gives {@code a -> b -> c}.
     */
    public static FlowGraph chain(String... ids) {
        FlowGraph graph = new FlowGraph();
        for (String id : ids) {
            graph.addNode(id);
        }
        for (int i = 1; i < ids.length; i++) {
            graph.addEdge(ids[i - 1], ids[i], 1.0d);
        }
        return graph;
    }

    private static FlowGraph rebuildWithAdjustments(FlowGraph tree, Map<String, Double> deltas) {
        FlowGraph graph = new FlowGraph();
        for (FlowNode node : tree.nodes()) {
            graph.addNode(node.id());
        }
        for (FlowEdge edge : tree.edges()) {
            double delta = deltas.getOrDefault(edge.source() + "->" + edge.target(), 0.0d);
            graph.addEdge(edge.source(), edge.target(), edge.value() + delta);
        }
        return graph;
    }
}
