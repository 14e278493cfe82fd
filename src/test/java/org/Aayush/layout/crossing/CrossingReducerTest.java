package org.Aayush.layout.crossing;

import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;
import org.Aayush.layout.layer.DummyNodeInserter;
import org.Aayush.layout.layer.LayerAlignment;
import org.Aayush.layout.layer.LayerAssigner;
import org.Aayush.layout.testutil.LayoutFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossingReducer Tests")
class CrossingReducerTest {

    private static FlowGraph prepared(FlowGraph graph) {
        LayerAssigner.assign(graph, LayerAlignment.RIGHT, true);
        DummyNodeInserter.insert(graph);
        CrossingReducer.initialize(graph);
        return graph;
    }

    private static Map<String, Integer> positions(FlowGraph graph) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (FlowNode node : graph.nodes()) {
            positions.put(node.id(), node.verticalPosition());
        }
        return positions;
    }

    private static void assertPermutations(FlowGraph graph) {
        for (int layer : graph.layers()) {
            List<FlowNode> layerNodes = graph.layerNodes(layer);
            int[] seen = layerNodes.stream().mapToInt(FlowNode::verticalPosition).sorted().toArray();
            int[] expected = new int[layerNodes.size()];
            Arrays.setAll(expected, i -> i);
            assertArrayEquals(expected, seen, "layer " + layer);
        }
    }

    @Test
    @DisplayName("Initialization follows insertion order within each layer")
    void testInitialize() {
        FlowGraph graph = prepared(LayoutFixtureFactory.balancedTree());

        assertEquals(0, graph.node("3").verticalPosition());
        assertEquals(3, graph.node("6").verticalPosition());
        assertEquals(7, graph.node("14").verticalPosition());
        assertPermutations(graph);
    }

    @Test
    @DisplayName("Three children of one parent keep order 0,1,2 after a sweep")
    void testFanOutKeepsOrder() {
        FlowGraph graph = new FlowGraph();
        graph.addNode("P");
        for (String child : List.of("x", "y", "z")) {
            graph.addNode(child);
            graph.addEdge("P", child, 1.0d);
        }
        prepared(graph);

        CrossingReduction reduction = CrossingReducer.reduce(graph, SweepSchedule.fixed(1), CrossingReductionListener.NO_OP);

        assertEquals(0, graph.node("x").verticalPosition());
        assertEquals(1, graph.node("y").verticalPosition());
        assertEquals(2, graph.node("z").verticalPosition());
        assertEquals(0, reduction.sweeps().get(0).getPositionChanges());
    }

    @Test
    @DisplayName("A forward sweep untangles a single crossing")
    void testUntangle() {
        FlowGraph graph = new FlowGraph();
        graph.addNode("A");
        graph.addNode("B");
        graph.addNode("C");
        graph.addNode("D");
        graph.addEdge("A", "D", 1.0d);
        graph.addEdge("B", "C", 1.0d);
        prepared(graph);
        assertEquals(1L, CrossingCounter.count(graph));

        CrossingReduction reduction = CrossingReducer.reduce(graph, SweepSchedule.fixed(1), CrossingReductionListener.NO_OP);

        assertEquals(1L, reduction.initialCrossings());
        assertEquals(0L, reduction.finalCrossings());
        assertEquals(0, graph.node("D").verticalPosition());
        assertEquals(1, graph.node("C").verticalPosition());
    }

    @Test
    @DisplayName("Zero sweeps leave the initial order unchanged")
    void testZeroSweepsIdempotent() {
        FlowGraph graph = prepared(LayoutFixtureFactory.siameseBalancedTree());
        Map<String, Integer> before = positions(graph);

        CrossingReduction reduction = CrossingReducer.reduce(graph, SweepSchedule.fixed(0), CrossingReductionListener.NO_OP);

        assertEquals(before, positions(graph));
        assertEquals(0, reduction.sweepCount());
        assertEquals(reduction.initialCrossings(), reduction.finalCrossings());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5})
    @DisplayName("A fixed schedule runs exactly that many sweeps with alternating direction")
    void testFixedSchedule(int sweeps) {
        FlowGraph graph = prepared(LayoutFixtureFactory.balancedTreeWithCrossEdge());
        List<SweepEvent> seen = new ArrayList<>();

        CrossingReduction reduction = CrossingReducer.reduce(graph, SweepSchedule.fixed(sweeps), seen::add);

        assertEquals(sweeps, reduction.sweepCount());
        assertEquals(reduction.sweeps(), seen);
        for (int i = 0; i < seen.size(); i++) {
            assertEquals(i, seen.get(i).getSweepIndex());
            assertEquals(i % 2 == 0 ? SweepDirection.FORWARD : SweepDirection.BACKWARD, seen.get(i).getDirection());
        }
        assertFalse(reduction.stabilized());
        assertPermutations(graph);
    }

    @Test
    @DisplayName("A range stops early once two sweeps in a row change nothing")
    void testRangeStopsOnStabilization() {
        FlowGraph graph = prepared(LayoutFixtureFactory.balancedTree());

        CrossingReduction reduction = CrossingReducer.reduce(graph, SweepSchedule.range(2, 6), CrossingReductionListener.NO_OP);

        // tree in insertion order has nothing to untangle
        assertEquals(2, reduction.sweepCount());
        assertTrue(reduction.stabilized());
        assertEquals(0L, reduction.finalCrossings());
    }

    @Test
    @DisplayName("A range never runs fewer than its minimum")
    void testRangeMinimum() {
        FlowGraph graph = prepared(LayoutFixtureFactory.balancedTree());

        CrossingReduction reduction = CrossingReducer.reduce(graph, SweepSchedule.range(4, 6), CrossingReductionListener.NO_OP);

        assertEquals(4, reduction.sweepCount());
    }

    @Test
    @DisplayName("Same input and insertion order give the same positions")
    void testDeterminism() {
        FlowGraph first = prepared(LayoutFixtureFactory.balancedTreeWithCrossEdge());
        FlowGraph second = prepared(LayoutFixtureFactory.balancedTreeWithCrossEdge());

        CrossingReducer.reduce(first, SweepSchedule.range(2, 6), CrossingReductionListener.NO_OP);
        CrossingReducer.reduce(second, SweepSchedule.range(2, 6), CrossingReductionListener.NO_OP);

        assertEquals(positions(first), positions(second));
    }

    @Test
    @DisplayName("Schedules reject negative or inverted bounds")
    void testScheduleValidation() {
        assertThrows(IllegalArgumentException.class, () -> SweepSchedule.fixed(-1));
        assertThrows(IllegalArgumentException.class, () -> SweepSchedule.range(5, 2));
        assertTrue(SweepSchedule.fixed(3).isFixed());
        assertFalse(SweepSchedule.range(2, 6).isFixed());
    }
}
