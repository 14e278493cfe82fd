package org.Aayush.layout.layer;

import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;
import org.Aayush.layout.graph.InvalidGraphException;
import org.Aayush.layout.testutil.LayoutFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LayerAssigner Tests")
class LayerAssignerTest {

    @Test
    @DisplayName("Source with two children: children share layer 1")
    void testSimpleFanOut() {
        FlowGraph graph = new FlowGraph();
        graph.addNode("A");
        graph.addNode("B");
        graph.addNode("C");
        graph.addEdge("A", "B", 5.0d);
        graph.addEdge("A", "C", 3.0d);

        int maxLayer = LayerAssigner.assign(graph, LayerAlignment.RIGHT, true);

        assertEquals(1, maxLayer);
        assertEquals(0, graph.node("A").layer());
        assertEquals(1, graph.node("B").layer());
        assertEquals(1, graph.node("C").layer());
    }

    @Test
    @DisplayName("Balanced tree layers follow depth")
    void testBalancedTreeDepth() {
        FlowGraph graph = LayoutFixtureFactory.balancedTree();

        assertEquals(3, LayerAssigner.assign(graph, LayerAlignment.LEFT, false));
        assertEquals(0, graph.node("0").layer());
        assertEquals(1, graph.node("2").layer());
        assertEquals(2, graph.node("4").layer());
        assertEquals(3, graph.node("14").layer());
    }

    @Test
    @DisplayName("Right alignment pushes short branches toward the sinks")
    void testRightAlignment() {
        FlowGraph graph = LayoutFixtureFactory.chain("A", "B", "C");
        graph.addNode("D");
        graph.addEdge("D", "C", 1.0d);

        LayerAssigner.assign(graph, LayerAlignment.RIGHT, false);
        assertEquals(1, graph.node("D").layer());

        FlowGraph justified = graph.copy();
        LayerAssigner.assign(justified, LayerAlignment.RIGHT, true);
        assertEquals(0, justified.node("D").layer());
    }

    @Test
    @DisplayName("Left alignment keeps short branches near the sources unless justified")
    void testLeftAlignment() {
        FlowGraph graph = LayoutFixtureFactory.chain("A", "B", "C");
        graph.addNode("E");
        graph.addEdge("A", "E", 1.0d);

        LayerAssigner.assign(graph, LayerAlignment.LEFT, false);
        assertEquals(1, graph.node("E").layer());

        FlowGraph justified = graph.copy();
        LayerAssigner.assign(justified, LayerAlignment.LEFT, true);
        assertEquals(2, justified.node("E").layer());
    }

    @ParameterizedTest
    @EnumSource(LayerAlignment.class)
    @DisplayName("Every forward edge points to a higher layer and isolated nodes sit on 0")
    void testOrderingInvariant(LayerAlignment alignment) {
        FlowGraph graph = LayoutFixtureFactory.siameseBalancedTree();
        graph.addNode("lonely");

        LayerAssigner.assign(graph, alignment, true);

        for (FlowEdge edge : graph.edges()) {
            assertTrue(graph.node(edge.target()).layer() > graph.node(edge.source()).layer(), edge.toString());
        }
        for (FlowNode node : graph.nodes()) {
            assertTrue(node.layer() >= 0);
        }
        assertEquals(0, graph.node("lonely").layer());
        assertEquals(6, graph.maxLayer());
    }

    @Test
    @DisplayName("Backward edges are ignored")
    void testBackwardEdgesIgnored() {
        FlowGraph graph = LayoutFixtureFactory.chain("A", "B");
        FlowEdge back = graph.addEdge("B", "A", 1.0d);
        graph.removeEdge(back.id());
        graph.restoreEdge(back.withBackward(true));

        assertEquals(1, LayerAssigner.assign(graph, LayerAlignment.RIGHT, true));
    }

    @Test
    @DisplayName("Cyclic input is refused")
    void testCycleRefused() {
        FlowGraph graph = LayoutFixtureFactory.chain("A", "B");
        graph.addEdge("B", "A", 1.0d);

        InvalidGraphException ex = assertThrows(
                InvalidGraphException.class,
                () -> LayerAssigner.assign(graph, LayerAlignment.LEFT, false)
        );
        assertEquals(InvalidGraphException.REASON_CYCLIC_GRAPH, ex.reasonCode());
    }
}
