package org.Aayush.layout.crossing;

import org.Aayush.layout.graph.FlowGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossingCounter Tests")
class CrossingCounterTest {

    private static FlowGraph twoByTwo(int positionOfC, int positionOfD) {
        FlowGraph graph = new FlowGraph();
        graph.addNode("A");
        graph.addNode("B");
        graph.addNode("C");
        graph.addNode("D");
        graph.addEdge("A", "D", 1.0d);
        graph.addEdge("B", "C", 1.0d);
        graph.assignLayer("A", 0);
        graph.assignLayer("B", 0);
        graph.assignLayer("C", 1);
        graph.assignLayer("D", 1);
        graph.assignVerticalPosition("A", 0);
        graph.assignVerticalPosition("B", 1);
        graph.assignVerticalPosition("C", positionOfC);
        graph.assignVerticalPosition("D", positionOfD);
        return graph;
    }

    @Test
    @DisplayName("Swapped targets cross once, aligned targets do not")
    void testSingleCrossing() {
        assertEquals(1L, CrossingCounter.count(twoByTwo(0, 1)));
        assertEquals(0L, CrossingCounter.count(twoByTwo(1, 0)));
    }

    @Test
    @DisplayName("Edges sharing an endpoint never cross")
    void testSharedEndpoint() {
        FlowGraph graph = twoByTwo(0, 1);
        graph.addEdge("A", "C", 1.0d);
        // A->C shares A with A->D and C with B->C; only A->D x B->C counts
        assertEquals(1L, CrossingCounter.count(graph));
    }

    @Test
    @DisplayName("Unlayered graphs count zero")
    void testUnlayered() {
        FlowGraph graph = new FlowGraph();
        graph.addNode("A");
        graph.addNode("B");
        graph.addEdge("A", "B", 1.0d);
        assertEquals(0L, CrossingCounter.count(graph));
    }
}
