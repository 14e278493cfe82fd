package org.Aayush.layout.cycle;

import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CycleReinserter Tests")
class CycleReinserterTest {

    @Test
    @DisplayName("Removed edges come back flagged backward without touching layout")
    void testReinsert() {
        FlowGraph graph = new FlowGraph();
        graph.addNode("A");
        graph.addNode("B");
        graph.addEdge("A", "B", 10.0d);
        FlowEdge back = graph.addEdge("B", "A", 2.0d);

        CycleRemoval removal = CycleResolver.resolve(graph);
        graph.assignLayer("A", 0);
        graph.assignLayer("B", 1);
        graph.assignVerticalPosition("A", 0);
        graph.assignVerticalPosition("B", 0);

        List<FlowEdge> restored = CycleReinserter.reinsert(graph, removal);

        assertEquals(1, restored.size());
        assertTrue(restored.get(0).backward());
        assertEquals(back.id(), restored.get(0).id());
        assertTrue(graph.edge(back.id()).backward());
        assertEquals(2, graph.edgeCount());
        assertEquals(0, graph.node("A").layer());
        assertEquals(1, graph.node("B").layer());
        assertEquals(2.0d, graph.node("A").inValue(), 1e-9);
        // backward edges are ignored by cycle detection
        assertTrue(CycleResolver.isAcyclic(graph));
    }

    @Test
    @DisplayName("Nothing removed means nothing restored")
    void testEmptyRemoval() {
        FlowGraph graph = new FlowGraph();
        graph.addNode("A");

        assertTrue(CycleReinserter.reinsert(graph, new CycleRemoval(List.of())).isEmpty());
    }
}
