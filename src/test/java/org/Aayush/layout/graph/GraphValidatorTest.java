package org.Aayush.layout.graph;

import org.Aayush.layout.testutil.LayoutFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphValidator Tests")
class GraphValidatorTest {

    @Test
    @DisplayName("Example trees are valid")
    void testExamplesPass() {
        assertDoesNotThrow(() -> GraphValidator.validate(LayoutFixtureFactory.balancedTree()));
        assertDoesNotThrow(() -> GraphValidator.validate(LayoutFixtureFactory.siameseBalancedTree()));
        assertDoesNotThrow(() -> GraphValidator.validate(LayoutFixtureFactory.treeWithSimpleCycle()));
    }

    @Test
    @DisplayName("Self-loops are rejected")
    void testSelfLoop() {
        InvalidGraphException ex = assertThrows(
                InvalidGraphException.class,
                () -> GraphValidator.validate(LayoutFixtureFactory.treeWithSelfLoop())
        );
        assertEquals(InvalidGraphException.REASON_SELF_LOOP, ex.reasonCode());
    }

    @Test
    @DisplayName("Negative and non-finite values are rejected")
    void testBadValues() {
        FlowGraph negative = LayoutFixtureFactory.chain("a", "b");
        negative.addNode("c");
        negative.addEdge("a", "c", -1.0d);
        assertEquals(
                InvalidGraphException.REASON_NEGATIVE_VALUE,
                assertThrows(InvalidGraphException.class, () -> GraphValidator.validate(negative)).reasonCode()
        );

        FlowGraph infinite = new FlowGraph();
        infinite.addNode("a");
        infinite.addNode("b");
        infinite.addEdge("a", "b", Double.POSITIVE_INFINITY);
        assertEquals(
                InvalidGraphException.REASON_NON_FINITE_VALUE,
                assertThrows(InvalidGraphException.class, () -> GraphValidator.validate(infinite)).reasonCode()
        );
    }

    @Test
    @DisplayName("Zero is fatal only on a sole in- or out-edge")
    void testZeroValues() {
        FlowGraph sole = new FlowGraph();
        sole.addNode("a");
        sole.addNode("b");
        sole.addEdge("a", "b", 0.0d);
        assertEquals(
                InvalidGraphException.REASON_ZERO_SOLE_EDGE,
                assertThrows(InvalidGraphException.class, () -> GraphValidator.validate(sole)).reasonCode()
        );

        // a -> x and b -> x, a -> y and b -> y: every node has two edges on each used side
        FlowGraph shared = new FlowGraph();
        shared.addNode("a");
        shared.addNode("b");
        shared.addNode("x");
        shared.addNode("y");
        shared.addEdge("a", "x", 0.0d);
        shared.addEdge("a", "y", 1.0d);
        shared.addEdge("b", "x", 1.0d);
        shared.addEdge("b", "y", 1.0d);
        assertDoesNotThrow(() -> GraphValidator.validate(shared));
    }
}
