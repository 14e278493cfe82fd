package org.Aayush.layout.cycle;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.GraphValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Makes a flow graph acyclic by removing low-value edges.
 *
 * <p>Removal is iterative: find one cycle by depth-first search, drop its lowest-value
 * edge (first inserted wins a tie), and search again, since one removal can leave other
 * cycles in place. Each round removes one edge, so the loop is bounded by the edge count.</p>
 */
@Slf4j
@UtilityClass
public class CycleResolver {
    private static final byte WHITE = 0;
    private static final byte GRAY = 1;
    private static final byte BLACK = 2;

    /**
     * Validates the graph and removes edges until it is acyclic.
     *
     * @param graph graph to open up, mutated in place.
     * @return removed edges in removal order.
     * @throws org.Aayush.layout.graph.InvalidGraphException when validation fails (self-loops included).
     * @throws UnresolvableCycleException when the iteration bound is exceeded.
     */
    public static CycleRemoval resolve(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        GraphValidator.validate(graph);

        int safetyBound = graph.edgeCount() + 1;
        List<FlowEdge> removed = new ArrayList<>();
        IntList cycle = findCycle(graph);
        while (!cycle.isEmpty()) {
            if (removed.size() >= safetyBound) {
                throw new UnresolvableCycleException(
                        "cycle removal did not terminate after " + removed.size() + " removals"
                );
            }
            FlowEdge weakest = weakestEdge(graph, cycle);
            log.debug("Opening cycle of {} edges by removing {} -> {} (value {})",
                    cycle.size(), weakest.source(), weakest.target(), weakest.value());
            removed.add(graph.removeEdge(weakest.id()));
            cycle = findCycle(graph);
        }
        if (!removed.isEmpty()) {
            log.debug("Removed {} edge(s) to make the graph acyclic", removed.size());
        }
        return new CycleRemoval(removed);
    }

    /**
     * Returns whether the graph, ignoring edges flagged backward, has no directed cycle.
     */
    public static boolean isAcyclic(FlowGraph graph) {
        return findCycle(graph).isEmpty();
    }

    private static FlowEdge weakestEdge(FlowGraph graph, IntList cycle) {
        FlowEdge weakest = null;
        for (int i = 0; i < cycle.size(); i++) {
            FlowEdge edge = graph.edge(cycle.getInt(i));
            if (weakest == null
                    || edge.value() < weakest.value()
                    || (edge.value() == weakest.value() && edge.id() < weakest.id())) {
                weakest = edge;
            }
        }
        return weakest;
    }

    /**
     * Finds one directed cycle with an iterative depth-first search.
     *
     * <p>Roots and edges are visited in insertion order so the same graph always yields
     * the same cycle.</p>
     *
     * @return edge ids along the cycle, empty when the graph is acyclic.
     */
    static IntList findCycle(FlowGraph graph) {
        int nodeCount = graph.nodeCount();
        byte[] state = new byte[nodeCount];
        int[] cursor = new int[nodeCount];
        int[] stackSlot = new int[nodeCount];
        IntArrayList nodeStack = new IntArrayList();
        // edgeStack[k] leaves nodeStack[k] and enters nodeStack[k + 1]
        IntArrayList edgeStack = new IntArrayList();

        for (int root = 0; root < nodeCount; root++) {
            if (state[root] != WHITE) {
                continue;
            }
            state[root] = GRAY;
            stackSlot[root] = 0;
            nodeStack.add(root);
            while (!nodeStack.isEmpty()) {
                int top = nodeStack.getInt(nodeStack.size() - 1);
                IntList outgoing = graph.outEdgeIds(top);
                if (cursor[top] < outgoing.size()) {
                    int edgeId = outgoing.getInt(cursor[top]++);
                    FlowEdge edge = graph.edge(edgeId);
                    if (edge.backward()) {
                        continue;
                    }
                    int next = graph.indexOf(edge.target());
                    if (state[next] == GRAY) {
                        IntArrayList cycle = new IntArrayList(edgeStack.subList(stackSlot[next], edgeStack.size()));
                        cycle.add(edgeId);
                        return cycle;
                    }
                    if (state[next] == WHITE) {
                        state[next] = GRAY;
                        stackSlot[next] = nodeStack.size();
                        nodeStack.add(next);
                        edgeStack.add(edgeId);
                    }
                } else {
                    state[top] = BLACK;
                    nodeStack.removeInt(nodeStack.size() - 1);
                    if (!edgeStack.isEmpty()) {
                        edgeStack.removeInt(edgeStack.size() - 1);
                    }
                }
            }
        }
        return new IntArrayList();
    }
}
