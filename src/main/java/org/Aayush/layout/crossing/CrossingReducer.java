package org.Aayush.layout.crossing;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Multi-sweep barycenter heuristic for within-layer ordering.
 *
 * <p>Sweeps alternate direction starting forward. Within one layer, every node with at
 * least one neighbor in the reference layer is ranked by the mean vertical position of
 * those neighbors (ties keep the previous order) and the ranked nodes are written back
 * into the slots they occupied together. Nodes without such neighbors keep their slot.</p>
 *
 * <p>The crossing count is recomputed after each sweep and reported to the listener;
 * it never decides which order is kept. The final order is the one left by the last
 * sweep.</p>
 */
@Slf4j
@UtilityClass
public class CrossingReducer {
    private static final int STABLE_SWEEPS_TO_STOP = 2;

    /**
     * Sets vertical positions to node insertion order within each layer.
     *
     * @param graph layered graph, mutated in place.
     */
    public static void initialize(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Int2IntOpenHashMap nextPosition = new Int2IntOpenHashMap();
        for (FlowNode node : graph.nodes()) {
            if (!node.hasLayer()) {
                throw new IllegalStateException("node " + node.id() + " has no layer");
            }
            graph.assignVerticalPosition(node.id(), nextPosition.addTo(node.layer(), 1));
        }
    }

    /**
     * Runs sweeps according to the schedule.
     *
     * @param graph layered, dummy-expanded graph with initialized positions; mutated in place.
     * @param schedule sweep bounds.
     * @param listener progress observer.
     * @return run summary.
     */
    public static CrossingReduction reduce(FlowGraph graph, SweepSchedule schedule, CrossingReductionListener listener) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(listener, "listener");

        int[] layers = graph.layers();
        long initialCrossings = CrossingCounter.count(graph);
        long crossings = initialCrossings;
        List<SweepEvent> events = new ArrayList<>();
        int stableRun = 0;
        boolean stabilized = false;

        for (int sweep = 0; sweep < schedule.getMaxSweeps(); sweep++) {
            if (!schedule.isFixed() && sweep >= schedule.getMinSweeps() && stableRun >= STABLE_SWEEPS_TO_STOP) {
                stabilized = true;
                break;
            }
            SweepDirection direction = SweepDirection.forSweep(sweep);
            int changes = sweep(graph, layers, direction);
            long after = CrossingCounter.count(graph);
            SweepEvent event = SweepEvent.builder()
                    .sweepIndex(sweep)
                    .direction(direction)
                    .positionChanges(changes)
                    .crossingsBefore(crossings)
                    .crossingsAfter(after)
                    .build();
            log.debug("Sweep {} ({}): {} position change(s), crossings {} -> {}",
                    sweep, direction, changes, crossings, after);
            events.add(event);
            listener.onSweep(event);
            crossings = after;
            stableRun = changes == 0 ? stableRun + 1 : 0;
        }
        return new CrossingReduction(initialCrossings, crossings, events, stabilized);
    }

    /**
     * Runs one sweep in the given direction.
     *
     * @return number of nodes whose position changed.
     */
    static int sweep(FlowGraph graph, int[] layers, SweepDirection direction) {
        int changes = 0;
        if (direction == SweepDirection.FORWARD) {
            for (int i = 1; i < layers.length; i++) {
                changes += reorderLayer(graph, layers[i], layers[i - 1], true);
            }
        } else {
            for (int i = layers.length - 2; i >= 0; i--) {
                changes += reorderLayer(graph, layers[i], layers[i + 1], false);
            }
        }
        return changes;
    }

    private static int reorderLayer(FlowGraph graph, int layer, int referenceLayer, boolean fromPredecessors) {
        List<FlowNode> layerNodes = graph.layerNodes(layer);
        IntArrayList slots = new IntArrayList();
        List<Ranked> movers = new ArrayList<>();
        for (FlowNode node : layerNodes) {
            double barycenter = barycenter(graph, node, referenceLayer, fromPredecessors);
            if (Double.isNaN(barycenter)) {
                continue;
            }
            slots.add(node.verticalPosition());
            movers.add(new Ranked(node, barycenter));
        }
        movers.sort(Comparator.comparingDouble(Ranked::barycenter)
                .thenComparingInt(ranked -> ranked.node().verticalPosition()));

        int changes = 0;
        for (int i = 0; i < movers.size(); i++) {
            FlowNode node = movers.get(i).node();
            int slot = slots.getInt(i);
            if (node.verticalPosition() != slot) {
                changes++;
            }
            graph.assignVerticalPosition(node.id(), slot);
        }
        return changes;
    }

    /**
     * Mean vertical position of neighbors in the reference layer, {@code NaN} when none.
     */
    static double barycenter(FlowGraph graph, FlowNode node, int referenceLayer, boolean fromPredecessors) {
        IntList edgeIds = fromPredecessors ? graph.inEdgeIds(node.index()) : graph.outEdgeIds(node.index());
        double sum = 0.0d;
        int count = 0;
        for (int k = 0; k < edgeIds.size(); k++) {
            FlowEdge edge = graph.edge(edgeIds.getInt(k));
            if (edge.backward()) {
                continue;
            }
            FlowNode neighbor = graph.node(fromPredecessors ? edge.source() : edge.target());
            if (neighbor.layer() == referenceLayer) {
                sum += neighbor.verticalPosition();
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    private record Ranked(FlowNode node, double barycenter) {
    }
}
