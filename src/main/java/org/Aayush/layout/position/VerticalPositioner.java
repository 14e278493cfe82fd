package org.Aayush.layout.position;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;
import org.Aayush.layout.graph.LayoutException;
import org.Aayush.layout.graph.LayoutWarning;
import org.Aayush.layout.position.solver.OptimizationInfeasibleException;
import org.Aayush.layout.position.solver.OptimizationSolver;
import org.Aayush.layout.position.solver.OptimizationTimeoutException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts within-layer order into y coordinates.
 *
 * <p>The strategy is picked once per run from {@link PositioningOptions#getMode()}.
 * Optimizing strategies model only nodes with a forward edge. Afterwards edgeless nodes
 * are stacked below the linked nodes of their layer, edgeless layers are centered on
 * {@code y = 0}, and both are reported. Solver
 * infeasibility or timeout is recovered locally: the graph keeps its crossing-reduced
 * order, receives heuristic positions and the outcome carries an
 * {@code OPTIMIZATION_FALLBACK} warning.</p>
 */
@Slf4j
public final class VerticalPositioner {
    private final OptimizationSolver solver;

    public VerticalPositioner(OptimizationSolver solver) {
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    /**
     * Assigns y (and in MILP mode possibly a new order) to every node.
     *
     * @param graph layered, dummy-expanded graph with vertical positions; mutated in place.
     * @param options strategy, budget and objective weights.
     * @return requested/effective strategy and non-fatal warnings.
     */
    public PositioningOutcome position(FlowGraph graph, PositioningOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(options, "options");
        VerticalPositioning mode = options.getMode();
        switch (mode) {
            case BARYCENTER_HEURISTIC:
                return new PositioningOutcome(mode, mode, HeuristicPositioner.assign(graph, options.getNodeGap()));
            case LP:
            case MILP:
                return optimize(graph, options);
            default:
                throw new IllegalStateException("Unhandled positioning mode " + mode);
        }
    }

    private PositioningOutcome optimize(FlowGraph graph, PositioningOptions options) {
        VerticalPositioning mode = options.getMode();
        List<List<FlowNode>> modeled = new ArrayList<>();
        List<List<FlowNode>> partial = new ArrayList<>();
        List<List<FlowNode>> disconnected = new ArrayList<>();
        for (int layer : graph.layers()) {
            List<FlowNode> layerNodes = graph.layerNodes(layer);
            List<FlowNode> linked = LayerGeometry.linkedNodes(graph, layerNodes);
            if (linked.isEmpty()) {
                disconnected.add(layerNodes);
                continue;
            }
            modeled.add(linked);
            if (linked.size() < layerNodes.size()) {
                partial.add(layerNodes);
            }
        }

        if (!modeled.isEmpty()) {
            PositionProgram positionProgram = mode == VerticalPositioning.MILP
                    ? PositionProgram.jointOrder(graph, modeled, options)
                    : PositionProgram.fixedOrder(graph, modeled, options);
            double[] solution;
            try {
                solution = solver.minimize(positionProgram.program(), options.getBudget());
            } catch (OptimizationInfeasibleException | OptimizationTimeoutException ex) {
                return fallBack(graph, options, ex);
            }
            for (List<FlowNode> linked : modeled) {
                for (FlowNode node : linked) {
                    graph.assignY(node.id(), positionProgram.y(solution, node.id()));
                }
                if (mode == VerticalPositioning.MILP) {
                    // solved order wins over the crossing-reduced one
                    LayerGeometry.rankByY(graph, linked);
                }
            }
        }

        List<LayoutWarning> warnings = new ArrayList<>();
        double floor = LayerGeometry.separationFloor(graph);
        for (List<FlowNode> layerNodes : partial) {
            List<FlowNode> linked = LayerGeometry.linkedNodes(graph, layerNodes);
            warnings.add(HeuristicPositioner.placeIsolated(graph, layerNodes, linked, options.getNodeGap(), floor));
        }
        for (List<FlowNode> layerNodes : disconnected) {
            LayerGeometry.placeCentered(graph, layerNodes, options.getNodeGap(), floor, 0.0d);
            warnings.add(HeuristicPositioner.disconnectedLayerWarning(layerNodes));
        }
        log.debug("{} positioning done: {} modeled layer(s), {} centered", mode, modeled.size(), disconnected.size());
        return new PositioningOutcome(mode, mode, warnings);
    }

    private static PositioningOutcome fallBack(FlowGraph graph, PositioningOptions options, LayoutException cause) {
        log.warn("{} positioning failed ({}); using heuristic positions", options.getMode(), cause.getMessage());
        List<LayoutWarning> warnings = new ArrayList<>();
        warnings.add(new LayoutWarning(LayoutWarning.Kind.OPTIMIZATION_FALLBACK, options.getMode().name(),
                options.getMode() + " positioning failed (" + cause.getMessage() + "); using heuristic positions"));
        warnings.addAll(HeuristicPositioner.assign(graph, options.getNodeGap()));
        return new PositioningOutcome(options.getMode(), VerticalPositioning.BARYCENTER_HEURISTIC, warnings);
    }
}
