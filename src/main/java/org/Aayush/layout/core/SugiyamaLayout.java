package org.Aayush.layout.core;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.layout.crossing.CrossingCounter;
import org.Aayush.layout.crossing.CrossingReducer;
import org.Aayush.layout.crossing.CrossingReduction;
import org.Aayush.layout.crossing.CrossingReductionListener;
import org.Aayush.layout.cycle.CycleReinserter;
import org.Aayush.layout.cycle.CycleRemoval;
import org.Aayush.layout.cycle.CycleResolver;
import org.Aayush.layout.graph.FlowBalanceInspector;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.GraphValidator;
import org.Aayush.layout.layer.DummyChain;
import org.Aayush.layout.layer.DummyNodeInserter;
import org.Aayush.layout.layer.LayerAssigner;
import org.Aayush.layout.position.PositioningOutcome;
import org.Aayush.layout.position.VerticalPositioner;
import org.Aayush.layout.position.solver.OjAlgoOptimizationSolver;
import org.Aayush.layout.position.solver.OptimizationSolver;

import java.util.List;
import java.util.Objects;

/**
 * Layered (Sugiyama) layout pipeline for flow graphs.
 *
 * <p>Stages run synchronously in order on a private copy of the input:
 * cycle removal, layer assignment, dummy insertion, crossing reduction, vertical
 * positioning and backward-edge reinsertion. The caller's graph is never mutated.
 * Instances are stateless apart from the solver and may be shared between threads
 * as long as the solver can be.</p>
 */
@Slf4j
public final class SugiyamaLayout {
    private final VerticalPositioner positioner;

    /**
     * Creates a pipeline backed by the ojalgo solver.
     */
    public SugiyamaLayout() {
        this(new OjAlgoOptimizationSolver());
    }

    public SugiyamaLayout(OptimizationSolver solver) {
        this.positioner = new VerticalPositioner(solver);
    }

    public LayoutResult layout(FlowGraph input, LayoutConfig config) {
        return layout(input, config, CrossingReductionListener.NO_OP);
    }

    /**
     * Lays out a copy of {@code input}.
     *
     * @param input source graph, left untouched.
     * @param config run configuration.
     * @param listener crossing-reduction progress observer.
     * @return attributed graph plus diagnostics.
     * @throws org.Aayush.layout.graph.InvalidGraphException on self-loops or invalid values.
     * @throws org.Aayush.layout.cycle.UnresolvableCycleException when cycle removal exceeds its bound.
     */
    public LayoutResult layout(FlowGraph input, LayoutConfig config, CrossingReductionListener listener) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(listener, "listener");

        FlowGraph graph = input.copy();
        LayoutResult.LayoutResultBuilder result = LayoutResult.builder().graph(graph);

        GraphValidator.validate(graph);
        result.warnings(FlowBalanceInspector.inspect(graph, config.getMaxImbalance()));
        CycleRemoval removal = CycleResolver.resolve(graph);

        int maxLayer = LayerAssigner.assign(graph, config.getAlign(), config.isJustify());
        List<DummyChain> chains = DummyNodeInserter.insert(graph);
        log.debug("layered {} node(s) into {} layer(s), {} dummy chain(s)", graph.nodeCount(), maxLayer + 1, chains.size());

        CrossingReducer.initialize(graph);
        CrossingReduction reduction = CrossingReducer.reduce(graph, config.getSweeps(), listener);

        PositioningOutcome outcome = positioner.position(graph, config.positioningOptions());
        long crossings = CrossingCounter.count(graph);
        List<FlowEdge> restored = CycleReinserter.reinsert(graph, removal);

        log.info(
                "layout done: nodes={}, edges={}, layers={}, backward={}, crossings={}, positioning={}{}",
                graph.nodeCount(),
                graph.edgeCount(),
                maxLayer + 1,
                restored.size(),
                crossings,
                outcome.effective(),
                outcome.degraded() ? " (requested " + outcome.requested() + ")" : ""
        );
        return result
                .backwardEdges(restored)
                .dummyChains(chains)
                .maxLayer(maxLayer)
                .crossingReduction(reduction)
                .finalCrossings(crossings)
                .requestedPositioning(outcome.requested())
                .effectivePositioning(outcome.effective())
                .warnings(outcome.warnings())
                .build();
    }
}
