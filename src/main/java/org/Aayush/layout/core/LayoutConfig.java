package org.Aayush.layout.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.layout.crossing.SweepSchedule;
import org.Aayush.layout.graph.FlowBalanceInspector;
import org.Aayush.layout.layer.LayerAlignment;
import org.Aayush.layout.position.PositioningOptions;
import org.Aayush.layout.position.VerticalPositioning;
import org.Aayush.layout.position.solver.SolverBudget;

/**
 * Immutable configuration of one layout run.
 *
 * <p>Defaults: right alignment, justified terminals, heuristic positioning,
 * 2 to 6 crossing-reduction sweeps and a solver budget read from system properties.</p>
 */
@Value
@Builder(toBuilder = true)
public class LayoutConfig {
    @Builder.Default
    LayerAlignment align = LayerAlignment.RIGHT;

    @Builder.Default
    boolean justify = true;

    @Builder.Default
    VerticalPositioning verticalPositioning = VerticalPositioning.BARYCENTER_HEURISTIC;

    @Builder.Default
    SweepSchedule sweeps = SweepSchedule.range(2, 6);

    @Builder.Default
    SolverBudget solverBudget = SolverBudget.defaults();

    @Builder.Default
    double bendinessWeight = 2.0d;

    @Builder.Default
    double centeringWeight = 1.0d;

    @Builder.Default
    double crossingWeight = 200.0d;

    @Builder.Default
    double nodeGap = 0.0d;

    /** Relative inflow/outflow mismatch above which a node is reported. */
    @Builder.Default
    double maxImbalance = FlowBalanceInspector.DEFAULT_MAX_IMBALANCE;

    public static LayoutConfig defaults() {
        return LayoutConfig.builder().build();
    }

    /**
     * Projects the positioning part of this configuration.
     */
    public PositioningOptions positioningOptions() {
        return PositioningOptions.builder()
                .mode(verticalPositioning)
                .budget(solverBudget)
                .bendinessWeight(bendinessWeight)
                .centeringWeight(centeringWeight)
                .crossingWeight(crossingWeight)
                .nodeGap(nodeGap)
                .build();
    }
}
