package org.Aayush.layout.position;

import lombok.Builder;
import lombok.Value;
import org.Aayush.layout.position.solver.SolverBudget;

/**
 * Parameters of one vertical positioning run.
 */
@Value
@Builder
public class PositioningOptions {
    /** Requested strategy. */
    @Builder.Default
    VerticalPositioning mode = VerticalPositioning.BARYCENTER_HEURISTIC;

    /** Solver limits for the optimizing strategies. */
    @Builder.Default
    SolverBudget budget = SolverBudget.unbounded();

    /** Objective weight of total edge bendiness. */
    @Builder.Default
    double bendinessWeight = 2.0d;

    /** Objective weight of total distance to the center line. */
    @Builder.Default
    double centeringWeight = 1.0d;

    /** Objective weight of each crossing edge pair (MILP only). */
    @Builder.Default
    double crossingWeight = 200.0d;

    /** Extra space between neighbouring nodes on top of their sizes. */
    @Builder.Default
    double nodeGap = 0.0d;
}
