package org.Aayush.layout.crossing;

import java.util.List;

/**
 * Summary of one crossing-reduction run.
 *
 * @param initialCrossings crossings of the initial order.
 * @param finalCrossings crossings of the order left by the last sweep.
 * @param sweeps per-sweep events in run order.
 * @param stabilized whether the run stopped early because the order stopped changing.
 */
public record CrossingReduction(long initialCrossings, long finalCrossings, List<SweepEvent> sweeps, boolean stabilized) {

    public CrossingReduction {
        sweeps = List.copyOf(sweeps);
    }

    public int sweepCount() {
        return sweeps.size();
    }
}
