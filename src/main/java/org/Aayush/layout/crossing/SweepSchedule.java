package org.Aayush.layout.crossing;

import lombok.Value;

/**
 * Sweep count bounds for the crossing reducer.
 *
 * <p>A fixed schedule ({@code min == max}) runs exactly that many sweeps. A range runs at
 * least {@code min} sweeps, stops once the order has stabilized, and never runs more
 * than {@code max}.</p>
 */
@Value
public class SweepSchedule {
    int minSweeps;
    int maxSweeps;

    private SweepSchedule(int minSweeps, int maxSweeps) {
        if (minSweeps < 0) {
            throw new IllegalArgumentException("minSweeps must be >= 0, got " + minSweeps);
        }
        if (maxSweeps < minSweeps) {
            throw new IllegalArgumentException("maxSweeps must be >= minSweeps, got " + minSweeps + ".." + maxSweeps);
        }
        this.minSweeps = minSweeps;
        this.maxSweeps = maxSweeps;
    }

    /**
     * Exactly {@code sweeps} sweeps; {@code 0} keeps the initial order.
     */
    public static SweepSchedule fixed(int sweeps) {
        return new SweepSchedule(sweeps, sweeps);
    }

    /**
     * Between {@code min} and {@code max} sweeps with early stop on stabilization.
     */
    public static SweepSchedule range(int min, int max) {
        return new SweepSchedule(min, max);
    }

    public boolean isFixed() {
        return minSweeps == maxSweeps;
    }
}
