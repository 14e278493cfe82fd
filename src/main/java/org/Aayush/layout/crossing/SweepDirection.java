package org.Aayush.layout.crossing;

/**
 * Sweep direction across layers.
 *
 * <p>{@code FORWARD}: layer 1 to the last layer, ordering by predecessor positions.</p>
 * <p>{@code BACKWARD}: second-to-last layer down to layer 0, ordering by successor positions.</p>
 */
public enum SweepDirection {
    FORWARD,
    BACKWARD;

    /**
     * Direction used by the sweep with this zero-based index.
     */
    public static SweepDirection forSweep(int sweepIndex) {
        return sweepIndex % 2 == 0 ? FORWARD : BACKWARD;
    }
}
