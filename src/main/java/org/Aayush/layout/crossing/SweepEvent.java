package org.Aayush.layout.crossing;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable progress snapshot emitted after each crossing-reduction sweep.
 */
@Value
@Builder
public class SweepEvent {
    /** Zero-based sweep index. */
    int sweepIndex;
    /** Direction of this sweep. */
    SweepDirection direction;
    /** Number of nodes whose vertical position changed in this sweep. */
    int positionChanges;
    /** Crossing count before the sweep. */
    long crossingsBefore;
    /** Crossing count after the sweep. */
    long crossingsAfter;
}
