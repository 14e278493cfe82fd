package org.Aayush.layout.crossing;

/**
 * Observer for crossing-reduction progress.
 */
@FunctionalInterface
public interface CrossingReductionListener {

    CrossingReductionListener NO_OP = event -> {
    };

    /**
     * Called once per completed sweep, on the calling thread.
     *
     * @param event sweep snapshot.
     */
    void onSweep(SweepEvent event);
}
