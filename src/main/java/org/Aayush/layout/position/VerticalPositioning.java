package org.Aayush.layout.position;

/**
 * Vertical positioning strategies.
 *
 * <p>{@code BARYCENTER_HEURISTIC}: y stacked directly from the crossing reducer's order.</p>
 * <p>{@code LP}: order frozen, continuous y chosen to minimize bendiness plus centering.</p>
 * <p>{@code MILP}: order and y chosen jointly, also penalizing crossings.</p>
 */
public enum VerticalPositioning {
    BARYCENTER_HEURISTIC,
    LP,
    MILP
}
