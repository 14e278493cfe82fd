package org.Aayush.layout.layer;

/**
 * Direction nodes are pushed to during layer assignment.
 *
 * <p>{@code LEFT}: every node sits at its earliest feasible layer (longest path from a source).</p>
 * <p>{@code RIGHT}: every node sits at its latest feasible layer (longest path to a sink,
 * measured back from the rightmost column).</p>
 */
public enum LayerAlignment {
    LEFT,
    RIGHT
}
