package org.Aayush.layout.core;

/**
 * Drawing coordinates of one node in a thin layout.
 *
 * @param layer column index.
 * @param y vertical center.
 */
public record NodePlacement(int layer, double y) {
}
