package org.Aayush.layout.graph;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * One node of a {@link FlowGraph} with the attributes the layout stages fill in.
 *
 * <p>Flow values are kept in sync by the owning graph whenever an incident edge is
 * added or removed. Layout attributes start unassigned ({@link #UNASSIGNED} or
 * {@code NaN}) and are written through the graph's {@code assign*} methods.</p>
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@Accessors(fluent = true)
public final class FlowNode {
    public static final int UNASSIGNED = -1;

    private final String id;
    private final int index;
    private final boolean dummy;

    private int layer = UNASSIGNED;
    private int verticalPosition = UNASSIGNED;
    private double y = Double.NaN;

    private double inValue;
    private double outValue;

    FlowNode(String id, int index, boolean dummy) {
        this.id = id;
        this.index = index;
        this.dummy = dummy;
    }

    /**
     * Returns {@code max(inValue, outValue)}, the node size used by rendering and spacing.
     */
    public double maxValue() {
        return Math.max(inValue, outValue);
    }

    /**
     * Returns whether a layer has been assigned.
     */
    public boolean hasLayer() {
        return layer != UNASSIGNED;
    }

    FlowNode copy() {
        FlowNode copy = new FlowNode(id, index, dummy);
        copy.layer = layer;
        copy.verticalPosition = verticalPosition;
        copy.y = y;
        copy.inValue = inValue;
        copy.outValue = outValue;
        return copy;
    }

    @Override
    public String toString() {
        return "FlowNode{" + id + ", layer=" + layer + ", pos=" + verticalPosition + (dummy ? ", dummy" : "") + "}";
    }
}
