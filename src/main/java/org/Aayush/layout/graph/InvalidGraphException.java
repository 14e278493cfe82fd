package org.Aayush.layout.graph;

/**
 * Structural or input failure of a flow graph. Always fatal: no partial layout is produced.
 */
public final class InvalidGraphException extends LayoutException {
    public static final String REASON_SELF_LOOP = "SELF_LOOP";
    public static final String REASON_NEGATIVE_VALUE = "NEGATIVE_VALUE";
    public static final String REASON_NON_FINITE_VALUE = "NON_FINITE_VALUE";
    public static final String REASON_VALUE_REQUIRED = "VALUE_REQUIRED";
    public static final String REASON_ZERO_SOLE_EDGE = "ZERO_SOLE_EDGE";
    public static final String REASON_UNKNOWN_NODE = "UNKNOWN_NODE";
    public static final String REASON_DUPLICATE_NODE = "DUPLICATE_NODE";
    public static final String REASON_BLANK_NODE_ID = "BLANK_NODE_ID";
    public static final String REASON_UNKNOWN_EDGE = "UNKNOWN_EDGE";
    public static final String REASON_DUPLICATE_EDGE = "DUPLICATE_EDGE";
    public static final String REASON_LAYER_REQUIRED = "LAYER_REQUIRED";
    public static final String REASON_LAYER_ORDER_VIOLATION = "LAYER_ORDER_VIOLATION";
    public static final String REASON_CYCLIC_GRAPH = "CYCLIC_GRAPH";

    /**
     * Creates a reason-coded graph failure.
     *
     * @param reasonCode one of the {@code REASON_*} constants.
     * @param message descriptive error message.
     */
    public InvalidGraphException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
