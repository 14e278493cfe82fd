package org.Aayush.layout.graph;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Input checks run before any layout stage touches a graph.
 */
@UtilityClass
public class GraphValidator {

    /**
     * Validates edge structure and values.
     *
     * <ul>
     * <li>self-loops are rejected;</li>
     * <li>values must be finite and {@code >= 0};</li>
     * <li>a zero value is rejected when the edge is the only outgoing edge of its source or
     * the only incoming edge of its target, since that node would carry no flow at all.</li>
     * </ul>
     *
     * @param graph graph to check.
     * @throws InvalidGraphException on the first violation, in edge order.
     */
    public static void validate(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        for (FlowEdge edge : graph.edges()) {
            if (edge.isSelfLoop()) {
                throw new InvalidGraphException(
                        InvalidGraphException.REASON_SELF_LOOP,
                        "self-loop on node " + edge.source() + " is not supported"
                );
            }
            double value = edge.value();
            if (!Double.isFinite(value)) {
                throw new InvalidGraphException(
                        InvalidGraphException.REASON_NON_FINITE_VALUE,
                        "edge " + describe(edge) + " has non-finite value " + value
                );
            }
            if (value < 0.0d) {
                throw new InvalidGraphException(
                        InvalidGraphException.REASON_NEGATIVE_VALUE,
                        "edge " + describe(edge) + " has negative value " + value
                );
            }
            if (value == 0.0d && isSoleEdge(graph, edge)) {
                throw new InvalidGraphException(
                        InvalidGraphException.REASON_ZERO_SOLE_EDGE,
                        "edge " + describe(edge) + " has value 0 and is the only flow of one of its endpoints"
                );
            }
        }
    }

    private static boolean isSoleEdge(FlowGraph graph, FlowEdge edge) {
        return graph.outEdgeIds(graph.indexOf(edge.source())).size() == 1
                || graph.inEdgeIds(graph.indexOf(edge.target())).size() == 1;
    }

    static String describe(FlowEdge edge) {
        return edge.source() + " -> " + edge.target();
    }
}
