package org.Aayush.layout.graph;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reports nodes whose inflow and outflow disagree.
 *
 * <p>Pure sources and pure sinks are never reported.</p>
 */
@Slf4j
@UtilityClass
public class FlowBalanceInspector {
    public static final double DEFAULT_MAX_IMBALANCE = 0.05d;
    private static final double EPSILON = 1e-6d;

    /**
     * Collects imbalance warnings using {@link #DEFAULT_MAX_IMBALANCE}.
     */
    public static List<LayoutWarning> inspect(FlowGraph graph) {
        return inspect(graph, DEFAULT_MAX_IMBALANCE);
    }

    /**
     * Collects one warning per real node with
     * {@code |in - out| / (max(in, out) + 1e-6) > maxImbalance}.
     *
     * @param graph graph with up-to-date flow values.
     * @param maxImbalance relative tolerance, {@code >= 0}.
     * @return warnings in node order.
     */
    public static List<LayoutWarning> inspect(FlowGraph graph, double maxImbalance) {
        if (!(maxImbalance >= 0.0d)) {
            throw new IllegalArgumentException("maxImbalance must be >= 0");
        }
        List<LayoutWarning> warnings = new ArrayList<>();
        for (FlowNode node : graph.nodes()) {
            if (node.dummy() || node.inValue() * node.outValue() <= 0.0d) {
                continue;
            }
            double imbalance = Math.abs(node.inValue() - node.outValue()) / (node.maxValue() + EPSILON);
            if (imbalance > maxImbalance) {
                String message = String.format(
                        Locale.ROOT,
                        "imbalanced node %s: inflow %.2f / outflow %.2f",
                        node.id(),
                        node.inValue(),
                        node.outValue()
                );
                log.warn("Imbalanced node {}: inflow {} / outflow {}", node.id(), node.inValue(), node.outValue());
                warnings.add(new LayoutWarning(LayoutWarning.Kind.IMBALANCED_NODE, node.id(), message));
            }
        }
        return warnings;
    }
}
