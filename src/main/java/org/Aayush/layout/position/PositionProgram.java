package org.Aayush.layout.position;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.layout.graph.FlowEdge;
import org.Aayush.layout.graph.FlowGraph;
import org.Aayush.layout.graph.FlowNode;
import org.Aayush.layout.position.solver.LinearProgram;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bendiness-minimizing position program over the connected layers of a graph.
 *
 * <p>Common part, for every modeled node {@code n} and forward edge {@code e = (u, v)}:</p>
 * <ul>
 * <li>{@code y_n} center coordinate, {@code d_n >= |y_n|} distance to the center line;</li>
 * <li>{@code b_e >= |y_u - y_v|} bendiness of the edge;</li>
 * <li>minimize {@code centering * sum(d_n) + bendiness * sum(b_e)}.</li>
 * </ul>
 * <p>The fixed-order variant adds {@code y_next - y_prev >= separation} along each layer's
 * current order. The joint variant instead adds a binary {@code after(a, b)} per ordered
 * node pair of a layer (exactly one of {@code after(a, b)}, {@code after(b, a)} holds,
 * big-M separation otherwise), and a binary crossing indicator per edge pair between
 * adjacent layers that is forced to 1 when the two edges swap order, weighted by the
 * crossing penalty.</p>
 */
final class PositionProgram {
    private final LinearProgram program;
    private final Object2IntOpenHashMap<String> yVariables;

    private PositionProgram(LinearProgram program, Object2IntOpenHashMap<String> yVariables) {
        this.program = program;
        this.yVariables = yVariables;
    }

    /**
     * Builds the LP with the within-layer order frozen.
     *
     * @param graph positioned graph.
     * @param layers modeled layers, each in current vertical order.
     * @param options objective weights and spacing.
     */
    static PositionProgram fixedOrder(FlowGraph graph, List<List<FlowNode>> layers, PositioningOptions options) {
        LinearProgram program = new LinearProgram("sugiyama-lp");
        double floor = LayerGeometry.separationFloor(graph);
        Object2IntOpenHashMap<String> y = addCommonTerms(graph, layers, options, program, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

        for (List<FlowNode> layerNodes : layers) {
            for (int i = 1; i < layerNodes.size(); i++) {
                FlowNode upper = layerNodes.get(i - 1);
                FlowNode lower = layerNodes.get(i);
                program.addConstraint("sep_" + upper.id() + "_" + lower.id(),
                                LayerGeometry.separation(upper, lower, options.getNodeGap(), floor),
                                Double.POSITIVE_INFINITY)
                        .setCoefficient(y.getInt(lower.id()), 1.0d)
                        .setCoefficient(y.getInt(upper.id()), -1.0d);
            }
        }
        return new PositionProgram(program, y);
    }

    /**
     * Builds the MILP choosing order and position together.
     *
     * @param graph positioned graph.
     * @param layers modeled layers.
     * @param options objective weights and spacing.
     */
    static PositionProgram jointOrder(FlowGraph graph, List<List<FlowNode>> layers, PositioningOptions options) {
        LinearProgram program = new LinearProgram("sugiyama-milp");
        double floor = LayerGeometry.separationFloor(graph);

        double halfRange = 0.0d;
        double maxSeparation = floor;
        for (List<FlowNode> layerNodes : layers) {
            double extent = 0.0d;
            for (FlowNode node : layerNodes) {
                extent += 2.0d * node.maxValue() + Math.max(options.getNodeGap(), 0.0d) + floor;
                maxSeparation = Math.max(maxSeparation, 2.0d * node.maxValue() + options.getNodeGap());
            }
            halfRange = Math.max(halfRange, extent);
        }
        double bigM = 2.0d * halfRange + maxSeparation + 1.0d;
        Object2IntOpenHashMap<String> y = addCommonTerms(graph, layers, options, program, -halfRange, halfRange);

        Map<String, Integer> after = new HashMap<>();
        for (List<FlowNode> layerNodes : layers) {
            for (FlowNode a : layerNodes) {
                for (FlowNode b : layerNodes) {
                    if (a != b) {
                        after.put(pairKey(a.id(), b.id()), program.addBinary("after_" + a.id() + "_" + b.id()));
                    }
                }
            }
            for (int i = 0; i < layerNodes.size(); i++) {
                for (int j = 0; j < layerNodes.size(); j++) {
                    if (i == j) {
                        continue;
                    }
                    FlowNode a = layerNodes.get(i);
                    FlowNode b = layerNodes.get(j);
                    double separation = LayerGeometry.separation(a, b, options.getNodeGap(), floor);
                    // after(a, b) = 1  =>  y_a - y_b >= separation
                    program.addConstraint("order_" + a.id() + "_" + b.id(), separation - bigM, Double.POSITIVE_INFINITY)
                            .setCoefficient(y.getInt(a.id()), 1.0d)
                            .setCoefficient(y.getInt(b.id()), -1.0d)
                            .setCoefficient(after.get(pairKey(a.id(), b.id())), -bigM);
                    if (i < j) {
                        program.addConstraint("either_" + a.id() + "_" + b.id(), 1.0d, 1.0d)
                                .setCoefficient(after.get(pairKey(a.id(), b.id())), 1.0d)
                                .setCoefficient(after.get(pairKey(b.id(), a.id())), 1.0d);
                    }
                }
            }
        }

        for (int l = 1; l < layers.size(); l++) {
            List<FlowEdge> between = edgesBetween(graph, layers.get(l - 1), layers.get(l));
            for (int i = 0; i < between.size(); i++) {
                FlowEdge first = between.get(i);
                for (int j = i + 1; j < between.size(); j++) {
                    FlowEdge second = between.get(j);
                    if (first.source().equals(second.source()) || first.target().equals(second.target())) {
                        continue;
                    }
                    int crossing = program.addBinary("cross_" + first.id() + "_" + second.id());
                    program.setObjective(crossing, options.getCrossingWeight());
                    program.addConstraint("crossA_" + first.id() + "_" + second.id(), Double.NEGATIVE_INFINITY, 1.0d)
                            .setCoefficient(after.get(pairKey(first.source(), second.source())), 1.0d)
                            .setCoefficient(after.get(pairKey(second.target(), first.target())), 1.0d)
                            .setCoefficient(crossing, -1.0d);
                    program.addConstraint("crossB_" + first.id() + "_" + second.id(), Double.NEGATIVE_INFINITY, 1.0d)
                            .setCoefficient(after.get(pairKey(second.source(), first.source())), 1.0d)
                            .setCoefficient(after.get(pairKey(first.target(), second.target())), 1.0d)
                            .setCoefficient(crossing, -1.0d);
                }
            }
        }
        return new PositionProgram(program, y);
    }

    private static Object2IntOpenHashMap<String> addCommonTerms(
            FlowGraph graph,
            List<List<FlowNode>> layers,
            PositioningOptions options,
            LinearProgram program,
            double lowerY,
            double upperY
    ) {
        Object2IntOpenHashMap<String> y = new Object2IntOpenHashMap<>();
        y.defaultReturnValue(-1);
        for (List<FlowNode> layerNodes : layers) {
            for (FlowNode node : layerNodes) {
                int yVar = program.addContinuous("y_" + node.id(), lowerY, upperY);
                int distance = program.addContinuous("center_" + node.id(), 0.0d, Double.POSITIVE_INFINITY);
                program.setObjective(distance, options.getCenteringWeight());
                program.addConstraint("centerPos_" + node.id(), Double.NEGATIVE_INFINITY, 0.0d)
                        .setCoefficient(yVar, 1.0d)
                        .setCoefficient(distance, -1.0d);
                program.addConstraint("centerNeg_" + node.id(), Double.NEGATIVE_INFINITY, 0.0d)
                        .setCoefficient(yVar, -1.0d)
                        .setCoefficient(distance, -1.0d);
                y.put(node.id(), yVar);
            }
        }
        for (FlowEdge edge : graph.edges()) {
            int source = y.getInt(edge.source());
            int target = y.getInt(edge.target());
            if (edge.backward() || source < 0 || target < 0) {
                continue;
            }
            int bend = program.addContinuous("bend_" + edge.id(), 0.0d, Double.POSITIVE_INFINITY);
            program.setObjective(bend, options.getBendinessWeight());
            program.addConstraint("bendDown_" + edge.id(), Double.NEGATIVE_INFINITY, 0.0d)
                    .setCoefficient(source, 1.0d)
                    .setCoefficient(target, -1.0d)
                    .setCoefficient(bend, -1.0d);
            program.addConstraint("bendUp_" + edge.id(), Double.NEGATIVE_INFINITY, 0.0d)
                    .setCoefficient(target, 1.0d)
                    .setCoefficient(source, -1.0d)
                    .setCoefficient(bend, -1.0d);
        }
        return y;
    }

    private static List<FlowEdge> edgesBetween(FlowGraph graph, List<FlowNode> upstream, List<FlowNode> downstream) {
        int downstreamLayer = downstream.get(0).layer();
        List<FlowEdge> between = new ArrayList<>();
        for (FlowNode node : upstream) {
            for (FlowEdge edge : graph.outEdges(node.id())) {
                if (!edge.backward() && graph.node(edge.target()).layer() == downstreamLayer) {
                    between.add(edge);
                }
            }
        }
        return between;
    }

    private static String pairKey(String first, String second) {
        return first + "\u0000" + second;
    }

    LinearProgram program() {
        return program;
    }

    /**
     * Returns the solved y of a node.
     */
    double y(double[] solution, String nodeId) {
        return solution[yVariables.getInt(nodeId)];
    }
}
