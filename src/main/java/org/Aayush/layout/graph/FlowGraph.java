package org.Aayush.layout.graph;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory directed multigraph carrying flow values and layout attributes.
 *
 * <p>The graph is the owned value threaded through every layout stage. Stages mutate
 * it only through the methods below; nothing is shared through static state.</p>
 * <ul>
 * <li>Nodes are indexed densely in insertion order and are never removed.</li>
 * <li>Edges keep a stable id and are iterated in insertion (or restoration) order.</li>
 * <li>{@code inValue}/{@code outValue} of both endpoints are recomputed on every edge
 * insertion or removal.</li>
 * <li>Extra node attributes live in a side-map keyed by node id and are never read by
 * the layout stages.</li>
 * </ul>
 */
public final class FlowGraph {
    private static final Comparator<FlowNode> BY_VERTICAL_POSITION =
            Comparator.comparingInt((FlowNode node) -> node.verticalPosition()).thenComparingInt(node -> node.index());

    private final List<FlowNode> nodes;
    private final Object2IntOpenHashMap<String> nodeIndex;
    private final List<IntArrayList> outEdges;
    private final List<IntArrayList> inEdges;
    private final Int2ObjectLinkedOpenHashMap<FlowEdge> edges;
    private final Map<String, Map<String, Object>> nodeAttributes;
    private int nextEdgeId;

    /**
     * Creates an empty graph.
     */
    public FlowGraph() {
        this.nodes = new ArrayList<>();
        this.nodeIndex = new Object2IntOpenHashMap<>();
        this.nodeIndex.defaultReturnValue(-1);
        this.outEdges = new ArrayList<>();
        this.inEdges = new ArrayList<>();
        this.edges = new Int2ObjectLinkedOpenHashMap<>();
        this.nodeAttributes = new HashMap<>();
    }

    /**
     * Builds a graph from a tabular record set.
     *
     * <p>Nodes are created in order of first appearance (source before target).</p>
     *
     * @param records flow records.
     * @return new graph with one edge per record.
     * @throws InvalidGraphException when a record misses its value or an endpoint id.
     */
    public static FlowGraph fromRecords(Collection<FlowRecord> records) {
        Objects.requireNonNull(records, "records");
        FlowGraph graph = new FlowGraph();
        int row = 0;
        for (FlowRecord record : records) {
            if (record.getValue() == null) {
                throw new InvalidGraphException(
                        InvalidGraphException.REASON_VALUE_REQUIRED,
                        "record " + row + " (" + record.getSource() + " -> " + record.getTarget() + ") has no value"
                );
            }
            graph.ensureNode(record.getSource());
            graph.ensureNode(record.getTarget());
            graph.addEdge(record.getSource(), record.getTarget(), record.getValue(), record.getAttributes());
            row++;
        }
        return graph;
    }

    /**
     * Exports the real flows of this graph as records.
     *
     * <p>Dummy chains are collapsed back into the edge they replaced; backward edges are
     * exported like any other edge.</p>
     *
     * @return one record per original edge, in edge order.
     */
    public List<FlowRecord> toRecords() {
        List<FlowRecord> records = new ArrayList<>(edges.size());
        for (FlowEdge edge : edges.values()) {
            if (edge.dummyChainSegment() && node(edge.source()).dummy()) {
                continue;
            }
            String target = edge.target();
            if (edge.dummyChainSegment()) {
                target = chainEnd(edge);
            }
            records.add(FlowRecord.builder()
                    .source(edge.source())
                    .target(target)
                    .value(edge.value())
                    .attributes(edge.attributes())
                    .build());
        }
        return records;
    }

    private String chainEnd(FlowEdge firstSegment) {
        String current = firstSegment.target();
        while (node(current).dummy()) {
            IntList out = outEdges.get(indexOf(current));
            if (out.isEmpty()) {
                break;
            }
            current = edges.get(out.getInt(0)).target();
        }
        return current;
    }

    // ========================================================================
    // NODES
    // ========================================================================

    /**
     * Adds a real node.
     *
     * @param id unique non-blank node id.
     * @return created node.
     * @throws InvalidGraphException when the id is blank or already present.
     */
    public FlowNode addNode(String id) {
        return insertNode(id, false);
    }

    /**
     * Adds a real node with extra pass-through attributes.
     */
    public FlowNode addNode(String id, Map<String, Object> attributes) {
        FlowNode node = insertNode(id, false);
        if (attributes != null && !attributes.isEmpty()) {
            nodeAttributes.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
        }
        return node;
    }

    /**
     * Adds a synthetic placeholder node used to route multi-layer edges.
     */
    public FlowNode addDummyNode(String id) {
        return insertNode(id, true);
    }

    /**
     * Returns the node with this id, adding a real node when absent.
     */
    public FlowNode ensureNode(String id) {
        int index = nodeIndex.getInt(id);
        return index >= 0 ? nodes.get(index) : insertNode(id, false);
    }

    private FlowNode insertNode(String id, boolean dummy) {
        if (id == null || id.isBlank()) {
            throw new InvalidGraphException(InvalidGraphException.REASON_BLANK_NODE_ID, "node id must be non-blank");
        }
        if (nodeIndex.containsKey(id)) {
            throw new InvalidGraphException(InvalidGraphException.REASON_DUPLICATE_NODE, "node already present: " + id);
        }
        FlowNode node = new FlowNode(id, nodes.size(), dummy);
        nodeIndex.put(id, node.index());
        nodes.add(node);
        outEdges.add(new IntArrayList());
        inEdges.add(new IntArrayList());
        return node;
    }

    public boolean containsNode(String id) {
        return nodeIndex.containsKey(id);
    }

    /**
     * Returns the node with this id.
     *
     * @throws InvalidGraphException when the id is unknown.
     */
    public FlowNode node(String id) {
        return nodes.get(indexOf(id));
    }

    public FlowNode nodeAt(int index) {
        return nodes.get(index);
    }

    /**
     * Returns the dense index of a node.
     *
     * @throws InvalidGraphException when the id is unknown.
     */
    public int indexOf(String id) {
        int index = nodeIndex.getInt(id);
        if (index < 0) {
            throw new InvalidGraphException(InvalidGraphException.REASON_UNKNOWN_NODE, "unknown node: " + id);
        }
        return index;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns all nodes in insertion order (read-only view).
     */
    public List<FlowNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Returns the pass-through attributes of a node, empty when none were given.
     */
    public Map<String, Object> nodeAttributes(String id) {
        indexOf(id);
        return nodeAttributes.getOrDefault(id, Map.of());
    }

    // ========================================================================
    // EDGES
    // ========================================================================

    /**
     * Adds an edge between two existing nodes.
     *
     * <p>Values are not validated here; {@link GraphValidator} enforces value rules before
     * a layout run.</p>
     *
     * @throws InvalidGraphException when either endpoint is unknown.
     */
    public FlowEdge addEdge(String source, String target, double value) {
        return addEdge(source, target, value, Map.of());
    }

    /**
     * Adds an edge with extra pass-through attributes.
     */
    public FlowEdge addEdge(String source, String target, double value, Map<String, Object> attributes) {
        return insertEdge(new FlowEdge(nextEdgeId, source, target, value, attributes, false, false));
    }

    /**
     * Adds one segment of a dummy chain.
     */
    public FlowEdge addChainSegment(String source, String target, double value, Map<String, Object> attributes) {
        return insertEdge(new FlowEdge(nextEdgeId, source, target, value, attributes, false, true));
    }

    /**
     * Re-adds a previously removed edge under its original id.
     *
     * @throws InvalidGraphException when an edge with the same id is present.
     */
    public FlowEdge restoreEdge(FlowEdge edge) {
        Objects.requireNonNull(edge, "edge");
        if (edges.containsKey(edge.id())) {
            throw new InvalidGraphException(InvalidGraphException.REASON_DUPLICATE_EDGE, "edge already present: " + edge.id());
        }
        return insertEdge(edge);
    }

    private FlowEdge insertEdge(FlowEdge edge) {
        int sourceIndex = indexOf(edge.source());
        int targetIndex = indexOf(edge.target());
        edges.put(edge.id(), edge);
        nextEdgeId = Math.max(nextEdgeId, edge.id() + 1);
        outEdges.get(sourceIndex).add(edge.id());
        inEdges.get(targetIndex).add(edge.id());
        refreshFlowValues(sourceIndex);
        refreshFlowValues(targetIndex);
        return edge;
    }

    /**
     * Removes an edge.
     *
     * @return removed edge.
     * @throws InvalidGraphException when the id is unknown.
     */
    public FlowEdge removeEdge(int edgeId) {
        FlowEdge edge = edges.remove(edgeId);
        if (edge == null) {
            throw new InvalidGraphException(InvalidGraphException.REASON_UNKNOWN_EDGE, "unknown edge: " + edgeId);
        }
        int sourceIndex = indexOf(edge.source());
        int targetIndex = indexOf(edge.target());
        outEdges.get(sourceIndex).rem(edgeId);
        inEdges.get(targetIndex).rem(edgeId);
        refreshFlowValues(sourceIndex);
        refreshFlowValues(targetIndex);
        return edge;
    }

    /**
     * Returns the edge with this id.
     *
     * @throws InvalidGraphException when the id is unknown.
     */
    public FlowEdge edge(int edgeId) {
        FlowEdge edge = edges.get(edgeId);
        if (edge == null) {
            throw new InvalidGraphException(InvalidGraphException.REASON_UNKNOWN_EDGE, "unknown edge: " + edgeId);
        }
        return edge;
    }

    public boolean containsEdge(int edgeId) {
        return edges.containsKey(edgeId);
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns a snapshot of all edges in iteration order.
     */
    public List<FlowEdge> edges() {
        return new ArrayList<>(edges.values());
    }

    /**
     * Outgoing edge ids of a node index (read-only view).
     */
    public IntList outEdgeIds(int nodeIndex) {
        return IntLists.unmodifiable(outEdges.get(nodeIndex));
    }

    /**
     * Incoming edge ids of a node index (read-only view).
     */
    public IntList inEdgeIds(int nodeIndex) {
        return IntLists.unmodifiable(inEdges.get(nodeIndex));
    }

    public List<FlowEdge> outEdges(String id) {
        return resolve(outEdges.get(indexOf(id)));
    }

    public List<FlowEdge> inEdges(String id) {
        return resolve(inEdges.get(indexOf(id)));
    }

    /**
     * Returns the number of incident edges, both directions.
     */
    public int degree(String id) {
        int index = indexOf(id);
        return outEdges.get(index).size() + inEdges.get(index).size();
    }

    private List<FlowEdge> resolve(IntList edgeIds) {
        List<FlowEdge> resolved = new ArrayList<>(edgeIds.size());
        for (int i = 0; i < edgeIds.size(); i++) {
            resolved.add(edges.get(edgeIds.getInt(i)));
        }
        return resolved;
    }

    private void refreshFlowValues(int index) {
        double in = 0.0d;
        IntArrayList incoming = inEdges.get(index);
        for (int i = 0; i < incoming.size(); i++) {
            in += edges.get(incoming.getInt(i)).value();
        }
        double out = 0.0d;
        IntArrayList outgoing = outEdges.get(index);
        for (int i = 0; i < outgoing.size(); i++) {
            out += edges.get(outgoing.getInt(i)).value();
        }
        FlowNode node = nodes.get(index);
        node.inValue(in);
        node.outValue(out);
    }

    // ========================================================================
    // LAYOUT ATTRIBUTES
    // ========================================================================

    public void assignLayer(String id, int layer) {
        if (layer < 0) {
            throw new IllegalArgumentException("layer must be >= 0, got " + layer + " for " + id);
        }
        node(id).layer(layer);
    }

    public void assignVerticalPosition(String id, int verticalPosition) {
        if (verticalPosition < 0) {
            throw new IllegalArgumentException("verticalPosition must be >= 0, got " + verticalPosition + " for " + id);
        }
        node(id).verticalPosition(verticalPosition);
    }

    public void assignY(String id, double y) {
        if (!Double.isFinite(y)) {
            throw new IllegalArgumentException("y must be finite, got " + y + " for " + id);
        }
        node(id).y(y);
    }

    /**
     * Returns the distinct assigned layers in ascending order.
     */
    public int[] layers() {
        IntSortedSet layers = new IntRBTreeSet();
        for (FlowNode node : nodes) {
            if (node.hasLayer()) {
                layers.add(node.layer());
            }
        }
        return layers.toIntArray();
    }

    /**
     * Returns the highest assigned layer, or {@link FlowNode#UNASSIGNED} when none is assigned.
     */
    public int maxLayer() {
        int max = FlowNode.UNASSIGNED;
        for (FlowNode node : nodes) {
            max = Math.max(max, node.layer());
        }
        return max;
    }

    /**
     * Returns the nodes of one layer ordered by vertical position, then insertion order.
     */
    public List<FlowNode> layerNodes(int layer) {
        List<FlowNode> layerNodes = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (node.layer() == layer) {
                layerNodes.add(node);
            }
        }
        layerNodes.sort(BY_VERTICAL_POSITION);
        return layerNodes;
    }

    /**
     * Returns a deep copy sharing no mutable state with this graph.
     */
    public FlowGraph copy() {
        FlowGraph copy = new FlowGraph();
        for (FlowNode node : nodes) {
            FlowNode nodeCopy = node.copy();
            copy.nodeIndex.put(nodeCopy.id(), nodeCopy.index());
            copy.nodes.add(nodeCopy);
            copy.outEdges.add(new IntArrayList(outEdges.get(node.index())));
            copy.inEdges.add(new IntArrayList(inEdges.get(node.index())));
        }
        copy.edges.putAll(edges);
        copy.nodeAttributes.putAll(nodeAttributes);
        copy.nextEdgeId = nextEdgeId;
        return copy;
    }
}
