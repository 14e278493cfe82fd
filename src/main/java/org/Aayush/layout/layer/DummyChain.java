package org.Aayush.layout.layer;

import org.Aayush.layout.graph.FlowEdge;

import java.util.List;

/**
 * One multi-layer edge and the placeholder chain that replaced it.
 *
 * @param original removed edge.
 * @param dummyNodeIds synthetic node ids from source side to target side.
 * @param segments chain edges from source side to target side.
 */
public record DummyChain(FlowEdge original, List<String> dummyNodeIds, List<FlowEdge> segments) {

    public DummyChain {
        dummyNodeIds = List.copyOf(dummyNodeIds);
        segments = List.copyOf(segments);
    }
}
