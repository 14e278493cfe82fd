package org.Aayush.layout.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One row of a tabular (source, target, value, ...) flow record set.
 */
@Value
@Builder
public class FlowRecord {
    /** Source node id. */
    String source;
    /** Target node id. */
    String target;
    /** Flow magnitude; required. */
    Double value;
    /** Extra columns, passed through to the edge untouched. */
    @Singular
    Map<String, Object> attributes;
}
