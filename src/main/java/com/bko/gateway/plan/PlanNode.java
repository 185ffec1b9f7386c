package com.bko.gateway.plan;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One node of a query plan. The set of node kinds is closed; the executor dispatches over
 * exactly these four variants.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SequenceNode.class, name = "Sequence"),
        @JsonSubTypes.Type(value = ParallelNode.class, name = "Parallel"),
        @JsonSubTypes.Type(value = FlattenNode.class, name = "Flatten"),
        @JsonSubTypes.Type(value = FetchNode.class, name = "Fetch")
})
public sealed interface PlanNode permits SequenceNode, ParallelNode, FlattenNode, FetchNode {
}
