package com.bko.gateway.plan;

import java.util.List;

public record SequenceNode(List<PlanNode> nodes) implements PlanNode {

    public SequenceNode {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
