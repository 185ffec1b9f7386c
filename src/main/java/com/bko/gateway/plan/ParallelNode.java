package com.bko.gateway.plan;

import java.util.List;

public record ParallelNode(List<PlanNode> nodes) implements PlanNode {

    public ParallelNode {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
