package com.bko.gateway.plan;

import java.util.List;

public record InlineFragmentSelection(String typeCondition, List<Selection> selections) implements Selection {

    public InlineFragmentSelection {
        selections = selections == null ? List.of() : List.copyOf(selections);
    }
}
