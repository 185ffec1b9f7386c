package com.bko.gateway.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record FieldSelection(String name, String alias, List<Selection> selections) implements Selection {

    public FieldSelection {
        selections = selections == null ? null : List.copyOf(selections);
    }

    public static FieldSelection field(String name) {
        return new FieldSelection(name, null, null);
    }

    public static FieldSelection field(String name, List<Selection> selections) {
        return new FieldSelection(name, null, selections);
    }

    @JsonIgnore
    public String responseName() {
        return alias != null && !alias.isBlank() ? alias : name;
    }

    @JsonIgnore
    public boolean hasSelections() {
        return selections != null && !selections.isEmpty();
    }
}
