package com.bko.gateway.plan;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A selection of a fetch's {@code requires} set: the fields read from an entity to build
 * its representation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FieldSelection.class, name = "Field"),
        @JsonSubTypes.Type(value = InlineFragmentSelection.class, name = "InlineFragment")
})
public sealed interface Selection permits FieldSelection, InlineFragmentSelection {
}
