package com.bko.gateway.execution;

public final class ExecutionConstants {

    private ExecutionConstants() {
    }

    // Well-known fields
    public static final String TYPENAME_FIELD = "__typename";
    public static final String ENTITIES_FIELD = "_entities";

    // Error codes
    public static final String CODE_INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";

    // Messages
    public static final String FETCH_FAILED_MESSAGE = "Error while fetching subquery from service \"%s\"";
    public static final String ENTITIES_NOT_A_LIST_MESSAGE = "Expected \"data._entities\" in response to be an array";
    public static final String ENTITIES_COUNT_MISMATCH_MESSAGE = "Expected \"data._entities\" to contain %d elements";
}
