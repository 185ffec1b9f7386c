package com.bko.gateway.execution.model;

import graphql.language.Document;
import graphql.schema.GraphQLSchema;

/**
 * The composed schema and the parsed client operation a plan was built for. Both are
 * optional: without a schema type conditions match by exact name only, and without a
 * document the response tree is returned as assembled.
 */
public record OperationContext(GraphQLSchema schema, Document operationDocument, String operationName) {

    public static OperationContext of(GraphQLSchema schema, Document operationDocument) {
        return new OperationContext(schema, operationDocument, null);
    }

    public static OperationContext empty() {
        return new OperationContext(null, null, null);
    }
}
