package com.bko.gateway.datasource;

import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;
import graphql.GraphQLError;
import graphql.schema.GraphQLSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes requests in process against an executable graphql-java schema.
 */
public class LocalGraphQLDataSource implements GraphQLDataSource {

    private final GraphQL graphQL;

    public LocalGraphQLDataSource(GraphQLSchema schema) {
        this.graphQL = GraphQL.newGraphQL(schema).build();
    }

    @Override
    public CompletableFuture<ServiceResponse> process(ServiceRequest request) {
        ExecutionInput input = ExecutionInput.newExecutionInput()
                .query(request.query())
                .operationName(request.operationName())
                .variables(request.wireVariables())
                .build();
        return graphQL.executeAsync(input).thenApply(LocalGraphQLDataSource::toServiceResponse);
    }

    private static ServiceResponse toServiceResponse(ExecutionResult result) {
        List<ServiceError> errors = new ArrayList<>(result.getErrors().size());
        for (GraphQLError error : result.getErrors()) {
            errors.add(new ServiceError(error.getMessage(), error.getPath(), error.getExtensions()));
        }
        Map<String, Object> data = result.getData();
        return new ServiceResponse(data, errors);
    }
}
