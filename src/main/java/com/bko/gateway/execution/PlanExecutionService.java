package com.bko.gateway.execution;

import com.bko.gateway.datasource.GraphQLDataSource;
import com.bko.gateway.execution.model.ExecutionResponse;
import com.bko.gateway.execution.model.OperationContext;
import com.bko.gateway.execution.model.RequestContext;
import com.bko.gateway.plan.QueryPlan;
import graphql.language.Document;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Runs a supplied plan against the configured services and composed schema.
 */
@Service
@Slf4j
public class PlanExecutionService {

    private final QueryPlanExecutor queryPlanExecutor;
    private final Map<String, GraphQLDataSource> serviceMap;
    private final GraphQLSchema schema;

    public PlanExecutionService(QueryPlanExecutor queryPlanExecutor,
                                @Qualifier("serviceMap") Map<String, GraphQLDataSource> serviceMap,
                                ObjectProvider<GraphQLSchema> schemaProvider) {
        this.queryPlanExecutor = queryPlanExecutor;
        this.serviceMap = serviceMap;
        this.schema = schemaProvider.getIfAvailable();
    }

    public ExecutionResponse execute(QueryPlan plan, @Nullable String query, @Nullable String operationName,
                                     @Nullable Map<String, Object> variables) {
        Document document = parseOperation(query);
        OperationContext operationContext = new OperationContext(schema, document, operationName);
        return queryPlanExecutor
                .executeQueryPlan(plan, serviceMap, new RequestContext(variables), operationContext)
                .join();
    }

    @Nullable
    Document parseOperation(@Nullable String query) {
        if (!StringUtils.hasText(query)) {
            return null;
        }
        try {
            return Parser.parse(query);
        } catch (InvalidSyntaxException ex) {
            log.warn("Rejected operation document: {}", ex.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid operation document: " + ex.getMessage());
        }
    }
}
