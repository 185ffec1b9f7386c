package com.bko.gateway.execution;

import com.bko.gateway.config.GatewayProperties;
import com.bko.gateway.datasource.DownstreamServiceException;
import com.bko.gateway.datasource.GraphQLDataSource;
import com.bko.gateway.datasource.ServiceError;
import com.bko.gateway.datasource.ServiceRequest;
import com.bko.gateway.datasource.ServiceResponse;
import com.bko.gateway.execution.model.ExecutionResponse;
import com.bko.gateway.execution.model.GatewayError;
import com.bko.gateway.execution.model.OperationContext;
import com.bko.gateway.execution.model.RequestContext;
import com.bko.gateway.plan.FetchNode;
import com.bko.gateway.plan.FlattenNode;
import com.bko.gateway.plan.ParallelNode;
import com.bko.gateway.plan.PlanNode;
import com.bko.gateway.plan.QueryPlan;
import com.bko.gateway.plan.ResponsePath;
import com.bko.gateway.plan.SequenceNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.bko.gateway.execution.ExecutionConstants.CODE_INTERNAL_SERVER_ERROR;
import static com.bko.gateway.execution.ExecutionConstants.ENTITIES_COUNT_MISMATCH_MESSAGE;
import static com.bko.gateway.execution.ExecutionConstants.ENTITIES_FIELD;
import static com.bko.gateway.execution.ExecutionConstants.ENTITIES_NOT_A_LIST_MESSAGE;
import static com.bko.gateway.execution.ExecutionConstants.FETCH_FAILED_MESSAGE;

/**
 * Interprets a query plan: runs its fetches against the named services, stitches their
 * results into one response tree and collects every downstream failure as an error with
 * the path it affects.
 *
 * <p>A failing fetch never fails the execution. Whatever data could be assembled is returned
 * together with the errors; sibling and later nodes keep running.
 */
@Service
@Slf4j
public class QueryPlanExecutor {

    private final RepresentationBuilder representationBuilder;
    private final ResultMerger resultMerger;
    private final ResponseShaper responseShaper;
    private final ExecutionMetricsService metricsService;
    private final GatewayProperties properties;

    public QueryPlanExecutor(RepresentationBuilder representationBuilder,
                             ResultMerger resultMerger,
                             ResponseShaper responseShaper,
                             ExecutionMetricsService metricsService,
                             GatewayProperties properties) {
        this.representationBuilder = representationBuilder;
        this.resultMerger = resultMerger;
        this.responseShaper = responseShaper;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public CompletableFuture<ExecutionResponse> executeQueryPlan(QueryPlan plan,
                                                                 Map<String, GraphQLDataSource> serviceMap,
                                                                 RequestContext requestContext,
                                                                 OperationContext operationContext) {
        Execution execution = new Execution(
                serviceMap == null ? Map.of() : serviceMap,
                requestContext == null ? RequestContext.empty() : requestContext,
                operationContext == null ? OperationContext.empty() : operationContext,
                new ResponseTree(resultMerger),
                new ErrorCollector());
        metricsService.recordPlanStarted();
        CompletableFuture<Void> completion = plan == null || plan.node() == null
                ? CompletableFuture.completedFuture(null)
                : executeNode(execution, plan.node(), ExecutionScope.root(execution.tree()));
        return completion.thenApply(ignored -> assemble(execution));
    }

    private CompletableFuture<Void> executeNode(Execution execution, PlanNode node, ExecutionScope scope) {
        if (node instanceof SequenceNode sequence) {
            return executeSequence(execution, sequence, scope);
        }
        if (node instanceof ParallelNode parallel) {
            return executeParallel(execution, parallel, scope);
        }
        if (node instanceof FlattenNode flatten) {
            return executeNode(execution, flatten.node(), scope.flatten(flatten.path(), execution.tree()));
        }
        if (node instanceof FetchNode fetch) {
            return executeFetch(execution, fetch, scope);
        }
        throw new IllegalStateException("Unknown plan node kind: " + node);
    }

    private CompletableFuture<Void> executeSequence(Execution execution, SequenceNode sequence, ExecutionScope scope) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PlanNode child : sequence.nodes()) {
            chain = chain.thenCompose(ignored -> executeNode(execution, child, scope));
        }
        return chain;
    }

    private CompletableFuture<Void> executeParallel(Execution execution, ParallelNode parallel, ExecutionScope scope) {
        CompletableFuture<?>[] children = parallel.nodes().stream()
                .map(child -> executeNode(execution, child, scope))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(children);
    }

    private CompletableFuture<Void> executeFetch(Execution execution, FetchNode fetch, ExecutionScope scope) {
        if (scope.locations().isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Map<String, Object> variables = selectVariables(fetch, execution.requestContext());
        GraphQLDataSource dataSource = execution.serviceMap().get(fetch.serviceName());
        if (dataSource == null) {
            log.warn("No service named {} in the service map.", fetch.serviceName());
            recordFetchFailure(execution, fetch, variables, scope.errorPrefix(), null);
            return CompletableFuture.completedFuture(null);
        }
        if (fetch.isEntityFetch()) {
            return executeEntityFetch(execution, fetch, scope, dataSource, variables);
        }
        ServiceRequest request = new ServiceRequest(fetch.operation(), fetch.operationName(), variables, null);
        metricsService.recordFetch(fetch.serviceName(), 0);
        return invoke(dataSource, request).handle((response, failure) -> {
            if (failure != null) {
                recordFetchFailure(execution, fetch, variables, scope.errorPrefix(), failure);
                return null;
            }
            try {
                List<Object> prefix = scope.errorPrefix();
                List<GatewayError> errors = new ArrayList<>(response.errors().size());
                for (ServiceError error : response.errors()) {
                    errors.add(downstreamError(error, ResponsePath.append(prefix, error.path()), fetch, variables));
                }
                record(execution, errors);
                if (response.data() != null) {
                    for (ResolvedLocation location : scope.locations()) {
                        execution.tree().merge(location, response.data());
                    }
                }
            } catch (RuntimeException ex) {
                recordFetchFailure(execution, fetch, variables, scope.errorPrefix(), ex);
            }
            return null;
        });
    }

    private CompletableFuture<Void> executeEntityFetch(Execution execution, FetchNode fetch, ExecutionScope scope,
                                                       GraphQLDataSource dataSource, Map<String, Object> variables) {
        List<Map<String, Object>> representations = new ArrayList<>();
        List<ResolvedLocation> origins = new ArrayList<>();
        execution.tree().read(() -> {
            for (ResolvedLocation location : scope.locations()) {
                representationBuilder.build(location.target(), fetch.requires(), fetch.typeCondition(),
                                execution.operationContext().schema())
                        .ifPresent(representation -> {
                            representations.add(representation);
                            origins.add(location);
                        });
            }
            return null;
        });
        if (representations.isEmpty()) {
            metricsService.recordFetchSkipped(fetch.serviceName());
            return CompletableFuture.completedFuture(null);
        }
        ServiceRequest request = new ServiceRequest(fetch.operation(), fetch.operationName(), variables,
                List.copyOf(representations));
        metricsService.recordFetch(fetch.serviceName(), representations.size());
        return invoke(dataSource, request).handle((response, failure) -> {
            if (failure != null) {
                recordFetchFailure(execution, fetch, variables, scope.errorPrefix(), failure);
                return null;
            }
            try {
                mergeEntities(execution, fetch, scope, variables, origins, response);
            } catch (RuntimeException ex) {
                recordFetchFailure(execution, fetch, variables, scope.errorPrefix(), ex);
            }
            return null;
        });
    }

    private void mergeEntities(Execution execution, FetchNode fetch, ExecutionScope scope,
                               Map<String, Object> variables, List<ResolvedLocation> origins,
                               ServiceResponse response) {
        List<GatewayError> errors = new ArrayList<>(response.errors().size());
        for (ServiceError error : response.errors()) {
            errors.add(downstreamError(error, entityErrorPath(error.path(), origins, scope), fetch, variables));
        }
        record(execution, errors);
        if (response.data() == null) {
            return;
        }
        Object entities = response.data().get(ENTITIES_FIELD);
        if (entities == null && response.hasErrors()) {
            return;
        }
        if (!(entities instanceof List<?> results)) {
            record(execution, List.of(gatewayError(ENTITIES_NOT_A_LIST_MESSAGE, scope.errorPrefix(),
                    CODE_INTERNAL_SERVER_ERROR, null, fetch, variables)));
            return;
        }
        if (results.size() != origins.size()) {
            record(execution, List.of(gatewayError(String.format(ENTITIES_COUNT_MISMATCH_MESSAGE, origins.size()),
                    scope.errorPrefix(), CODE_INTERNAL_SERVER_ERROR, null, fetch, variables)));
            return;
        }
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) instanceof Map<?, ?> entity) {
                execution.tree().merge(origins.get(i), ResultMerger.asObject(entity));
            }
        }
    }

    /**
     * Re-paths a service error reported under {@code _entities[i]} onto the location that
     * representation {@code i} was built from.
     */
    private List<Object> entityErrorPath(@Nullable List<Object> servicePath, List<ResolvedLocation> origins,
                                         ExecutionScope scope) {
        if (servicePath != null && servicePath.size() >= 2
                && ENTITIES_FIELD.equals(servicePath.get(0))
                && servicePath.get(1) instanceof Number index
                && index.intValue() >= 0 && index.intValue() < origins.size()) {
            return ResponsePath.append(origins.get(index.intValue()).path(), servicePath.subList(2, servicePath.size()));
        }
        return scope.errorPrefix();
    }

    private CompletableFuture<ServiceResponse> invoke(GraphQLDataSource dataSource, ServiceRequest request) {
        try {
            CompletableFuture<ServiceResponse> future = dataSource.process(request);
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Data source returned no result"));
            }
            return future;
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private Map<String, Object> selectVariables(FetchNode fetch, RequestContext requestContext) {
        Map<String, Object> variables = new LinkedHashMap<>();
        for (String name : fetch.variableUsages()) {
            if (requestContext.variables().containsKey(name)) {
                variables.put(name, requestContext.variables().get(name));
            }
        }
        return variables;
    }

    private void recordFetchFailure(Execution execution, FetchNode fetch, Map<String, Object> variables,
                                    List<Object> path, @Nullable Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        String message = String.format(FETCH_FAILED_MESSAGE, fetch.serviceName());
        String code = CODE_INTERNAL_SERVER_ERROR;
        if (cause instanceof DownstreamServiceException typed) {
            message = StringUtils.hasText(typed.getMessage()) ? typed.getMessage() : message;
            code = typed.getCode() != null ? typed.getCode() : code;
        }
        if (cause != null) {
            log.warn("Fetch from service {} failed: {}", fetch.serviceName(), cause.toString());
        }
        record(execution, List.of(gatewayError(message, path, code, null, fetch, variables)));
    }

    private GatewayError downstreamError(ServiceError error, List<Object> path, FetchNode fetch,
                                         Map<String, Object> variables) {
        Object code = error.extensions().get(GatewayError.CODE);
        String message = StringUtils.hasText(error.message())
                ? error.message()
                : String.format(FETCH_FAILED_MESSAGE, fetch.serviceName());
        return gatewayError(message, path, code != null ? code : CODE_INTERNAL_SERVER_ERROR,
                error.extensions(), fetch, variables);
    }

    private GatewayError gatewayError(String message, List<Object> path, Object code,
                                      @Nullable Map<String, Object> serviceExtensions,
                                      FetchNode fetch, Map<String, Object> variables) {
        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put(GatewayError.CODE, code);
        extensions.put(GatewayError.SERVICE_NAME, fetch.serviceName());
        extensions.put(GatewayError.QUERY, fetch.operation());
        extensions.put(GatewayError.VARIABLES, variables);
        if (serviceExtensions != null) {
            serviceExtensions.forEach(extensions::putIfAbsent);
        }
        return new GatewayError(message, path, extensions);
    }

    private void record(Execution execution, List<GatewayError> errors) {
        if (errors.isEmpty()) {
            return;
        }
        execution.errors().addAll(errors);
        metricsService.recordErrors(errors.size());
    }

    private ExecutionResponse assemble(Execution execution) {
        Map<String, Object> data = execution.tree().data();
        OperationContext operationContext = execution.operationContext();
        if (properties.getExecutor().isShapeResponse() && operationContext.operationDocument() != null) {
            try {
                data = responseShaper.shape(data, operationContext, execution.requestContext().variables());
            } catch (IllegalArgumentException ex) {
                log.warn("Returning unshaped response data: {}", ex.getMessage());
            }
        }
        List<GatewayError> errors = execution.errors().snapshot();
        metricsService.logSummary();
        return ExecutionResponse.of(data, errors);
    }

    private record Execution(
            Map<String, GraphQLDataSource> serviceMap,
            RequestContext requestContext,
            OperationContext operationContext,
            ResponseTree tree,
            ErrorCollector errors
    ) {
    }
}
