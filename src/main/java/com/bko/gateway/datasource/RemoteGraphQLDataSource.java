package com.bko.gateway.datasource;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Sends GraphQL requests to a backend service over HTTP. Calls run on the shared fetch
 * executor and are bounded by the configured service timeout.
 */
@Slf4j
public class RemoteGraphQLDataSource implements GraphQLDataSource {

    private final String serviceName;
    private final RestClient restClient;
    private final Executor fetchExecutor;
    private final Duration timeout;

    public RemoteGraphQLDataSource(String serviceName, RestClient restClient, Executor fetchExecutor, Duration timeout) {
        this.serviceName = serviceName;
        this.restClient = restClient;
        this.fetchExecutor = fetchExecutor;
        this.timeout = timeout;
    }

    public String getServiceName() {
        return serviceName;
    }

    @Override
    public CompletableFuture<ServiceResponse> process(ServiceRequest request) {
        CompletableFuture<ServiceResponse> future = CompletableFuture.supplyAsync(() -> send(request), fetchExecutor);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return future;
        }
        return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    ServiceResponse send(ServiceRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", request.query());
        if (StringUtils.hasText(request.operationName())) {
            body.put("operationName", request.operationName());
        }
        body.put("variables", request.wireVariables());
        log.debug("Sending request to service {} (entities={}).", serviceName,
                request.isEntityRequest() ? request.representations().size() : 0);
        ServiceResponse response = restClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value(), (req, res) -> {
                    throw DownstreamServiceException.unauthenticated(
                            "Service \"" + serviceName + "\" rejected the request as unauthenticated");
                })
                .onStatus(status -> status.value() == HttpStatus.FORBIDDEN.value(), (req, res) -> {
                    throw DownstreamServiceException.forbidden(
                            "Service \"" + serviceName + "\" rejected the request as forbidden");
                })
                .body(ServiceResponse.class);
        if (response == null) {
            throw new IllegalStateException("Service \"" + serviceName + "\" returned an empty response body");
        }
        return response;
    }
}
