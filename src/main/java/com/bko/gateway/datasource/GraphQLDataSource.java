package com.bko.gateway.datasource;

import java.util.concurrent.CompletableFuture;

/**
 * Uniform access to one named backend GraphQL service.
 *
 * <p>Implementations complete the returned future exceptionally when the service cannot be
 * reached at all. GraphQL errors reported by a reachable service are returned in
 * {@link ServiceResponse#errors()} instead.
 */
public interface GraphQLDataSource {

    CompletableFuture<ServiceResponse> process(ServiceRequest request);
}
