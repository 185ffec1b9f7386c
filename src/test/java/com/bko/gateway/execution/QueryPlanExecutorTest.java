package com.bko.gateway.execution;

import com.bko.gateway.config.GatewayProperties;
import com.bko.gateway.datasource.DownstreamServiceException;
import com.bko.gateway.datasource.GraphQLDataSource;
import com.bko.gateway.datasource.ServiceRequest;
import com.bko.gateway.datasource.ServiceResponse;
import com.bko.gateway.execution.model.ExecutionResponse;
import com.bko.gateway.execution.model.GatewayError;
import com.bko.gateway.execution.model.OperationContext;
import com.bko.gateway.execution.model.RequestContext;
import com.bko.gateway.plan.QueryPlan;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QueryPlanExecutorTest {

    private static final String ME_QUERY = "{me{name{first last}}}";
    private static final String TOP_REVIEWS_QUERY = "{topReviews{body}}";
    private static final String USER_ENTITIES_QUERY =
            "query($representations:[_Any!]!){_entities(representations:$representations){...on User{name{first}}}}";
    private static final String BOOK_REVIEWS_QUERY =
            "query($representations:[_Any!]!){_entities(representations:$representations){...on Book{reviews{body}}}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutionMetricsService metricsService;
    private QueryPlanExecutor executor;
    private GraphQLDataSource accounts;
    private GraphQLDataSource reviews;
    private GraphQLDataSource product;
    private Map<String, GraphQLDataSource> serviceMap;

    @BeforeEach
    void setUp() {
        ResultMerger resultMerger = new ResultMerger();
        metricsService = new ExecutionMetricsService();
        executor = new QueryPlanExecutor(new RepresentationBuilder(resultMerger), resultMerger,
                new ResponseShaper(resultMerger), metricsService, new GatewayProperties());
        accounts = mock(GraphQLDataSource.class);
        reviews = mock(GraphQLDataSource.class);
        product = mock(GraphQLDataSource.class);
        serviceMap = new HashMap<>(Map.of("accounts", accounts, "reviews", reviews, "product", product));
    }

    @Test
    void testNoErrorsKeyWhenNothingFailed() throws Exception {
        respond(accounts, """
                {"data": {"me": {"name": {"first": "Ada", "last": "Lovelace"}}}}
                """);
        QueryPlan plan = plan("""
                {"kind": "QueryPlan", "node": {"kind": "Fetch", "serviceName": "accounts",
                  "variableUsages": [], "operation": "{me{name{first last}}}"}}
                """);

        ExecutionResponse response = execute(plan, Map.of(), "{ me { name { first last } } }");

        assertNull(response.errors());
        assertFalse(objectMapper.writeValueAsString(response).contains("errors"));
        assertEquals(json("""
                {"me": {"name": {"first": "Ada", "last": "Lovelace"}}}
                """), response.data());
    }

    @Test
    void testRootFieldErrorIsReportedWithServiceExtensions() {
        respond(accounts, """
                {"data": {"me": null},
                 "errors": [{"message": "Something went wrong", "path": ["me"],
                             "extensions": {"code": "UNAUTHENTICATED"}}]}
                """);

        ExecutionResponse response = execute(rootFetchPlan("accounts", ME_QUERY), Map.of(),
                "{ me { name { first last } } }");

        assertTrue(response.data().containsKey("me"));
        assertNull(response.data().get("me"));
        assertEquals(1, response.errors().size());
        GatewayError error = response.errors().get(0);
        assertEquals("Something went wrong", error.message());
        assertEquals(List.of("me"), error.path());
        assertEquals("UNAUTHENTICATED", error.extensions().get("code"));
        assertEquals("accounts", error.extensions().get("serviceName"));
        assertEquals(ME_QUERY, error.extensions().get("query"));
        assertEquals(Map.of(), error.extensions().get("variables"));
    }

    @Test
    void testTypedFailureKeepsItsCodeAndNullsTheField() {
        when(accounts.process(any())).thenReturn(CompletableFuture.failedFuture(
                DownstreamServiceException.unauthenticated("Something went wrong")));

        ExecutionResponse response = execute(rootFetchPlan("accounts", ME_QUERY), Map.of(),
                "{ me { name { first last } } }");

        assertNull(response.data().get("me"));
        assertTrue(response.data().containsKey("me"));
        assertEquals(1, response.errors().size());
        assertEquals("Something went wrong", response.errors().get(0).message());
        assertEquals("UNAUTHENTICATED", response.errors().get(0).code());
        assertEquals(List.of(), response.errors().get(0).path());
    }

    @Test
    void testEntityErrorsArePathedToTheirOriginatingLocations() {
        respond(reviews, """
                {"data": {"topReviews": [
                  {"id": "1", "author": {"__typename": "User", "id": "1"}},
                  {"id": "2", "author": {"__typename": "User", "id": "2"}}]}}
                """);
        respond(accounts, """
                {"data": {"_entities": [null, null]},
                 "errors": [
                   {"message": "Something went wrong", "path": ["_entities", 0, "name"], "extensions": {"code": "FORBIDDEN"}},
                   {"message": "Something went wrong", "path": ["_entities", 1, "name"], "extensions": {"code": "FORBIDDEN"}}]}
                """);

        ExecutionResponse response = execute(topReviewsAuthorPlan(), Map.of(), null);

        assertEquals(2, response.errors().size());
        assertEquals(List.of("topReviews", 0, "author", "name"), response.errors().get(0).path());
        assertEquals(List.of("topReviews", 1, "author", "name"), response.errors().get(1).path());
        assertEquals("FORBIDDEN", response.errors().get(0).code());
        assertEquals(USER_ENTITIES_QUERY, response.errors().get(0).extensions().get("query"));
    }

    @Test
    void testNoEntityCallWhenNoLocationHasTheRequiredFields() {
        respond(reviews, """
                {"data": {"topReviews": [
                  {"id": "1", "author": {"__typename": "User"}},
                  {"id": "2", "author": null},
                  {"id": "3"}]}}
                """);

        ExecutionResponse response = execute(topReviewsAuthorPlan(), Map.of(), null);

        verify(accounts, never()).process(any());
        assertNull(response.errors());
        assertEquals(3, ((List<?>) response.data().get("topReviews")).size());
    }

    @Test
    void testRemainingEntitiesAreSentInOrderWithDuplicates() {
        respond(product, """
                {"data": {"topProducts": [
                  {"__typename": "Furniture", "upc": "1", "reviews": [{"body": "Love it!"}, {"body": "Prefer something else."}]},
                  {"__typename": "Furniture", "upc": "2", "reviews": [{"body": "Too expensive."}]},
                  {"__typename": "Furniture", "upc": "3", "reviews": [{"body": "Could be better."}]},
                  {"__typename": "Book", "isbn": "0262510871",
                   "reviews": [{"body": "Wish I had read this before.", "author": {"__typename": "User", "id": "2"}}]},
                  {"__typename": "Book", "isbn": "0136291554",
                   "reviews": [{"body": "A bit outdated.", "author": {"__typename": "User", "id": "2"}}]}]}}
                """);
        respond(accounts, """
                {"data": {"_entities": [
                  {"name": {"first": "Alan", "last": "Turing"}},
                  {"name": {"first": "Alan", "last": "Turing"}}]}}
                """);
        QueryPlan plan = plan("""
                {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
                  {"kind": "Fetch", "serviceName": "product", "variableUsages": [],
                   "operation": "{topProducts{__typename ...on Book{isbn reviews{body author{__typename id}}} ...on Furniture{upc reviews{body}}}}"},
                  {"kind": "Flatten", "path": ["topProducts", "@", "reviews", "@", "author"],
                   "node": {"kind": "Fetch", "serviceName": "accounts", "variableUsages": [],
                     "requires": [{"kind": "InlineFragment", "typeCondition": "User",
                       "selections": [{"kind": "Field", "name": "__typename"}, {"kind": "Field", "name": "id"}]}],
                     "operation": "query($representations:[_Any!]!){_entities(representations:$representations){...on User{name{first last}}}}"}}
                ]}}
                """);

        ExecutionResponse response = execute(plan, Map.of(), """
                { topProducts { reviews { body } ... on Book { reviews { author { name { first last } } } } } }
                """);

        ArgumentCaptor<ServiceRequest> captor = ArgumentCaptor.forClass(ServiceRequest.class);
        verify(accounts, times(1)).process(captor.capture());
        assertEquals(List.of(
                Map.of("__typename", "User", "id", "2"),
                Map.of("__typename", "User", "id", "2")), captor.getValue().representations());
        assertNull(response.errors());
        assertEquals(json("""
                {"topProducts": [
                  {"reviews": [{"body": "Love it!"}, {"body": "Prefer something else."}]},
                  {"reviews": [{"body": "Too expensive."}]},
                  {"reviews": [{"body": "Could be better."}]},
                  {"reviews": [{"body": "Wish I had read this before.", "author": {"name": {"first": "Alan", "last": "Turing"}}}]},
                  {"reviews": [{"body": "A bit outdated.", "author": {"name": {"first": "Alan", "last": "Turing"}}}]}]}
                """), response.data());
    }

    @Test
    void testNoEntityCallWhenNoEntityMatchesTheTypeCondition() {
        respond(product, """
                {"data": {"topProducts": [
                  {"__typename": "Furniture", "upc": "1"},
                  {"__typename": "Furniture", "upc": "2"},
                  {"__typename": "Furniture", "upc": "3"}]}}
                """);

        ExecutionResponse response = execute(bookReviewsPlan(), Map.of(),
                "{ topProducts(first: 3) { ... on Book { reviews { body } } } }");

        verify(reviews, never()).process(any());
        assertEquals(1, metricsService.getFetchCount());
        assertEquals(1, metricsService.getSkippedFetchCount());
        assertNull(response.errors());
        assertEquals(json("""
                {"topProducts": [{}, {}, {}]}
                """), response.data());
    }

    @Test
    void testOnlyEntitiesMatchingTheTypeConditionAreSent() {
        respond(product, """
                {"data": {"topProducts": [
                  {"__typename": "Furniture", "upc": "1"},
                  {"__typename": "Furniture", "upc": "2"},
                  {"__typename": "Furniture", "upc": "3"},
                  {"__typename": "Book", "isbn": "0262510871"},
                  {"__typename": "Book", "isbn": "0136291554"}]}}
                """);
        respond(reviews, """
                {"data": {"_entities": [
                  {"reviews": [{"body": "Wish I had read this before."}]},
                  {"reviews": [{"body": "A bit outdated."}]}]}}
                """);

        ExecutionResponse response = execute(bookReviewsPlan(), Map.of(),
                "{ topProducts(first: 5) { ... on Book { reviews { body } } } }");

        ArgumentCaptor<ServiceRequest> captor = ArgumentCaptor.forClass(ServiceRequest.class);
        verify(reviews, times(1)).process(captor.capture());
        assertEquals(List.of(
                Map.of("__typename", "Book", "isbn", "0262510871"),
                Map.of("__typename", "Book", "isbn", "0136291554")), captor.getValue().representations());
        assertEquals(json("""
                {"topProducts": [{}, {}, {},
                  {"reviews": [{"body": "Wish I had read this before."}]},
                  {"reviews": [{"body": "A bit outdated."}]}]}
                """), response.data());
    }

    @Test
    void testRootFailureDoesNotSuppressSiblingRootFields() {
        when(accounts.process(any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("connection refused")));
        respond(reviews, """
                {"data": {"topReviews": [{"body": "Love it!"}, {"body": "Too expensive."}]}}
                """);

        ExecutionResponse response = execute(parallelRootPlan(), Map.of(),
                "{ me { name { first last } } topReviews { body } }");

        assertNull(response.data().get("me"));
        assertTrue(response.data().get("topReviews") instanceof List<?>);
        assertEquals(1, response.errors().size());
        GatewayError error = response.errors().get(0);
        assertEquals("Error while fetching subquery from service \"accounts\"", error.message());
        assertEquals("INTERNAL_SERVER_ERROR", error.code());
        assertEquals("accounts", error.serviceName());
    }

    @Test
    void testMissingServiceBehavesLikeAThrowingService() {
        when(accounts.process(any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("connection refused")));
        respond(reviews, """
                {"data": {"topReviews": [{"body": "Love it!"}]}}
                """);
        ExecutionResponse throwing = execute(parallelRootPlan(), Map.of(),
                "{ me { name { first last } } topReviews { body } }");

        serviceMap.remove("accounts");
        ExecutionResponse missing = execute(parallelRootPlan(), Map.of(),
                "{ me { name { first last } } topReviews { body } }");

        assertEquals(throwing.data(), missing.data());
        assertEquals(throwing.errors(), missing.errors());
        assertNull(missing.data().get("me"));
        assertEquals(List.of(Map.of("body", "Love it!")), missing.data().get("topReviews"));
    }

    @Test
    void testSynchronouslyThrowingServiceIsRecordedAsFailure() {
        when(accounts.process(any())).thenThrow(new IllegalStateException("boom"));

        ExecutionResponse response = execute(rootFetchPlan("accounts", ME_QUERY), Map.of(), null);

        assertEquals(Map.of(), response.data());
        assertEquals(1, response.errors().size());
        assertEquals("accounts", response.errors().get(0).serviceName());
    }

    @Test
    void testFetchReceivesOnlyItsDeclaredVariables() {
        respond(reviews, """
                {"data": {"topReviews": []}}
                """);
        QueryPlan plan = plan("""
                {"kind": "QueryPlan", "node": {"kind": "Fetch", "serviceName": "reviews",
                  "variableUsages": ["first", "missing"],
                  "operation": "query($first:Int){topReviews(first:$first){body}}"}}
                """);

        execute(plan, Map.of("first", 3, "locale", "en"), null);

        ArgumentCaptor<ServiceRequest> captor = ArgumentCaptor.forClass(ServiceRequest.class);
        verify(reviews).process(captor.capture());
        assertEquals(Map.of("first", 3), captor.getValue().variables());
        assertNull(captor.getValue().representations());
    }

    @Test
    void testErrorCarriesTheVariablesSentToTheService() {
        respond(reviews, """
                {"errors": [{"message": "Bad input", "path": ["topReviews"]}]}
                """);
        QueryPlan plan = plan("""
                {"kind": "QueryPlan", "node": {"kind": "Fetch", "serviceName": "reviews",
                  "variableUsages": ["first"],
                  "operation": "query($first:Int){topReviews(first:$first){body}}"}}
                """);

        ExecutionResponse response = execute(plan, Map.of("first", 3, "locale", "en"), null);

        assertEquals(Map.of("first", 3), response.errors().get(0).extensions().get("variables"));
        assertEquals("INTERNAL_SERVER_ERROR", response.errors().get(0).code());
    }

    @Test
    void testSequenceContinuesAfterFailureAndKeepsErrorOrder() {
        when(accounts.process(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(reviews.process(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        respond(product, """
                {"data": {"topProducts": [{"upc": "1"}]}}
                """);
        QueryPlan plan = plan("""
                {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
                  {"kind": "Fetch", "serviceName": "accounts", "variableUsages": [], "operation": "{me{id}}"},
                  {"kind": "Fetch", "serviceName": "reviews", "variableUsages": [], "operation": "{topReviews{body}}"},
                  {"kind": "Fetch", "serviceName": "product", "variableUsages": [], "operation": "{topProducts{upc}}"}
                ]}}
                """);

        ExecutionResponse response = execute(plan, Map.of(), null);

        assertEquals(List.of("accounts", "reviews"),
                response.errors().stream().map(GatewayError::serviceName).toList());
        assertEquals(List.of(Map.of("upc", "1")), response.data().get("topProducts"));
    }

    @Test
    void testParallelFailuresAreAllCollected() {
        when(accounts.process(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(reviews.process(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        ExecutionResponse response = execute(parallelRootPlan(), Map.of(), null);

        Set<String> services = response.errors().stream().map(GatewayError::serviceName).collect(Collectors.toSet());
        assertEquals(Set.of("accounts", "reviews"), services);
        assertEquals(2, metricsService.getErrorCount());
    }

    @Test
    void testEntityCountMismatchIsRecordedOnce() {
        respond(reviews, """
                {"data": {"topReviews": [
                  {"author": {"__typename": "User", "id": "1"}},
                  {"author": {"__typename": "User", "id": "2"}}]}}
                """);
        respond(accounts, """
                {"data": {"_entities": [{"name": {"first": "Ada"}}]}}
                """);

        ExecutionResponse response = execute(topReviewsAuthorPlan(), Map.of(), null);

        assertEquals(1, response.errors().size());
        assertEquals("Expected \"data._entities\" to contain 2 elements", response.errors().get(0).message());
        assertEquals(List.of("topReviews"), response.errors().get(0).path());
        assertFalse(((Map<?, ?>) ((Map<?, ?>) ((List<?>) response.data().get("topReviews")).get(0))
                .get("author")).containsKey("name"));
    }

    @Test
    void testFalseyRequiredValuesAreStillSent() {
        respond(product, """
                {"data": {"books": [
                  {"__typename": "Book", "isbn": "1", "title": "", "year": null},
                  {"__typename": "Book", "isbn": "2", "title": "Design Patterns", "year": 1995}]}}
                """);
        respond(reviews, """
                {"data": {"_entities": [{"name": " (null)"}, {"name": "Design Patterns (1995)"}]}}
                """);
        QueryPlan plan = plan("""
                {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
                  {"kind": "Fetch", "serviceName": "product", "variableUsages": [],
                   "operation": "{books{__typename isbn title year}}"},
                  {"kind": "Flatten", "path": ["books", "@"],
                   "node": {"kind": "Fetch", "serviceName": "reviews", "variableUsages": [],
                     "requires": [{"kind": "InlineFragment", "typeCondition": "Book", "selections": [
                       {"kind": "Field", "name": "__typename"}, {"kind": "Field", "name": "isbn"},
                       {"kind": "Field", "name": "title"}, {"kind": "Field", "name": "year"}]}],
                     "operation": "query($representations:[_Any!]!){_entities(representations:$representations){...on Book{name}}}"}}
                ]}}
                """);

        ExecutionResponse response = execute(plan, Map.of(), "{ books { name } }");

        ArgumentCaptor<ServiceRequest> captor = ArgumentCaptor.forClass(ServiceRequest.class);
        verify(reviews).process(captor.capture());
        Map<String, Object> first = captor.getValue().representations().get(0);
        assertEquals("", first.get("title"));
        assertTrue(first.containsKey("year"));
        assertNull(first.get("year"));
        assertEquals(json("""
                {"books": [{"name": " (null)"}, {"name": "Design Patterns (1995)"}]}
                """), response.data());
    }

    @Test
    void testEmptyPlanYieldsEmptyData() {
        ExecutionResponse response = execute(QueryPlan.empty(), Map.of(), null);

        assertEquals(Map.of(), response.data());
        assertNull(response.errors());
    }

    @Test
    void testParallelEntityFetchesRunConcurrentlyOntoTheSameElements() {
        GraphQLDataSource inventory = mock(GraphQLDataSource.class);
        serviceMap.put("inventory", inventory);
        respond(product, """
                {"data": {"topProducts": [{"__typename": "Book", "upc": "1"}, {"__typename": "Book", "upc": "2"}]}}
                """);
        ExecutorService servicePool = Executors.newFixedThreadPool(2);
        CountDownLatch bothCalled = new CountDownLatch(2);
        List<Boolean> calledTogether = new CopyOnWriteArrayList<>();
        try {
            respondLater(reviews, servicePool, bothCalled, calledTogether, """
                    {"data": {"_entities": [{"reviews": [{"body": "Classic"}]}, {"reviews": []}]}}
                    """);
            respondLater(inventory, servicePool, bothCalled, calledTogether, """
                    {"data": {"_entities": [{"inStock": true}, {"inStock": false}]}}
                    """);
            QueryPlan plan = plan("""
                    {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
                      {"kind": "Fetch", "serviceName": "product", "variableUsages": [],
                       "operation": "{topProducts{__typename upc}}"},
                      {"kind": "Parallel", "nodes": [
                        {"kind": "Flatten", "path": ["topProducts", "@"],
                         "node": {"kind": "Fetch", "serviceName": "reviews", "variableUsages": [],
                           "requires": %1$s, "operation": "{_entities{...on Book{reviews{body}}}}"}},
                        {"kind": "Flatten", "path": ["topProducts", "@"],
                         "node": {"kind": "Fetch", "serviceName": "inventory", "variableUsages": [],
                           "requires": %1$s, "operation": "{_entities{...on Book{inStock}}}"}}
                      ]}
                    ]}}
                    """.formatted("""
                    [{"kind": "InlineFragment", "typeCondition": "Book",
                      "selections": [{"kind": "Field", "name": "__typename"}, {"kind": "Field", "name": "upc"}]}]
                    """));

            ExecutionResponse response = execute(plan, Map.of(), null);

            assertEquals(List.of(true, true), calledTogether);
            assertEquals(json("""
                    {"topProducts": [
                      {"__typename": "Book", "upc": "1", "reviews": [{"body": "Classic"}], "inStock": true},
                      {"__typename": "Book", "upc": "2", "reviews": [], "inStock": false}
                    ]}
                    """), response.data());
            assertNull(response.errors());
        } finally {
            servicePool.shutdownNow();
        }
    }

    @Test
    void testLaterMergeDoesNotOverwriteWrittenValues() {
        respond(accounts, """
                {"data": {"me": {"id": "1", "name": "Ada"}}}
                """);
        respond(reviews, """
                {"data": {"me": {"id": "changed", "reviews": [{"body": "Love it!"}]}}}
                """);
        QueryPlan plan = plan("""
                {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
                  {"kind": "Fetch", "serviceName": "accounts", "variableUsages": [], "operation": "{me{id name}}"},
                  {"kind": "Fetch", "serviceName": "reviews", "variableUsages": [], "operation": "{me{id reviews{body}}}"}
                ]}}
                """);

        ExecutionResponse response = execute(plan, Map.of(), null);

        assertEquals(json("""
                {"me": {"id": "1", "name": "Ada", "reviews": [{"body": "Love it!"}]}}
                """), response.data());
    }

    @Test
    void testUnshapedResponseKeepsJoinFieldsWhenShapingIsDisabled() {
        GatewayProperties properties = new GatewayProperties();
        properties.getExecutor().setShapeResponse(false);
        ResultMerger resultMerger = new ResultMerger();
        QueryPlanExecutor unshaped = new QueryPlanExecutor(new RepresentationBuilder(resultMerger), resultMerger,
                new ResponseShaper(resultMerger), new ExecutionMetricsService(), properties);
        respond(accounts, """
                {"data": {"me": {"__typename": "User", "id": "1"}}}
                """);

        ExecutionResponse response = unshaped.executeQueryPlan(rootFetchPlan("accounts", "{me{__typename id}}"),
                serviceMap, RequestContext.empty(),
                OperationContext.of(null, Parser.parse("{ me { id } }"))).join();

        assertEquals(json("""
                {"me": {"__typename": "User", "id": "1"}}
                """), response.data());
    }

    private ExecutionResponse execute(QueryPlan plan, Map<String, Object> variables, String operation) {
        OperationContext operationContext = operation == null
                ? OperationContext.empty()
                : OperationContext.of(null, Parser.parse(operation));
        return executor.executeQueryPlan(plan, serviceMap, new RequestContext(variables), operationContext).join();
    }

    private void respond(GraphQLDataSource dataSource, String body) {
        ServiceResponse response;
        try {
            response = objectMapper.readValue(body, ServiceResponse.class);
        } catch (Exception ex) {
            throw new IllegalArgumentException(ex);
        }
        when(dataSource.process(any())).thenReturn(CompletableFuture.completedFuture(response));
    }

    /**
     * Answers on another thread once every service sharing {@code bothCalled} has been called.
     */
    private void respondLater(GraphQLDataSource dataSource, ExecutorService pool, CountDownLatch bothCalled,
                              List<Boolean> calledTogether, String body) {
        ServiceResponse response = objectMapper.convertValue(json(body), ServiceResponse.class);
        when(dataSource.process(any())).thenAnswer(invocation -> {
            bothCalled.countDown();
            return CompletableFuture.supplyAsync(() -> {
                try {
                    calledTogether.add(bothCalled.await(5, TimeUnit.SECONDS));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    calledTogether.add(false);
                }
                return response;
            }, pool);
        });
    }

    private QueryPlan plan(String body) {
        try {
            return objectMapper.readValue(body, QueryPlan.class);
        } catch (Exception ex) {
            throw new IllegalArgumentException(ex);
        }
    }

    private Map<String, Object> json(String body) {
        try {
            return objectMapper.readValue(body, new TypeReference<>() {});
        } catch (Exception ex) {
            throw new IllegalArgumentException(ex);
        }
    }

    private QueryPlan rootFetchPlan(String serviceName, String operation) {
        return plan("""
                {"kind": "QueryPlan", "node": {"kind": "Fetch", "serviceName": "%s",
                  "variableUsages": [], "operation": "%s"}}
                """.formatted(serviceName, operation));
    }

    private QueryPlan parallelRootPlan() {
        return plan("""
                {"kind": "QueryPlan", "node": {"kind": "Parallel", "nodes": [
                  {"kind": "Fetch", "serviceName": "accounts", "variableUsages": [], "operation": "%s"},
                  {"kind": "Fetch", "serviceName": "reviews", "variableUsages": [], "operation": "%s"}
                ]}}
                """.formatted(ME_QUERY, TOP_REVIEWS_QUERY));
    }

    private QueryPlan topReviewsAuthorPlan() {
        return plan("""
                {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
                  {"kind": "Fetch", "serviceName": "reviews", "variableUsages": [],
                   "operation": "{topReviews(first:2){id author{__typename id}}}"},
                  {"kind": "Flatten", "path": ["topReviews", "@", "author"],
                   "node": {"kind": "Fetch", "serviceName": "accounts", "variableUsages": [],
                     "requires": [{"kind": "InlineFragment", "typeCondition": "User",
                       "selections": [{"kind": "Field", "name": "__typename"}, {"kind": "Field", "name": "id"}]}],
                     "operation": "%s"}}
                ]}}
                """.formatted(USER_ENTITIES_QUERY));
    }

    private QueryPlan bookReviewsPlan() {
        return plan("""
                {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
                  {"kind": "Fetch", "serviceName": "product", "variableUsages": [],
                   "operation": "{topProducts{__typename ...on Book{isbn} ...on Furniture{upc}}}"},
                  {"kind": "Flatten", "path": ["topProducts", "@"],
                   "node": {"kind": "Fetch", "serviceName": "reviews", "variableUsages": [],
                     "requires": [{"kind": "InlineFragment", "typeCondition": "Book",
                       "selections": [{"kind": "Field", "name": "__typename"}, {"kind": "Field", "name": "isbn"}]}],
                     "operation": "%s"}}
                ]}}
                """.formatted(BOOK_REVIEWS_QUERY));
    }
}
