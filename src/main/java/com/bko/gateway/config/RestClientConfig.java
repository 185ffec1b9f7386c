package com.bko.gateway.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer(GatewayProperties properties) {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            restClientBuilder.requestFactory(requestFactory(properties.getServiceTimeout()));
        };
    }

    /**
     * Bounds connect and read of each blocking call by the service timeout, so a service that
     * never answers releases its fetch thread.
     */
    static ClientHttpRequestFactory requestFactory(@Nullable Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
            factory.setConnectTimeout(millis);
            factory.setReadTimeout(millis);
        }
        // buffering lets the interceptor read the response body before the converters do
        return new BufferingClientHttpRequestFactory(factory);
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.bko.gateway.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--> {} {}", request.getMethod(), request.getURI());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            try {
                httpLogger.debug("<-- {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("<-- status unknown");
            }
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }
    }
}
