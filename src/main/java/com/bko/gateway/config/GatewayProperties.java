package com.bko.gateway.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private int fetchConcurrency = 8;
    private Duration serviceTimeout = Duration.ofSeconds(30);
    private String schemaFile;
    private Map<String, ServiceConfig> services = new LinkedHashMap<>();
    private ExecutorConfig executor = new ExecutorConfig();

    public static class ServiceConfig {
        private String url;
        private Map<String, String> headers = new LinkedHashMap<>();

        public ServiceConfig() {}

        public ServiceConfig(String url) {
            this.url = url;
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public Map<String, String> getHeaders() { return headers; }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
        }
    }

    public static class ExecutorConfig {
        private boolean shapeResponse = true;

        public boolean isShapeResponse() { return shapeResponse; }
        public void setShapeResponse(boolean shapeResponse) { this.shapeResponse = shapeResponse; }
    }

    public int getFetchConcurrency() {
        return fetchConcurrency;
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = fetchConcurrency;
    }

    public Duration getServiceTimeout() {
        return serviceTimeout;
    }

    public void setServiceTimeout(Duration serviceTimeout) {
        this.serviceTimeout = serviceTimeout;
    }

    public String getSchemaFile() {
        return schemaFile;
    }

    public void setSchemaFile(String schemaFile) {
        this.schemaFile = schemaFile;
    }

    public Map<String, ServiceConfig> getServices() {
        return services;
    }

    public void setServices(Map<String, ServiceConfig> services) {
        if (services == null) {
            return;
        }
        this.services = new LinkedHashMap<>(services);
    }

    public ExecutorConfig getExecutor() {
        return executor;
    }

    public void setExecutor(ExecutorConfig executor) {
        this.executor = executor != null ? executor : new ExecutorConfig();
    }
}
