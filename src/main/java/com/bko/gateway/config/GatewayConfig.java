package com.bko.gateway.config;

import com.bko.gateway.datasource.GraphQLDataSource;
import com.bko.gateway.datasource.RemoteGraphQLDataSource;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class GatewayConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(GatewayProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getFetchConcurrency()));
    }

    @Bean
    public Map<String, GraphQLDataSource> serviceMap(GatewayProperties properties,
                                                     RestClient.Builder restClientBuilder,
                                                     @Qualifier("fetchExecutor") ExecutorService fetchExecutor) {
        Map<String, GraphQLDataSource> services = new LinkedHashMap<>();
        properties.getServices().forEach((name, config) -> {
            if (config == null || !StringUtils.hasText(config.getUrl())) {
                log.warn("Service {} has no url configured and will be treated as unavailable.", name);
                return;
            }
            RestClient.Builder builder = restClientBuilder.clone().baseUrl(config.getUrl());
            config.getHeaders().forEach(builder::defaultHeader);
            services.put(name, new RemoteGraphQLDataSource(name, builder.build(), fetchExecutor,
                    properties.getServiceTimeout()));
        });
        log.info("Configured services: {}.", String.join(", ", services.keySet()));
        return Collections.unmodifiableMap(services);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway", name = "schema-file")
    public GraphQLSchema composedSchema(GatewayProperties properties) {
        try {
            String sdl = Files.readString(Path.of(properties.getSchemaFile()));
            TypeDefinitionRegistry registry = new SchemaParser().parse(sdl);
            log.info("Loaded composed schema from {}.", properties.getSchemaFile());
            return UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read schema file " + properties.getSchemaFile(), ex);
        }
    }
}
