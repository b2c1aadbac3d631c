package com.example.gateway.config;

import com.example.gateway.config.properties.GatewayProperties;
import com.example.gateway.datastore.DatastoreFactory;
import com.example.gateway.datastore.DatastoreRegistry;
import com.example.gateway.translate.process.QueryAstProcessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires datastores and the query compiler from {@link GatewayProperties}.
 * Misconfiguration fails startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    @Bean
    public QueryAstProcessor queryAstProcessor(GatewayProperties properties) {
        var translation = properties.translation();
        log.info("Query processor: skipUnknown={}, validateMode={}",
                translation.skipUnknown(), translation.validateMode());
        return new QueryAstProcessor(translation.skipUnknown(), translation.validateMode());
    }

    @Bean
    public DatastoreFactory datastoreFactory(GatewayProperties properties, ObjectMapper objectMapper) {
        return new DatastoreFactory(properties, objectMapper);
    }

    @Bean
    public DatastoreRegistry datastoreRegistry(DatastoreFactory datastoreFactory) {
        return datastoreFactory.createAll();
    }
}
