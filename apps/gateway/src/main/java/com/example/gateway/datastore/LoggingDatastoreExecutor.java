package com.example.gateway.datastore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dry-run executor: logs each query as JSON instead of running it, and always allows.
 */
@Slf4j
public class LoggingDatastoreExecutor<Q extends DatastoreQuery> implements DatastoreExecutor<Q> {

    private final String alias;
    private final ObjectMapper objectMapper;

    public LoggingDatastoreExecutor(String alias, ObjectMapper objectMapper) {
        this.alias = alias;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Boolean> execute(Q query) {
        return Mono.fromCallable(() -> {
            log.info("Dry run [{}]: {}", alias, toJson(query));
            return Boolean.TRUE;
        });
    }

    @Override
    public Mono<Void> ping() {
        return Mono.empty();
    }

    String toJson(Q query) throws JsonProcessingException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("query", query.statement());
        data.put("parameter", query.parameters());
        return objectMapper.writeValueAsString(data);
    }
}
