package com.example.gateway.datastore.mongo;

import com.example.gateway.datastore.DatastoreQuery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One JSON filter per physical collection, counted independently.
 */
public record MongoQuery(Map<String, String> filters) implements DatastoreQuery {

    public MongoQuery {
        filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    @Override
    public Object statement() {
        return filters;
    }

    @Override
    public List<Object> parameters() {
        return List.of();
    }

    @Override
    public int length() {
        return filters.values().stream().mapToInt(String::length).sum();
    }
}
