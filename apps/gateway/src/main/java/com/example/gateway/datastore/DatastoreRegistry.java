package com.example.gateway.datastore;

import org.springframework.lang.NonNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Configured datastores by alias. Built once at startup.
 */
public final class DatastoreRegistry {

    private final Map<String, Datastore> datastores;

    public DatastoreRegistry(@NonNull Map<String, Datastore> datastores) {
        this.datastores = Collections.unmodifiableMap(new LinkedHashMap<>(datastores));
    }

    @NonNull
    public Optional<Datastore> find(@NonNull String alias) {
        return Optional.ofNullable(datastores.get(alias));
    }

    @NonNull
    public Collection<Datastore> all() {
        return datastores.values();
    }

    public int size() {
        return datastores.size();
    }
}
