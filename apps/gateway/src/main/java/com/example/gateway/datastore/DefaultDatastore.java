package com.example.gateway.datastore;

import com.example.gateway.common.exception.QueryLengthException;
import com.example.gateway.query.model.Union;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Pairs a translator with an executor for one datastore alias.
 */
@Slf4j
public class DefaultDatastore<Q extends DatastoreQuery> implements Datastore {

    private final String alias;
    private final DatastoreType type;
    private final DatastoreTranslator<Q> translator;
    private final DatastoreExecutor<Q> executor;
    private final int hugeQuerySize;

    public DefaultDatastore(
            @NonNull String alias,
            @NonNull DatastoreType type,
            @NonNull DatastoreTranslator<Q> translator,
            @NonNull DatastoreExecutor<Q> executor,
            int hugeQuerySize) {
        this.alias = Objects.requireNonNull(alias, "alias");
        this.type = Objects.requireNonNull(type, "type");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.hugeQuerySize = hugeQuerySize;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public DatastoreType type() {
        return type;
    }

    @Override
    public Mono<Boolean> execute(Union union) {
        return Mono.fromCallable(() -> translator.translate(union))
                .flatMap(query -> {
                    log.debug("Datastore [{}] statement: {} params: {}", alias, query.statement(), query.parameters());
                    if (query.length() > hugeQuerySize) {
                        log.warn("Datastore [{}] refused statement of length {} (limit {})",
                                alias, query.length(), hugeQuerySize);
                        return Mono.error(new QueryLengthException(alias, query.length(), hugeQuerySize));
                    }
                    return executor.execute(query);
                });
    }

    @Override
    public Mono<Void> ping() {
        return executor.ping();
    }
}
