package com.example.gateway.datastore.sql;

import com.example.gateway.common.exception.ExecutionException;
import com.example.gateway.common.exception.GatewayException;
import com.example.gateway.datastore.DatastoreExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@code SELECT count(*)} statement and allows when any returned count is positive.
 * A union is a single statement, so there is no fan-out.
 */
@Slf4j
public class SqlDatastoreExecutor implements DatastoreExecutor<SqlStatement> {

    private static final String PING_STATEMENT = "SELECT 1";

    private final String alias;
    private final DatabaseClient databaseClient;
    private final Duration timeout;

    public SqlDatastoreExecutor(@NonNull String alias, @NonNull DatabaseClient databaseClient, @NonNull Duration timeout) {
        this.alias = alias;
        this.databaseClient = databaseClient;
        this.timeout = timeout;
    }

    @Override
    public Mono<Boolean> execute(SqlStatement statement) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(statement.text());
        List<Object> parameters = statement.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            spec = spec.bind(i, parameters.get(i));
        }

        return spec.map((row, metadata) -> row.get(0, Long.class))
                .all()
                .any(count -> count != null && count > 0)
                .timeout(timeout)
                .doOnNext(allowed -> log.debug("Datastore [{}] returned allowed={}", alias, allowed))
                .onErrorMap(e -> !(e instanceof GatewayException), this::toExecutionException);
    }

    @Override
    public Mono<Void> ping() {
        return databaseClient.sql(PING_STATEMENT)
                .map((row, metadata) -> 1)
                .first()
                .then();
    }

    private ExecutionException toExecutionException(Throwable e) {
        if (e instanceof TimeoutException) {
            log.error("Datastore [{}] timed out after {}", alias, timeout);
            return new ExecutionException(alias, "query timed out after " + timeout, e);
        }
        log.error("Datastore [{}] query failed: {}", alias, e.getMessage());
        return new ExecutionException(alias, "query failed: " + e.getMessage(), e);
    }
}
