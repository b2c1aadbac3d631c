package com.example.gateway.health.indicator;

import com.example.gateway.datastore.Datastore;
import com.example.gateway.datastore.DatastoreRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Pings every configured datastore. Reported via /actuator/health/datastores.
 */
@Slf4j
@Component("datastoresHealthIndicator")
public class DatastoreHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final DatastoreRegistry datastores;

    public DatastoreHealthIndicator(DatastoreRegistry datastores) {
        this.datastores = datastores;
    }

    @Override
    public Mono<Health> health() {
        Health.Builder builder = Health.up();
        builder.withDetail("count", datastores.size());

        return Flux.fromIterable(datastores.all())
                .concatMap(datastore -> check(datastore, builder))
                .then(Mono.fromSupplier(builder::build));
    }

    private Mono<Void> check(Datastore datastore, Health.Builder builder) {
        return datastore.ping()
                .timeout(HEALTH_CHECK_TIMEOUT)
                .doOnSuccess(ignored -> builder.withDetail(datastore.alias(), datastore.type().key() + " connected"))
                .doOnError(e -> {
                    log.warn("Datastore [{}] health check failed: {}", datastore.alias(), e.getMessage());
                    builder.down();
                    builder.withDetail(datastore.alias(), datastore.type().key() + " disconnected: " + e.getMessage());
                })
                .onErrorResume(e -> Mono.empty());
    }
}
