package com.example.gateway.decision.service;

import com.example.gateway.common.exception.ExecutionException;
import com.example.gateway.common.exception.TranslationException;
import com.example.gateway.datastore.Datastore;
import com.example.gateway.datastore.DatastoreRegistry;
import com.example.gateway.decision.model.PolicyDecision;
import com.example.gateway.observability.metrics.DecisionMetrics;
import com.example.gateway.policy.model.PartialQueries;
import com.example.gateway.policy.parser.PartialQueryParser;
import com.example.gateway.query.model.Union;
import com.example.gateway.translate.preprocess.ReferencePreprocessor;
import com.example.gateway.translate.process.QueryAstProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns a partial policy evaluation into an allow/deny decision.
 *
 * <p>Undefined policies deny. A body without remaining conditions allows without touching the
 * datastore. Anything else is preprocessed, turned into a Query-AST, translated and executed
 * against the target datastore.
 *
 * <p>Fails closed: any parse, translation or execution error yields DENY.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyDecisionService {

    private final PartialQueryParser parser;
    private final ReferencePreprocessor preprocessor;
    private final QueryAstProcessor processor;
    private final DatastoreRegistry datastores;
    private final DecisionMetrics metrics;

    /**
     * Decide from the raw compile-API response of the policy engine.
     */
    @NonNull
    public Mono<PolicyDecision> decide(@NonNull String datastore, @NonNull String partialEvaluationJson) {
        return Mono.fromCallable(() -> parser.parse(partialEvaluationJson))
                .flatMap(partial -> decide(datastore, partial))
                .onErrorResume(e -> {
                    PolicyDecision decision = denyOnError(datastore, e);
                    metrics.recordDecision(metricTag(datastore), decision, Duration.ZERO);
                    return Mono.just(decision);
                });
    }

    @NonNull
    public Mono<PolicyDecision> decide(@NonNull String datastore, @Nullable PartialQueries partial) {
        long start = System.nanoTime();
        return evaluate(datastore, partial)
                .onErrorResume(e -> Mono.just(denyOnError(datastore, e)))
                .doOnNext(decision -> metrics.recordDecision(
                        metricTag(datastore), decision, Duration.ofNanos(System.nanoTime() - start)));
    }

    private Mono<PolicyDecision> evaluate(String alias, @Nullable PartialQueries partial) {
        if (partial == null || partial.isUndefined()) {
            log.info("Access DENIED for datastore [{}]: policy is undefined for the input", alias);
            return Mono.just(PolicyDecision.deny(alias, "Policy is undefined for the input"));
        }
        if (partial.hasUnconditionalBody()) {
            log.debug("Access ALLOWED for datastore [{}]: policy holds without datastore conditions", alias);
            return Mono.just(PolicyDecision.allow(alias, "Policy holds without datastore conditions"));
        }

        Optional<Datastore> datastore = datastores.find(alias);
        if (datastore.isEmpty()) {
            log.warn("Access DENIED: no datastore configured with alias [{}]", alias);
            return Mono.just(PolicyDecision.deny(alias, "Unknown datastore"));
        }

        return Mono.fromCallable(() -> compile(alias, partial))
                .flatMap(union -> datastore.get().execute(union))
                .map(allowed -> {
                    if (allowed) {
                        log.debug("Access ALLOWED by datastore [{}]", alias);
                        return PolicyDecision.allow(alias, "Datastore returned matching entries");
                    }
                    log.info("Access DENIED by datastore [{}]: no matching entries", alias);
                    return PolicyDecision.deny(alias, "Datastore returned no matching entries");
                });
    }

    /**
     * Preprocess and build the Query-AST. Pure; exposed for validation tooling.
     */
    @NonNull
    public Union compile(@NonNull String datastore, @NonNull PartialQueries partial) {
        var bodies = preprocessor.process(partial.queries(), datastore);
        Union union = processor.process(bodies);
        log.debug("Compiled query for datastore [{}]: {}", datastore, union);
        return union;
    }

    private String metricTag(String alias) {
        return datastores.find(alias).isPresent() ? alias : DecisionMetrics.TAG_UNKNOWN;
    }

    private PolicyDecision denyOnError(String datastore, Throwable e) {
        if (e instanceof TranslationException te) {
            metrics.recordTranslationError(te.getError());
        } else if (e instanceof ExecutionException) {
            metrics.recordExecutionError(metricTag(datastore));
        }
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn("Access DENIED for datastore [{}] due to error: {}", datastore, reason);
        return PolicyDecision.deny(datastore, reason);
    }
}
