package com.example.gateway.observability.metrics;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.decision.model.PolicyDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decision and translation metrics. Tags are limited to configured datastore aliases,
 * decision outcomes and translation error codes. Callers pass {@link #TAG_UNKNOWN} for an
 * alias that no datastore is configured with.
 */
@Component
public class DecisionMetrics {

    static final String DECISIONS = "gateway.decisions";
    static final String DECISION_DURATION = "gateway.decision.duration";
    static final String TRANSLATION_ERRORS = "gateway.translation.errors";
    static final String EXECUTION_ERRORS = "gateway.execution.errors";

    public static final String TAG_UNKNOWN = "unknown";

    private final MeterRegistry registry;

    public DecisionMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(@NonNull String datastore, @NonNull PolicyDecision decision, @NonNull Duration duration) {
        Counter.builder(DECISIONS)
                .tag("datastore", datastore)
                .tag("result", decision.isAllowed() ? "allowed" : "denied")
                .description("Authorization decisions by datastore and outcome")
                .register(registry)
                .increment();

        Timer.builder(DECISION_DURATION)
                .tag("datastore", datastore)
                .description("Time to translate and execute a partial evaluation")
                .register(registry)
                .record(duration);
    }

    public void recordTranslationError(@NonNull TranslationError error) {
        Counter.builder(TRANSLATION_ERRORS)
                .tag("error", error.name())
                .description("Partial evaluations that could not be translated")
                .register(registry)
                .increment();
    }

    public void recordExecutionError(@NonNull String datastore) {
        Counter.builder(EXECUTION_ERRORS)
                .tag("datastore", datastore)
                .description("Datastore executions that failed")
                .register(registry)
                .increment();
    }
}
