package com.example.gateway.observability.metrics;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.decision.model.PolicyDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DecisionMetrics")
class DecisionMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final DecisionMetrics metrics = new DecisionMetrics(registry);

    @Test
    @DisplayName("should count decisions by datastore and outcome")
    void shouldRecordDecisions() {
        metrics.recordDecision("pg", PolicyDecision.allow("pg", "match"), Duration.ofMillis(12));
        metrics.recordDecision("pg", PolicyDecision.allow("pg", "match"), Duration.ofMillis(8));
        metrics.recordDecision("docs", PolicyDecision.deny("docs", "no match"), Duration.ofMillis(5));

        assertThat(registry.get(DecisionMetrics.DECISIONS).tags("datastore", "pg", "result", "allowed")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(DecisionMetrics.DECISIONS).tags("datastore", "docs", "result", "denied")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(DecisionMetrics.DECISION_DURATION).tag("datastore", "pg")
                .timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(20.0);
    }

    @Test
    @DisplayName("should count translation errors by code")
    void shouldRecordTranslationErrors() {
        metrics.recordTranslationError(TranslationError.UNSUPPORTED_OPERATOR);

        assertThat(registry.get(DecisionMetrics.TRANSLATION_ERRORS).tag("error", "UNSUPPORTED_OPERATOR")
                .counter().count()).isEqualTo(1.0);
    }
}
