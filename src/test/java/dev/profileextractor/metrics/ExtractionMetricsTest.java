package dev.profileextractor.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionMetricsTest {

    private MeterRegistry meterRegistry;
    private ExtractionMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ExtractionMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Run counters")
    class RunCountersTests {

        @Test
        @DisplayName("Should record an extraction run")
        void shouldRecordExtraction() {
            metrics.recordExtraction(2, 5);

            assertThat(meterRegistry.counter("profile_extractor_extractions_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("profile_extractor_records_total").count()).isEqualTo(5.0);
            assertThat(meterRegistry.counter("profile_extractor_empty_extractions_total").count()).isZero();
        }

        @Test
        @DisplayName("Should count runs where no strategy produced a profile")
        void shouldRecordEmptyExtraction() {
            metrics.recordExtraction(0, 0);

            assertThat(meterRegistry.counter("profile_extractor_empty_extractions_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should expose the last run in gauges")
        void shouldUpdateGauges() {
            metrics.recordExtraction(3, 7);
            metrics.recordExtraction(1, 2);

            assertThat(meterRegistry.get("profile_extractor_last_run_records").gauge().value()).isEqualTo(2.0);
            assertThat(meterRegistry.get("profile_extractor_last_run_strategies").gauge().value()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Strategy metrics")
    class StrategyMetricsTests {

        @Test
        @DisplayName("Should reuse one timer per strategy")
        void shouldReuseTimer() {
            Timer first = metrics.getStrategyTimer("structured");
            Timer second = metrics.getStrategyTimer("structured");

            assertThat(first).isSameAs(second);
        }

        @Test
        @DisplayName("Should record strategy latency")
        void shouldRecordLatency() {
            metrics.recordStrategyLatency("text-fallback", 150);

            Timer timer = meterRegistry.get("profile_extractor_strategy_duration")
                    .tag("strategy", "text-fallback")
                    .timer();
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(150.0);
        }

        @Test
        @DisplayName("Should count results and unavailability per strategy")
        void shouldCountPerStrategy() {
            metrics.recordStrategySuccess("structured");
            metrics.recordStrategySuccess("structured");
            metrics.recordStrategyUnavailable("enhancement");

            assertThat(meterRegistry.counter("profile_extractor_strategy_results_total", "strategy", "structured")
                    .count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("profile_extractor_strategy_unavailable_total", "strategy", "enhancement")
                    .count()).isEqualTo(1.0);
        }
    }
}
