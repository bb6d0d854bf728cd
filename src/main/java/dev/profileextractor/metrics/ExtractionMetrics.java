package dev.profileextractor.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for profile extraction runs.
 */
@Component
public class ExtractionMetrics {

    private static final String TAG_STRATEGY = "strategy";
    private final MeterRegistry registry;

    private final Counter extractionsCounter;
    private final Counter emptyExtractionsCounter;
    private final Counter recordsExtractedCounter;

    // Timers (per strategy)
    private final ConcurrentHashMap<String, Timer> strategyTimers = new ConcurrentHashMap<>();

    private final AtomicInteger lastRunRecords = new AtomicInteger(0);
    private final AtomicInteger lastRunStrategies = new AtomicInteger(0);

    public ExtractionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.extractionsCounter = Counter.builder("profile_extractor_extractions_total")
                .description("Total extraction runs")
                .register(registry);

        this.emptyExtractionsCounter = Counter.builder("profile_extractor_empty_extractions_total")
                .description("Extraction runs where no strategy produced a profile")
                .register(registry);

        this.recordsExtractedCounter = Counter.builder("profile_extractor_records_total")
                .description("Total work and education records in merged profiles")
                .register(registry);

        Gauge.builder("profile_extractor_last_run_records", lastRunRecords, AtomicInteger::get)
                .description("Records in the last merged profile")
                .register(registry);

        Gauge.builder("profile_extractor_last_run_strategies", lastRunStrategies, AtomicInteger::get)
                .description("Strategies that produced a profile in the last run")
                .register(registry);
    }

    /**
     * Get or create a timer for a specific strategy.
     */
    public Timer getStrategyTimer(String strategyName) {
        return strategyTimers.computeIfAbsent(strategyName, name ->
                Timer.builder("profile_extractor_strategy_duration")
                        .description("Time spent in one extraction strategy")
                        .tag(TAG_STRATEGY, name)
                        .register(registry));
    }

    public void recordStrategyLatency(String strategy, long latencyMs) {
        getStrategyTimer(strategy).record(Duration.ofMillis(latencyMs));
    }

    public void recordStrategySuccess(String strategy) {
        Counter.builder("profile_extractor_strategy_results_total")
                .tag(TAG_STRATEGY, strategy)
                .register(registry)
                .increment();
    }

    /**
     * Strategy failed, timed out or produced nothing.
     */
    public void recordStrategyUnavailable(String strategy) {
        Counter.builder("profile_extractor_strategy_unavailable_total")
                .tag(TAG_STRATEGY, strategy)
                .register(registry)
                .increment();
    }

    /**
     * Record the outcome of one extraction run.
     */
    public void recordExtraction(int strategies, int records) {
        extractionsCounter.increment();
        if (strategies == 0) {
            emptyExtractionsCounter.increment();
        }
        recordsExtractedCounter.increment(records);
        lastRunStrategies.set(strategies);
        lastRunRecords.set(records);
    }
}
