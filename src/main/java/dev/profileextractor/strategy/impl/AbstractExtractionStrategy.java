package dev.profileextractor.strategy.impl;

import dev.profileextractor.metrics.ExtractionMetrics;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.strategy.ExtractionRequest;
import dev.profileextractor.strategy.ExtractionStrategy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Base class for strategies: timing, metrics and the "unavailable" contract.
 * A failing or timed-out strategy completes empty instead of erroring.
 */
@Slf4j
public abstract class AbstractExtractionStrategy implements ExtractionStrategy {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final ExtractionMetrics metrics;

    protected AbstractExtractionStrategy(ExtractionMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Run the strategy itself. May error or complete empty.
     */
    protected abstract Mono<CareerProfile> doExtract(ExtractionRequest request);

    protected Duration getTimeout() {
        return DEFAULT_TIMEOUT;
    }

    @Override
    public Mono<CareerProfile> extract(ExtractionRequest request) {
        long start = System.currentTimeMillis();
        return Mono.defer(() -> doExtract(request))
                .timeout(getTimeout())
                .doOnNext(profile -> {
                    log.debug("{} produced a profile with {} records", getName(), profile.getRecordCount());
                    metrics.recordStrategySuccess(getName());
                })
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("{} produced no profile", getName());
                    metrics.recordStrategyUnavailable(getName());
                    return Mono.empty();
                }))
                .doOnError(e -> {
                    log.warn("{} strategy unavailable: {}", getName(), e.getMessage());
                    metrics.recordStrategyUnavailable(getName());
                })
                .onErrorResume(e -> Mono.empty())
                .doOnTerminate(() -> metrics.recordStrategyLatency(getName(), System.currentTimeMillis() - start));
    }
}
