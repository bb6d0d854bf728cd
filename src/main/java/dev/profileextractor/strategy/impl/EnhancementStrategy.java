package dev.profileextractor.strategy.impl;

import dev.profileextractor.ai.ProfileEnhancer;
import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.metrics.ExtractionMetrics;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.strategy.ExtractionRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Least trusted strategy: delegates to the configured enhancement service,
 * giving it the captured text and the draft of the other strategies.
 */
@Component
public class EnhancementStrategy extends AbstractExtractionStrategy {

    public static final String NAME = "enhancement";
    public static final int TRUST_RANK = 2;

    private final ProfileEnhancer enhancer;
    private final ExtractionConfig config;

    public EnhancementStrategy(ExtractionMetrics metrics, ProfileEnhancer enhancer, ExtractionConfig config) {
        super(metrics);
        this.enhancer = enhancer;
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getTrustRank() {
        return TRUST_RANK;
    }

    @Override
    public boolean requiresDraft() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return enhancer.isEnabled();
    }

    @Override
    protected Duration getTimeout() {
        return Duration.ofSeconds(config.getEnhancementTimeoutSeconds());
    }

    @Override
    protected Mono<CareerProfile> doExtract(ExtractionRequest request) {
        CareerProfile draft = request.draft() == null ? CareerProfile.empty() : request.draft().copy();
        return enhancer.enhance(request.rawText(), draft);
    }
}
