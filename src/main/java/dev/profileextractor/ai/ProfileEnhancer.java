package dev.profileextractor.ai;

import dev.profileextractor.model.CareerProfile;
import reactor.core.publisher.Mono;

/**
 * Contract of the optional enhancement service (an LLM pass over the captured text).
 * Implementations only deliver the service's output; merging is done by the caller.
 */
public interface ProfileEnhancer {

    /**
     * Produce an enhanced profile.
     *
     * @param rawText captured text
     * @param draft   merged profile of the other strategies
     * @return the service's profile, or empty when unavailable
     */
    Mono<CareerProfile> enhance(String rawText, CareerProfile draft);

    /**
     * Check if an enhancement service is configured.
     */
    boolean isEnabled();
}
