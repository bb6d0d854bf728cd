package dev.profileextractor.strategy;

import dev.profileextractor.model.CareerProfile;
import reactor.core.publisher.Mono;

/**
 * Interface for profile extraction strategies.
 * Each independent way of producing a profile (DOM hints, raw text, enhancement
 * service) implements this interface.
 */
public interface ExtractionStrategy {

    /**
     * Get the name of this strategy (e.g., "structured", "text-fallback")
     */
    String getName();

    /**
     * Trust rank used when merging; lower is more trusted.
     */
    int getTrustRank();

    /**
     * Produce a profile, or complete empty when this strategy has nothing to offer.
     */
    Mono<CareerProfile> extract(ExtractionRequest request);

    /**
     * Check if this strategy needs the merged draft of the other strategies.
     */
    default boolean requiresDraft() {
        return false;
    }

    /**
     * Check if this strategy is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
