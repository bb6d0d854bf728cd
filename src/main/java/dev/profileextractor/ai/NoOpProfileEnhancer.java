package dev.profileextractor.ai;

import dev.profileextractor.model.CareerProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op implementation of ProfileEnhancer.
 * Used when no enhancement provider is configured; always unavailable.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.enhancement.provider", havingValue = "none", matchIfMissing = true)
public class NoOpProfileEnhancer implements ProfileEnhancer {

    public NoOpProfileEnhancer() {
        log.info("Profile enhancement disabled - using no-op enhancer");
    }

    @Override
    public Mono<CareerProfile> enhance(String rawText, CareerProfile draft) {
        return Mono.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
