package dev.profileextractor.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.profileextractor.model.CareerProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Implementation of ProfileEnhancer that reads the enhancement service's output
 * from a JSON file produced out of band (the service call itself happens elsewhere).
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.enhancement.provider", havingValue = "file")
public class FileProfileEnhancer implements ProfileEnhancer {

    private final ObjectMapper objectMapper;
    private final String profilePath;

    public FileProfileEnhancer(
            ObjectMapper objectMapper,
            @Value("${app.enhancement.file.path:}") String profilePath) {
        this.objectMapper = objectMapper;
        this.profilePath = profilePath;

        if (profilePath == null || profilePath.isBlank()) {
            log.warn("Enhancement file path is missing! Enhancement will be unavailable.");
        } else {
            log.info("File-based profile enhancement enabled: {}", profilePath);
        }
    }

    @Override
    public Mono<CareerProfile> enhance(String rawText, CareerProfile draft) {
        if (!isEnabled()) {
            return Mono.empty();
        }

        Path path = Path.of(profilePath);
        return Mono.fromCallable(() -> readProfile(path))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(profile -> log.info("Loaded enhanced profile from {} ({} records)",
                        path, profile.getRecordCount()));
    }

    @Override
    public boolean isEnabled() {
        return profilePath != null && !profilePath.isBlank();
    }

    private CareerProfile readProfile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Enhanced profile not found: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), CareerProfile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read enhanced profile " + path, e);
        }
    }
}
