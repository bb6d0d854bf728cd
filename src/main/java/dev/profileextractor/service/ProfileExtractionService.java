package dev.profileextractor.service;

import dev.profileextractor.metrics.ExtractionMetrics;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.ProfileCapture;
import dev.profileextractor.strategy.ExtractionRequest;
import dev.profileextractor.strategy.ExtractionStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Main orchestration service: runs the strategies and reconciles their output.
 * <p>
 * Independent strategies run concurrently; draft-dependent ones (enhancement)
 * run once the independent outputs are merged into a draft. The final merge
 * only starts after every strategy has completed or been declared unavailable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileExtractionService {

    private static final String SEPARATOR = "========================================";

    private final List<ExtractionStrategy> strategies;
    private final ProfileMergeService mergeService;
    private final ProfileValidator validator;
    private final ExtractionMetrics metrics;

    /**
     * Profile produced by one strategy.
     */
    public record StrategyOutput(String strategy, int trustRank, CareerProfile profile) {
    }

    /**
     * Extract a profile from a capture.
     *
     * @param capture captured text and hints
     * @return the reconciled profile; empty collections when nothing was found
     */
    public Mono<CareerProfile> extract(ProfileCapture capture) {
        if (capture == null) {
            return Mono.just(validator.validate(CareerProfile.empty()));
        }

        List<ExtractionStrategy> enabled = strategies.stream()
                .filter(ExtractionStrategy::isEnabled)
                .toList();
        List<ExtractionStrategy> independent = enabled.stream().filter(s -> !s.requiresDraft()).toList();
        List<ExtractionStrategy> dependent = enabled.stream().filter(ExtractionStrategy::requiresDraft).toList();

        log.info(SEPARATOR);
        log.info("Profile extraction starting");
        log.info(SEPARATOR);
        log.info("Strategies enabled: {}", enabled.stream().map(ExtractionStrategy::getName).toList());

        ExtractionRequest request = ExtractionRequest.of(capture);

        return runAll(independent, request)
                .flatMap(outputs -> {
                    if (dependent.isEmpty()) {
                        return Mono.just(outputs);
                    }
                    CareerProfile draft = reconcile(outputs);
                    return runAll(dependent, request.withDraft(draft))
                            .map(enhanced -> {
                                List<StrategyOutput> all = new ArrayList<>(outputs);
                                all.addAll(enhanced);
                                return all;
                            });
                })
                .map(outputs -> {
                    CareerProfile profile = reconcile(outputs);
                    metrics.recordExtraction(outputs.size(), profile.getRecordCount());

                    log.info(SEPARATOR);
                    log.info("EXTRACTION SUMMARY: {} strategies produced output", outputs.size());
                    log.info("Work: {}, Education: {}, Skills: {}",
                            profile.getWorkExperience().size(), profile.getEducation().size(),
                            profile.getSkills().size());
                    log.info(SEPARATOR);
                    return profile;
                });
    }

    /**
     * Run strategies concurrently and collect the ones that produced a profile,
     * in strategy order.
     */
    private Mono<List<StrategyOutput>> runAll(List<ExtractionStrategy> toRun, ExtractionRequest request) {
        return Flux.fromIterable(toRun)
                .flatMapSequential(strategy -> {
                    log.info("Running strategy: {}", strategy.getName());
                    return strategy.extract(request)
                            .map(profile -> new StrategyOutput(strategy.getName(), strategy.getTrustRank(), profile));
                })
                .collectList();
    }

    private CareerProfile reconcile(List<StrategyOutput> outputs) {
        if (outputs.isEmpty()) {
            log.warn("No strategy produced a profile - returning empty profile");
            return validator.validate(CareerProfile.empty());
        }
        return mergeService.merge(
                outputs.stream().map(StrategyOutput::profile).toList(),
                outputs.stream().map(StrategyOutput::trustRank).toList());
    }
}
