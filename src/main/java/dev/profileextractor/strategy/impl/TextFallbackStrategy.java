package dev.profileextractor.strategy.impl;

import dev.profileextractor.metrics.ExtractionMetrics;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.model.ProfileCapture;
import dev.profileextractor.service.ExtractionPipeline;
import dev.profileextractor.service.ProfileDetailsExtractor;
import dev.profileextractor.strategy.ExtractionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic pass over the captured text: normalize, classify, associate.
 */
@Slf4j
@Component
public class TextFallbackStrategy extends AbstractExtractionStrategy {

    public static final String NAME = "text-fallback";
    public static final int TRUST_RANK = 1;

    private final ExtractionPipeline pipeline;
    private final ProfileDetailsExtractor detailsExtractor;

    public TextFallbackStrategy(ExtractionMetrics metrics, ExtractionPipeline pipeline,
                                ProfileDetailsExtractor detailsExtractor) {
        super(metrics);
        this.pipeline = pipeline;
        this.detailsExtractor = detailsExtractor;
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
    protected Mono<CareerProfile> doExtract(ExtractionRequest request) {
        ProfileCapture capture = request.capture();
        if (!capture.hasText()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> extractFromText(capture));
    }

    private CareerProfile extractFromText(ProfileCapture capture) {
        List<ClassifiedLine> lines = pipeline.normalizeAndClassify(capture);

        CareerProfile profile = detailsExtractor.extract(pipeline.rawLines(capture),
                lines.stream().map(ClassifiedLine::line).toList());
        profile.setWorkExperience(new ArrayList<>(pipeline.extractWorkExperience(lines)));
        profile.setEducation(new ArrayList<>(pipeline.extractEducation(lines)));

        log.debug("Text pass: {} lines, {} work, {} education",
                lines.size(), profile.getWorkExperience().size(), profile.getEducation().size());
        return profile;
    }
}
