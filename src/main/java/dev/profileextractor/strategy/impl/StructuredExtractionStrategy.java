package dev.profileextractor.strategy.impl;

import dev.profileextractor.metrics.ExtractionMetrics;
import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.Certification;
import dev.profileextractor.model.PersonalInfo;
import dev.profileextractor.model.StructuralHints;
import dev.profileextractor.strategy.ExtractionRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Most trusted strategy: the values the capture read from known page elements.
 */
@Component
public class StructuredExtractionStrategy extends AbstractExtractionStrategy {

    public static final String NAME = "structured";
    public static final int TRUST_RANK = 0;

    public StructuredExtractionStrategy(ExtractionMetrics metrics) {
        super(metrics);
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
        if (!request.capture().hasHints()) {
            return Mono.empty();
        }
        return Mono.just(fromHints(request.capture().getHints()));
    }

    private CareerProfile fromHints(StructuralHints hints) {
        return CareerProfile.builder()
                .personalInfo(hints.getPersonalInfo() == null ? new PersonalInfo() : hints.getPersonalInfo().copy())
                .summary(hints.getSummary())
                .workExperience(copyRecords(hints.getExperience()))
                .education(copyRecords(hints.getEducation()))
                .skills(hints.getSkills() == null ? new ArrayList<>()
                        : new ArrayList<>(hints.getSkills().stream().filter(Objects::nonNull).toList()))
                .certifications(hints.getCertifications() == null ? new ArrayList<>()
                        : new ArrayList<>(hints.getCertifications().stream()
                                .filter(Objects::nonNull)
                                .map(Certification::copy)
                                .toList()))
                .build();
    }

    private static List<CandidateRecord> copyRecords(List<CandidateRecord> records) {
        // JSON arrays may carry null entries
        return records == null ? new ArrayList<>() : new ArrayList<>(records.stream()
                .filter(Objects::nonNull)
                .map(CandidateRecord::copy)
                .toList());
    }
}
