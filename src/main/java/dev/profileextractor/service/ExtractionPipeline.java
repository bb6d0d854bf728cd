package dev.profileextractor.service;

import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.model.ProfileCapture;
import dev.profileextractor.model.TextLine;
import dev.profileextractor.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Synchronous entry points of the extraction core.
 * Every call is independent; nothing is kept between calls.
 */
@Service
@RequiredArgsConstructor
public class ExtractionPipeline {

    private final TextNormalizer normalizer;
    private final LineClassifier classifier;
    private final ExperienceExtractionService experienceExtractionService;
    private final ProfileValidator validator;
    private final ProfileMergeService mergeService;

    /**
     * Normalize a raw blob and label its lines. Empty input gives an empty list.
     */
    public List<ClassifiedLine> normalizeAndClassify(String rawText) {
        return classifier.classify(normalizer.normalize(rawText));
    }

    /**
     * Normalize a capture (pre-split lines win over the raw blob) and label its
     * lines, letting the capture's hints promote unmatched lines.
     */
    public List<ClassifiedLine> normalizeAndClassify(ProfileCapture capture) {
        if (capture == null) {
            return List.of();
        }
        return classifier.classify(normalize(capture), capture.getHints());
    }

    public List<CandidateRecord> extractWorkExperience(List<ClassifiedLine> lines) {
        return experienceExtractionService.extractWorkExperience(lines == null ? List.of() : lines);
    }

    public List<CandidateRecord> extractEducation(List<ClassifiedLine> lines) {
        return experienceExtractionService.extractEducation(lines == null ? List.of() : lines);
    }

    /**
     * Validate a draft; never throws.
     */
    public CareerProfile validateProfile(CareerProfile draft) {
        return validator.validate(draft);
    }

    /**
     * Reconcile strategy outputs.
     *
     * @throws IllegalArgumentException on an empty list or a rank list of another size
     */
    public CareerProfile mergeProfiles(List<CareerProfile> profiles, List<Integer> trustRanks) {
        return mergeService.merge(profiles, trustRanks);
    }

    /**
     * Candidate lines of a capture.
     */
    public List<TextLine> normalize(ProfileCapture capture) {
        if (capture.getLines() != null && !capture.getLines().isEmpty()) {
            return normalizer.normalizeLines(capture.getLines());
        }
        return normalizer.normalize(capture.getRawText());
    }

    /**
     * Cleaned but unfiltered lines of a capture.
     */
    public List<String> rawLines(ProfileCapture capture) {
        if (capture.getLines() != null && !capture.getLines().isEmpty()) {
            return normalizer.splitLines(String.join("\n", capture.getLines()));
        }
        return normalizer.splitLines(capture.getRawText());
    }
}
