package dev.profileextractor.service;

import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.service.NestedGroupResolver.Resolution;
import dev.profileextractor.service.ProximityAssociator.AnchoredRecord;
import dev.profileextractor.service.SectionSplitter.Section;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns classified lines into work-experience and education records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExperienceExtractionService {

    private final LineClassifier classifier;
    private final SectionSplitter sectionSplitter;
    private final NestedGroupResolver nestedGroupResolver;
    private final ProximityAssociator associator;

    /**
     * Work records in page order: nested groups first resolved, then proximity
     * association over the remaining lines.
     *
     * @param lines classified lines of a whole profile or of its experience section
     * @return unvalidated work records
     */
    public List<CandidateRecord> extractWorkExperience(List<ClassifiedLine> lines) {
        List<ClassifiedLine> scope = sectionSplitter.section(lines, ClassifiedLine::content, Section.EXPERIENCE);
        if (scope.isEmpty()) {
            return List.of();
        }

        Resolution resolution = nestedGroupResolver.resolve(scope);
        List<AnchoredRecord> anchored = new ArrayList<>(resolution.records());
        anchored.addAll(associator.associateWork(resolution.remaining()));

        List<CandidateRecord> records = inPageOrder(anchored);
        log.debug("Extracted {} work records ({} from nested groups)",
                records.size(), resolution.records().size());
        return records;
    }

    /**
     * Education records in page order. Lines are relabelled with the education rules.
     *
     * @param lines classified lines of a whole profile or of its education section
     * @return unvalidated education records
     */
    public List<CandidateRecord> extractEducation(List<ClassifiedLine> lines) {
        List<ClassifiedLine> scope = sectionSplitter.section(lines, ClassifiedLine::content, Section.EDUCATION);
        if (scope.isEmpty()) {
            return List.of();
        }

        List<ClassifiedLine> relabelled = scope.stream()
                .map(line -> new ClassifiedLine(line.line(), classifier.classifyEducation(line.content())))
                .toList();

        List<CandidateRecord> records = inPageOrder(associator.associateEducation(relabelled));
        log.debug("Extracted {} education records", records.size());
        return records;
    }

    private static List<CandidateRecord> inPageOrder(List<AnchoredRecord> anchored) {
        return anchored.stream()
                .sorted(Comparator.comparingInt(AnchoredRecord::anchorIndex))
                .map(AnchoredRecord::record)
                .toList();
    }
}
