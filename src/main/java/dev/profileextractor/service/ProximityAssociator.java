package dev.profileextractor.service;

import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.model.LineLabel;
import dev.profileextractor.model.RecordKind;
import dev.profileextractor.model.TextLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pairs anchor lines (titles, degrees) with the nearest unused partner line
 * (company, school) and the nearest date line inside bounded index windows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProximityAssociator {

    private final ExtractionConfig config;
    private final LineClassifier classifier;

    /**
     * A record and the index of the line that anchored it, used to keep output in page order.
     */
    public record AnchoredRecord(int anchorIndex, CandidateRecord record) {
    }

    /**
     * One anchor with the partner and date chosen for it.
     */
    record Pairing(TextLine anchor, TextLine partner, TextLine date) {

        int endIndex() {
            int end = Math.max(anchor.index(), partner.index());
            return date == null ? end : Math.max(end, date.index());
        }
    }

    /**
     * Build work records from classified work lines.
     * Companies include those recovered from "Company · Employment type" metadata.
     */
    public List<AnchoredRecord> associateWork(List<ClassifiedLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }

        List<TextLine> titles = linesLabelled(lines, LineLabel.TITLE);
        List<TextLine> companies = companyLines(lines);
        List<TextLine> dates = linesLabelled(lines, LineLabel.DATE_RANGE);

        List<Pairing> pairings = pair(titles, companies, dates, config.getCompanyWindow(), config.getDateWindow());

        List<AnchoredRecord> records = new ArrayList<>();
        for (Pairing pairing : pairings) {
            int boundary = nextAnchorIndex(titles, pairing.anchor().index(), Integer.MAX_VALUE);
            CandidateRecord record = CandidateRecord.builder()
                    .kind(RecordKind.WORK)
                    .title(pairing.anchor().content())
                    .organization(pairing.partner().content())
                    .dateRange(pairing.date() == null ? null : pairing.date().content())
                    .location(locate(lines, pairing.endIndex(), boundary))
                    .description(describe(lines, pairing.endIndex(), boundary))
                    .build();
            records.add(new AnchoredRecord(pairing.anchor().index(), record));
        }

        log.debug("Associated {} work records from {} titles and {} companies",
                records.size(), titles.size(), companies.size());
        return records;
    }

    /**
     * Build education records from lines labelled with the education rules
     * (DEGREE anchors, SCHOOL partners, DATE_RANGE years).
     */
    public List<AnchoredRecord> associateEducation(List<ClassifiedLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }

        List<TextLine> degrees = linesLabelled(lines, LineLabel.DEGREE);
        List<TextLine> schools = linesLabelled(lines, LineLabel.SCHOOL);
        List<TextLine> years = linesLabelled(lines, LineLabel.DATE_RANGE);

        int window = config.getEducationWindow();
        List<AnchoredRecord> records = pair(degrees, schools, years, window, window).stream()
                .map(pairing -> new AnchoredRecord(pairing.anchor().index(), CandidateRecord.builder()
                        .kind(RecordKind.EDUCATION)
                        .title(pairing.anchor().content())
                        .organization(pairing.partner().content())
                        .dateRange(pairing.date() == null ? null : pairing.date().content())
                        .build()))
                .toList();

        log.debug("Associated {} education records from {} degrees and {} schools",
                records.size(), degrees.size(), schools.size());
        return records;
    }

    /**
     * Pair every anchor, in order, with the nearest unused partner and the nearest date.
     * Used partners leave the pool; dates stay available. Anchors without a partner are dropped.
     */
    List<Pairing> pair(List<TextLine> anchors, List<TextLine> partners, List<TextLine> dates,
                       int partnerWindow, int dateWindow) {
        List<TextLine> pool = new ArrayList<>(partners);
        List<Pairing> pairings = new ArrayList<>();

        for (TextLine anchor : anchors) {
            Optional<TextLine> partner = nearest(anchor, pool, partnerWindow);
            if (partner.isEmpty()) {
                log.debug("Dropping '{}' (no partner within {} lines)", anchor.content(), partnerWindow);
                continue;
            }
            pool.remove(partner.get());
            pairings.add(new Pairing(anchor, partner.get(), nearest(anchor, dates, dateWindow).orElse(null)));
        }
        return pairings;
    }

    /**
     * Candidate with the smallest index distance to the anchor, within the window.
     * Ties go to the candidate after the anchor; a candidate with the anchor's text is never chosen.
     */
    static Optional<TextLine> nearest(TextLine anchor, List<TextLine> candidates, int window) {
        TextLine best = null;
        int bestDistance = Integer.MAX_VALUE;

        for (TextLine candidate : candidates) {
            if (candidate.index() == anchor.index() || candidate.content().equalsIgnoreCase(anchor.content())) {
                continue;
            }
            int distance = Math.abs(candidate.index() - anchor.index());
            if (distance > window) {
                continue;
            }
            boolean after = candidate.index() > anchor.index();
            if (distance < bestDistance || (distance == bestDistance && after)) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Location metadata following the record, before the next anchor and within the date window.
     */
    String locate(List<ClassifiedLine> lines, int recordEnd, int boundary) {
        return lines.stream()
                .filter(line -> line.index() > recordEnd && line.index() < boundary)
                .filter(line -> line.index() - recordEnd <= config.getDateWindow())
                .filter(line -> line.is(LineLabel.METADATA) && classifier.isLocation(line.content()))
                .map(ClassifiedLine::content)
                .findFirst()
                .orElse(null);
    }

    /**
     * Unclassified prose between the record and the next anchor.
     */
    String describe(List<ClassifiedLine> lines, int recordEnd, int boundary) {
        String description = lines.stream()
                .filter(line -> line.index() > recordEnd && line.index() < boundary)
                .filter(line -> line.is(LineLabel.UNCLASSIFIED))
                .limit(config.getMaxDescriptionLines())
                .map(ClassifiedLine::content)
                .collect(Collectors.joining("\n"));
        return description.isEmpty() ? null : description;
    }

    /**
     * Company lines plus companies embedded in metadata lines, in index order.
     */
    List<TextLine> companyLines(List<ClassifiedLine> lines) {
        List<TextLine> companies = new ArrayList<>();
        for (ClassifiedLine line : lines) {
            if (line.is(LineLabel.COMPANY)) {
                companies.add(line.line());
            } else if (line.is(LineLabel.METADATA)) {
                classifier.companyFromMetadata(line.content())
                        .ifPresent(company -> companies.add(new TextLine(company, line.index())));
            }
        }
        companies.sort(Comparator.comparingInt(TextLine::index));
        return companies;
    }

    static int nextAnchorIndex(List<TextLine> anchors, int after, int fallback) {
        return anchors.stream()
                .mapToInt(TextLine::index)
                .filter(index -> index > after)
                .min()
                .orElse(fallback);
    }

    static List<TextLine> linesLabelled(List<ClassifiedLine> lines, LineLabel label) {
        return lines.stream()
                .filter(line -> line.is(label))
                .map(ClassifiedLine::line)
                .toList();
    }
}
