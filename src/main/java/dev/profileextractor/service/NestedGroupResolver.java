package dev.profileextractor.service;

import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.model.LineLabel;
import dev.profileextractor.model.RecordKind;
import dev.profileextractor.model.TextLine;
import dev.profileextractor.service.ProximityAssociator.AnchoredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands one company heading followed by several stacked roles
 * (a promotion history) into one record per role.
 * <p>
 * A group starts at a company-like line and runs to the next one. Groups with
 * enough valid titles are resolved here and their lines are withheld from
 * proximity association.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NestedGroupResolver {

    private final ExtractionConfig config;
    private final ProximityAssociator associator;

    /**
     * Records from nested groups plus the lines left for proximity association.
     */
    public record Resolution(List<AnchoredRecord> records, List<ClassifiedLine> remaining) {

        public static Resolution unchanged(List<ClassifiedLine> lines) {
            return new Resolution(List.of(), lines);
        }
    }

    public Resolution resolve(List<ClassifiedLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return Resolution.unchanged(List.of());
        }

        List<TextLine> companies = associator.companyLines(lines);
        if (companies.isEmpty()) {
            return Resolution.unchanged(lines);
        }

        List<AnchoredRecord> records = new ArrayList<>();
        Set<Integer> consumed = new HashSet<>();

        for (int i = 0; i < companies.size(); i++) {
            TextLine company = companies.get(i);
            int groupEnd = i + 1 < companies.size() ? companies.get(i + 1).index() : Integer.MAX_VALUE;
            int nextGroupEnd = i + 2 < companies.size() ? companies.get(i + 2).index() : Integer.MAX_VALUE;

            List<ClassifiedLine> group = linesBetween(lines, company.index(), groupEnd);

            // A title right above a company without titles of its own heads that company's entry
            boolean nextHasTitles = groupEnd != Integer.MAX_VALUE
                    && linesBetween(lines, groupEnd, nextGroupEnd).stream().anyMatch(line -> line.is(LineLabel.TITLE));
            int trailingIndex = nextHasTitles ? -1 : groupEnd - 1;

            List<TextLine> titles = ProximityAssociator.linesLabelled(group, LineLabel.TITLE).stream()
                    .filter(title -> title.index() != trailingIndex)
                    .filter(title -> isValidTitle(title.content(), company.content()))
                    .toList();

            if (!isValidOrganization(company.content()) || titles.size() < config.getNestedMinTitles()) {
                continue;
            }

            List<TextLine> dates = ProximityAssociator.linesLabelled(group, LineLabel.DATE_RANGE);
            for (TextLine title : titles) {
                TextLine date = ProximityAssociator.nearest(title, datesOwnedBy(title, titles, dates),
                        config.getDateWindow()).orElse(null);
                int recordEnd = date == null ? title.index() : Math.max(title.index(), date.index());
                int boundary = Math.min(ProximityAssociator.nextAnchorIndex(titles, title.index(), groupEnd), groupEnd);

                CandidateRecord record = CandidateRecord.builder()
                        .kind(RecordKind.WORK)
                        .title(title.content())
                        .organization(company.content())
                        .dateRange(date == null ? null : date.content())
                        .location(associator.locate(group, recordEnd, boundary))
                        .description(associator.describe(group, recordEnd, boundary))
                        .build();
                records.add(new AnchoredRecord(title.index(), record));
            }

            consumed.add(company.index());
            group.stream()
                    .filter(line -> !(line.is(LineLabel.TITLE) && line.index() == trailingIndex))
                    .forEach(line -> consumed.add(line.index()));
            log.debug("Nested group at line {} ('{}') expanded into {} roles",
                    company.index(), company.content(), titles.size());
        }

        if (records.isEmpty()) {
            return Resolution.unchanged(lines);
        }

        List<ClassifiedLine> remaining = lines.stream()
                .filter(line -> !consumed.contains(line.index()))
                .toList();
        return new Resolution(records, remaining);
    }

    private static List<ClassifiedLine> linesBetween(List<ClassifiedLine> lines, int start, int end) {
        return lines.stream()
                .filter(line -> line.index() > start && line.index() < end)
                .toList();
    }

    /**
     * Dates closer to this title than to any other role of the group.
     * A date halfway between two roles belongs to the one above it.
     */
    private static List<TextLine> datesOwnedBy(TextLine title, List<TextLine> titles, List<TextLine> dates) {
        return dates.stream()
                .filter(date -> closestTitle(date, titles).index() == title.index())
                .toList();
    }

    private static TextLine closestTitle(TextLine date, List<TextLine> titles) {
        TextLine closest = titles.get(0);
        for (TextLine title : titles) {
            if (Math.abs(title.index() - date.index()) < Math.abs(closest.index() - date.index())) {
                closest = title;
            }
        }
        return closest;
    }

    private boolean isValidTitle(String title, String company) {
        int length = title.length();
        return length >= config.getTitleMinLength()
                && length <= config.getTitleMaxLength()
                && !title.equalsIgnoreCase(company);
    }

    private boolean isValidOrganization(String organization) {
        int length = organization.length();
        return length >= config.getOrgMinLength() && length <= config.getOrgMaxLength();
    }
}
