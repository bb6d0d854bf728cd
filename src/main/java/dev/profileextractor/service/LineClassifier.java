package dev.profileextractor.service;

import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.config.KeywordTable;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.model.LineLabel;
import dev.profileextractor.model.StructuralHints;
import dev.profileextractor.model.TextLine;
import dev.profileextractor.text.DuplicationRepairer;
import dev.profileextractor.text.KeywordMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Labels captured lines with ordered heuristic rules.
 * <p>
 * Rules run cheapest and most precise first: DateRange, then Metadata, then the
 * ambiguous Title/Company pair. The label is a pure function of the line content
 * (plus optional hints, which can only promote otherwise unmatched lines).
 */
@Slf4j
@Service
public class LineClassifier {

    private static final Pattern YEAR = Pattern.compile("(?<!\\d)(19|20)\\d{2}(?!\\d)");

    private static final Pattern BULLET_SEPARATOR = Pattern.compile("[·•∙]");

    private static final Pattern LOCATION_SHAPE = Pattern.compile(
            "^\\p{Lu}[\\p{L}.'\\- ]*(,\\s*\\p{Lu}[\\p{L}.'\\- ]*){1,2}$");

    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+");

    private static final int MAX_PROPER_CASED_TOKENS = 8;

    private final ExtractionConfig config;
    private final DuplicationRepairer duplicationRepairer;

    private final KeywordMatcher monthTokens;
    private final KeywordMatcher presentTokens;
    private final List<Pattern> durationPatterns;
    private final KeywordMatcher employmentTypes;
    private final KeywordMatcher boilerplate;
    private final KeywordMatcher locationKeywords;
    private final KeywordMatcher roleKeywords;
    private final KeywordMatcher companySuffixes;
    private final KeywordMatcher schoolKeywords;
    private final KeywordMatcher degreeKeywords;
    private final Set<String> connectorWords;

    public LineClassifier(ExtractionConfig config, KeywordTable keywords, DuplicationRepairer duplicationRepairer) {
        this.config = config;
        this.duplicationRepairer = duplicationRepairer;
        this.monthTokens = KeywordMatcher.of(keywords.getMonthTokens());
        this.presentTokens = KeywordMatcher.of(keywords.getPresentTokens());
        this.durationPatterns = keywords.getDurationPatterns().stream()
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
        this.employmentTypes = KeywordMatcher.of(keywords.getEmploymentTypes());
        this.boilerplate = KeywordMatcher.of(keywords.getBoilerplate());
        this.locationKeywords = KeywordMatcher.of(keywords.getLocationKeywords());
        this.roleKeywords = KeywordMatcher.of(keywords.getRoleKeywords());
        this.companySuffixes = KeywordMatcher.of(keywords.getCompanySuffixes());
        this.schoolKeywords = KeywordMatcher.of(keywords.getSchoolKeywords());
        this.degreeKeywords = KeywordMatcher.of(keywords.getDegreeKeywords());
        this.connectorWords = keywords.getConnectorWords().stream()
                .map(word -> word.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Classify work-section lines.
     */
    public List<ClassifiedLine> classify(List<TextLine> lines) {
        return classify(lines, null);
    }

    /**
     * Classify work-section lines, letting hinted titles and companies promote
     * lines the rules leave unclassified (or only guess as proper-cased companies).
     *
     * @param lines normalized lines
     * @param hints structural hints, may be null
     * @return one classified line per input line, same order
     */
    public List<ClassifiedLine> classify(List<TextLine> lines, StructuralHints hints) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }

        Set<String> titleHints = hints == null ? Set.of() : lowerCased(hints.getTitleHints());
        Set<String> companyHints = hints == null ? Set.of() : lowerCased(hints.getCompanyHints());

        return lines.stream()
                .map(line -> new ClassifiedLine(line, applyHints(line.content(), classify(line.content()),
                        titleHints, companyHints)))
                .toList();
    }

    /**
     * Label a single work line.
     */
    public LineLabel classify(String content) {
        if (content == null || content.isBlank()) {
            return LineLabel.UNCLASSIFIED;
        }
        if (isDateRange(content)) {
            return LineLabel.DATE_RANGE;
        }
        if (isMetadata(content)) {
            return LineLabel.METADATA;
        }
        if (isTitle(content)) {
            return LineLabel.TITLE;
        }
        if (isCompany(content)) {
            return LineLabel.COMPANY;
        }
        return LineLabel.UNCLASSIFIED;
    }

    /**
     * Label a single education line: SCHOOL, DEGREE, DATE_RANGE or UNCLASSIFIED.
     */
    public LineLabel classifyEducation(String content) {
        if (content == null || content.isBlank()) {
            return LineLabel.UNCLASSIFIED;
        }
        if (schoolKeywords.matches(content)) {
            return LineLabel.SCHOOL;
        }
        if (degreeKeywords.matches(content)) {
            return LineLabel.DEGREE;
        }
        if (isDateRange(content)) {
            return LineLabel.DATE_RANGE;
        }
        return LineLabel.UNCLASSIFIED;
    }

    public boolean isDateRange(String content) {
        if (monthTokens.matches(content) || presentTokens.matches(content) || YEAR.matcher(content).find()) {
            return true;
        }
        return durationPatterns.stream().anyMatch(pattern -> pattern.matcher(content).find());
    }

    public boolean isMetadata(String content) {
        return employmentTypes.matches(content)
                || BULLET_SEPARATOR.matcher(content).find()
                || boilerplate.matches(content)
                || isLocation(content);
    }

    public boolean isBoilerplate(String content) {
        return boilerplate.matches(content);
    }

    public boolean isTitle(String content) {
        return roleKeywords.matches(content) && !hasCompanySuffix(content);
    }

    public boolean isCompany(String content) {
        return hasCompanySuffix(content) || (isProperCasedMultiWord(content) && !isTitle(content));
    }

    public boolean hasCompanySuffix(String content) {
        return companySuffixes.matches(content);
    }

    /**
     * Location-shaped line ("Tokyo, Japan", "Greater Boston Area") that is not a role or company.
     */
    public boolean isLocation(String content) {
        if (content == null || roleKeywords.matches(content) || hasCompanySuffix(content)) {
            return false;
        }
        return locationKeywords.matches(content) || LOCATION_SHAPE.matcher(content).matches();
    }

    /**
     * Recover the company from a "Company · Employment type" metadata line.
     *
     * @return the company part, if the line has that shape
     */
    public Optional<String> companyFromMetadata(String content) {
        if (content == null || !BULLET_SEPARATOR.matcher(content).find()) {
            return Optional.empty();
        }

        String[] parts = BULLET_SEPARATOR.split(content);
        if (parts.length < 2) {
            return Optional.empty();
        }

        String candidate = duplicationRepairer.repair(parts[0]);
        boolean typedAfter = false;
        for (int i = 1; i < parts.length; i++) {
            if (employmentTypes.matches(parts[i])) {
                typedAfter = true;
                break;
            }
        }

        if (!typedAfter
                || candidate.length() < config.getOrgMinLength()
                || employmentTypes.matches(candidate)
                || isDateRange(candidate)
                || isTitle(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Two or more words, each capitalized or a connector ("of", "&", ...).
     */
    boolean isProperCasedMultiWord(String content) {
        String[] tokens = content.trim().split("\\s+");
        if (tokens.length < 2 || tokens.length > MAX_PROPER_CASED_TOKENS) {
            return false;
        }

        int words = 0;
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (connectorWords.contains(token.toLowerCase(Locale.ROOT)) && i > 0) {
                continue;
            }
            String stripped = LEADING_PUNCTUATION.matcher(token).replaceFirst("");
            if (stripped.isEmpty()) {
                continue;
            }
            int first = stripped.codePointAt(0);
            if (!Character.isUpperCase(first) && !Character.isDigit(first)) {
                return false;
            }
            words++;
        }
        return words >= 2;
    }

    private LineLabel applyHints(String content, LineLabel label, Set<String> titleHints, Set<String> companyHints) {
        if (titleHints.isEmpty() && companyHints.isEmpty()) {
            return label;
        }
        String key = content.toLowerCase(Locale.ROOT);
        boolean promotable = label == LineLabel.UNCLASSIFIED
                || (label == LineLabel.COMPANY && !hasCompanySuffix(content));

        if (promotable && titleHints.contains(key)) {
            log.debug("Line '{}' promoted to TITLE by hint", content);
            return LineLabel.TITLE;
        }
        if (label == LineLabel.UNCLASSIFIED && companyHints.contains(key)) {
            log.debug("Line '{}' promoted to COMPANY by hint", content);
            return LineLabel.COMPANY;
        }
        return label;
    }

    private static Set<String> lowerCased(List<String> values) {
        return values.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
