package dev.profileextractor.service;

import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.Certification;
import dev.profileextractor.model.LineLabel;
import dev.profileextractor.model.PersonalInfo;
import dev.profileextractor.model.TextLine;
import dev.profileextractor.service.SectionSplitter.Section;
import dev.profileextractor.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts the non-record parts of a profile from captured text: personal
 * details, About summary, skills and certifications.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileDetailsExtractor {

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

    private static final Pattern PHONE = Pattern.compile(
            "(?<![\\d\\w])(?:\\+\\d{1,3}[-.\\s]?)?\\(?\\d{2,4}\\)?[-.\\s]?\\d{3,4}[-.\\s]?\\d{4}(?!\\d)");

    private static final Pattern LINKEDIN = Pattern.compile(
            "(?:https?://)?(?:[a-z]{2,3}\\.)?linkedin\\.com/in/[^\\s\"'?<>/]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern WEBSITE = Pattern.compile("https?://[^\\s\"'<>]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern SKILL_SEPARATOR = Pattern.compile("\\s*[·•∙,|]\\s*");

    private static final Pattern CREDENTIAL_LINE = Pattern.compile(
            "^(issued|expires|credential|show credential|see credential)\\b.*", Pattern.CASE_INSENSITIVE);

    private static final int MIN_PHONE_DIGITS = 9;
    private static final int MAX_NAME_LENGTH = 50;

    private final ExtractionConfig config;
    private final LineClassifier classifier;
    private final SectionSplitter sectionSplitter;
    private final TextNormalizer normalizer;

    /**
     * Extract details from one capture.
     *
     * @param rawLines cleaned but unfiltered lines (long About paragraphs survive here)
     * @param lines    normalized candidate lines
     * @return a profile with personal info, summary, skills and certifications; no records
     */
    public CareerProfile extract(List<String> rawLines, List<TextLine> lines) {
        Map<Section, List<TextLine>> sections = sectionSplitter.split(lines, TextLine::content);
        List<TextLine> header = sections.getOrDefault(Section.HEADER, List.of());

        return CareerProfile.builder()
                .personalInfo(extractPersonalInfo(rawLines, header))
                .summary(extractSummary(rawLines))
                .skills(new ArrayList<>(extractSkills(sections.getOrDefault(Section.SKILLS, List.of()))))
                .certifications(new ArrayList<>(
                        extractCertifications(sections.getOrDefault(Section.CERTIFICATIONS, List.of()))))
                .build();
    }

    PersonalInfo extractPersonalInfo(List<String> rawLines, List<TextLine> header) {
        PersonalInfo info = new PersonalInfo();
        String text = String.join("\n", rawLines);

        info.setEmail(firstMatch(EMAIL, text));
        info.setPhone(findPhone(text));

        String linkedin = firstMatch(LINKEDIN, text);
        if (linkedin != null) {
            info.setLinkedin(linkedin.toLowerCase(Locale.ROOT).startsWith("http") ? linkedin : "https://" + linkedin);
        }

        Matcher website = WEBSITE.matcher(text);
        while (website.find()) {
            if (!website.group().toLowerCase(Locale.ROOT).contains("linkedin.com")) {
                info.setWebsite(website.group());
                break;
            }
        }

        List<TextLine> scan = header.stream().limit(config.getHeaderScanLines()).toList();
        for (int i = 0; i < scan.size(); i++) {
            String line = scan.get(i).content();
            if (info.getFullName() == null && looksLikeName(line)) {
                String[] words = line.split("\\s+");
                info.setFullName(line);
                info.setFirstName(words[0]);
                info.setLastName(words[words.length - 1]);
                if (i + 1 < scan.size()) {
                    String next = scan.get(i + 1).content();
                    if (!classifier.isLocation(next) && !EMAIL.matcher(next).find()
                            && next.length() <= config.getHeadlineMaxLength()) {
                        info.setHeadline(next);
                    }
                }
            } else if (info.getLocation() == null && classifier.isLocation(line)) {
                info.setLocation(line);
            }
        }
        return info;
    }

    /**
     * Text of the About section, one paragraph per line.
     */
    String extractSummary(List<String> rawLines) {
        if (!sectionSplitter.hasHeadings(rawLines, line -> line)) {
            return null;
        }
        List<String> about = sectionSplitter.split(rawLines, (String line) -> line)
                .getOrDefault(Section.ABOUT, List.of());
        String summary = about.stream()
                .filter(line -> !normalizer.isNoise(line))
                .collect(Collectors.joining("\n"));
        return summary.isBlank() ? null : summary;
    }

    List<String> extractSkills(List<TextLine> skillLines) {
        List<String> skills = new ArrayList<>();
        for (TextLine line : skillLines) {
            String content = line.content();
            if (classifier.isBoilerplate(content) || classifier.isDateRange(content)) {
                continue;
            }
            for (String piece : SKILL_SEPARATOR.split(content)) {
                String skill = piece.trim();
                if (!skill.isEmpty() && skill.length() <= config.getSkillMaxLength()) {
                    skills.add(skill);
                }
            }
        }
        return skills;
    }

    /**
     * Certification name lines, each optionally followed by an issuer line.
     */
    List<Certification> extractCertifications(List<TextLine> certificationLines) {
        List<Certification> certifications = new ArrayList<>();
        Certification current = null;

        for (TextLine line : certificationLines) {
            String content = line.content();
            if (CREDENTIAL_LINE.matcher(content).matches()
                    || classifier.classify(content) == LineLabel.DATE_RANGE
                    || classifier.isBoilerplate(content)) {
                continue;
            }
            if (current != null && current.getIssuer() == null && classifier.isCompany(content)) {
                current.setIssuer(content);
                continue;
            }
            current = new Certification(content, null);
            certifications.add(current);
        }
        return certifications;
    }

    boolean looksLikeName(String line) {
        if (line.length() >= MAX_NAME_LENGTH || line.chars().anyMatch(Character::isDigit)) {
            return false;
        }
        if (classifier.isTitle(line) || classifier.hasCompanySuffix(line)
                || classifier.isLocation(line) || classifier.isMetadata(line)) {
            return false;
        }
        String[] words = line.split("\\s+");
        if (words.length < 2 || words.length > 4) {
            return false;
        }
        for (String word : words) {
            int first = word.codePointAt(0);
            boolean capitalized = Character.isUpperCase(first);
            boolean ideographic = Character.isIdeographic(first)
                    || Character.UnicodeScript.of(first) == Character.UnicodeScript.KATAKANA;
            if (!capitalized && !ideographic) {
                return false;
            }
            if (!word.codePoints().allMatch(cp -> Character.isLetter(cp) || cp == '-' || cp == '\'' || cp == '.')) {
                return false;
            }
        }
        return true;
    }

    private String findPhone(String text) {
        Matcher matcher = PHONE.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().trim();
            long digits = candidate.chars().filter(Character::isDigit).count();
            if (digits >= MIN_PHONE_DIGITS) {
                return candidate;
            }
        }
        return null;
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }
}
