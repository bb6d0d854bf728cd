package dev.profileextractor.service;

import dev.profileextractor.config.KeywordTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Splits profile lines into page sections (About, Experience, Education, ...)
 * using the heading lines of the keyword tables.
 */
@Slf4j
@Service
public class SectionSplitter {

    public enum Section {
        HEADER,
        ABOUT,
        EXPERIENCE,
        EDUCATION,
        SKILLS,
        CERTIFICATIONS,
        OTHER
    }

    private final Map<String, Section> headings = new HashMap<>();

    public SectionSplitter(KeywordTable keywords) {
        keywords.getSectionHeadings().forEach((name, words) -> {
            Section section = toSection(name);
            words.forEach(word -> headings.putIfAbsent(word.trim().toLowerCase(Locale.ROOT), section));
        });
    }

    /**
     * Group lines by the section they fall under. Lines before the first heading
     * belong to HEADER; heading lines themselves are dropped.
     *
     * @param lines   lines in page order
     * @param content accessor for the text of a line
     * @return sections that have at least one line, in page order of first appearance
     */
    public <T> Map<Section, List<T>> split(List<T> lines, Function<T, String> content) {
        Map<Section, List<T>> sections = new EnumMap<>(Section.class);
        Section current = Section.HEADER;

        for (T line : lines) {
            Section heading = headingOf(content.apply(line));
            if (heading != null) {
                current = heading;
                continue;
            }
            sections.computeIfAbsent(current, key -> new ArrayList<>()).add(line);
        }
        return sections;
    }

    /**
     * Lines of one section. When the text carries no headings at all the whole
     * input is returned, so bare snippets (a pasted experience list) still work.
     */
    public <T> List<T> section(List<T> lines, Function<T, String> content, Section section) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }
        if (!hasHeadings(lines, content)) {
            return lines;
        }
        return split(lines, content).getOrDefault(section, List.of());
    }

    public <T> boolean hasHeadings(List<T> lines, Function<T, String> content) {
        return lines.stream().anyMatch(line -> headingOf(content.apply(line)) != null);
    }

    Section headingOf(String line) {
        if (line == null) {
            return null;
        }
        return headings.get(line.trim().toLowerCase(Locale.ROOT));
    }

    private static Section toSection(String name) {
        try {
            return Section.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown section '{}' in keyword table, treating as OTHER", name);
            return Section.OTHER;
        }
    }
}
