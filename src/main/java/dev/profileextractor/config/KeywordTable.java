package dev.profileextractor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Keyword lists driving line classification for one locale.
 * Loaded from keywords/{locale}.json; several locales are merged into one table.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeywordTable {

    private String locale = "";
    private List<String> roleKeywords = new ArrayList<>();
    private List<String> companySuffixes = new ArrayList<>();
    private List<String> monthTokens = new ArrayList<>();
    private List<String> presentTokens = new ArrayList<>();
    private List<String> durationPatterns = new ArrayList<>();
    private List<String> employmentTypes = new ArrayList<>();
    private List<String> boilerplate = new ArrayList<>();
    private List<String> noisePatterns = new ArrayList<>();
    private List<String> locationKeywords = new ArrayList<>();
    private List<String> schoolKeywords = new ArrayList<>();
    private List<String> degreeKeywords = new ArrayList<>();
    private List<String> connectorWords = new ArrayList<>();

    /**
     * Section name (experience, education, skills, about, certifications, other)
     * to the headings that open it.
     */
    private Map<String, List<String>> sectionHeadings = new LinkedHashMap<>();

    /**
     * Union of this table and another, keeping first-seen order.
     */
    public KeywordTable mergedWith(KeywordTable other) {
        KeywordTable merged = new KeywordTable();
        merged.setLocale(locale.isEmpty() ? other.getLocale() : locale + "+" + other.getLocale());
        merged.setRoleKeywords(union(roleKeywords, other.getRoleKeywords()));
        merged.setCompanySuffixes(union(companySuffixes, other.getCompanySuffixes()));
        merged.setMonthTokens(union(monthTokens, other.getMonthTokens()));
        merged.setPresentTokens(union(presentTokens, other.getPresentTokens()));
        merged.setDurationPatterns(union(durationPatterns, other.getDurationPatterns()));
        merged.setEmploymentTypes(union(employmentTypes, other.getEmploymentTypes()));
        merged.setBoilerplate(union(boilerplate, other.getBoilerplate()));
        merged.setNoisePatterns(union(noisePatterns, other.getNoisePatterns()));
        merged.setLocationKeywords(union(locationKeywords, other.getLocationKeywords()));
        merged.setSchoolKeywords(union(schoolKeywords, other.getSchoolKeywords()));
        merged.setDegreeKeywords(union(degreeKeywords, other.getDegreeKeywords()));
        merged.setConnectorWords(union(connectorWords, other.getConnectorWords()));

        Map<String, List<String>> headings = new LinkedHashMap<>(sectionHeadings);
        other.getSectionHeadings().forEach((section, words) ->
                headings.merge(section, words, KeywordTable::union));
        merged.setSectionHeadings(headings);
        return merged;
    }

    private static List<String> union(List<String> first, List<String> second) {
        LinkedHashSet<String> all = new LinkedHashSet<>(first);
        all.addAll(second);
        return new ArrayList<>(all);
    }
}
