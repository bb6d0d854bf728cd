package dev.profileextractor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Configuration for loading the per-locale keyword tables from keywords/*.json.
 */
@Slf4j
@Configuration
public class KeywordConfig {

    private static final String KEYWORDS_PATH = "keywords/%s.json";

    @Bean
    public KeywordTable keywordTable(ObjectMapper objectMapper, ExtractionConfig extractionConfig) {
        return loadTables(objectMapper, extractionConfig.getLocales());
    }

    /**
     * Load and merge the tables of the given locales.
     *
     * @param objectMapper mapper used to read the JSON tables
     * @param locales      locale codes, e.g. "en", "ja"
     * @return merged keyword table
     */
    public static KeywordTable loadTables(ObjectMapper objectMapper, List<String> locales) {
        if (locales == null || locales.isEmpty()) {
            throw new IllegalStateException("At least one keyword locale must be configured");
        }

        KeywordTable merged = new KeywordTable();
        for (String locale : locales) {
            merged = merged.mergedWith(loadTable(objectMapper, locale));
        }
        log.info("Loaded keyword tables for locales {} ({} role keywords, {} company suffixes)",
                locales, merged.getRoleKeywords().size(), merged.getCompanySuffixes().size());
        return merged;
    }

    private static KeywordTable loadTable(ObjectMapper objectMapper, String locale) {
        ClassPathResource resource = new ClassPathResource(String.format(KEYWORDS_PATH, locale));
        if (!resource.exists()) {
            throw new IllegalStateException("No keyword table for locale: " + locale);
        }

        try (InputStream in = resource.getInputStream()) {
            KeywordTable table = objectMapper.readValue(in, KeywordTable.class);
            table.setLocale(locale);
            return table;
        } catch (IOException e) {
            log.error("Failed to load keyword table {}", resource.getPath(), e);
            throw new IllegalStateException("Could not load keyword table for locale " + locale, e);
        }
    }
}
