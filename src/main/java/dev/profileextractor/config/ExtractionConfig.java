package dev.profileextractor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable limits and proximity windows for the extraction pipeline.
 * Loaded from application.yml under 'extraction' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "extraction")
public class ExtractionConfig {

    private List<String> locales = new ArrayList<>(List.of("en", "ja"));

    // Normalization
    private int minLineLength = 3;
    private int maxLineLength = 150;

    // Proximity windows (line-index distance)
    private int companyWindow = 5;
    private int dateWindow = 3;
    private int educationWindow = 3;
    private int nestedMinTitles = 2;

    // Record validation
    private int titleMinLength = 3;
    private int titleMaxLength = 100;
    private int orgMinLength = 2;
    private int orgMaxLength = 100;
    private int skillMaxLength = 80;
    private int summaryMaxLength = 10_000;
    private String truncationMarker = "... [truncated]";

    // Merge heuristics
    private double titleSimilarityThreshold = 0.8;
    private int nameMaxLength = 100;
    private int headlineMaxLength = 200;

    // Personal details
    private int headerScanLines = 6;
    private int maxDescriptionLines = 8;

    private int enhancementTimeoutSeconds = 30;
}
