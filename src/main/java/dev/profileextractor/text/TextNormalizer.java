package dev.profileextractor.text;

import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.config.KeywordTable;
import dev.profileextractor.model.TextLine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans noisy captured text into candidate lines:
 * - Unicode NFC normalization and invisible character removal
 * - Line splitting, whitespace collapsing and trimming
 * - Doubling repair, length bounds and UI-chrome (noise) removal
 */
@Slf4j
@Component
public class TextNormalizer {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n|\\u2028|\\u2029");

    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]");

    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t\\u00A0]+");

    private final ExtractionConfig config;
    private final DuplicationRepairer duplicationRepairer;
    private final HtmlTextExtractor htmlTextExtractor;
    private final List<Pattern> noisePatterns;

    public TextNormalizer(ExtractionConfig config, KeywordTable keywordTable,
                          DuplicationRepairer duplicationRepairer, HtmlTextExtractor htmlTextExtractor) {
        this.config = config;
        this.duplicationRepairer = duplicationRepairer;
        this.htmlTextExtractor = htmlTextExtractor;
        this.noisePatterns = keywordTable.getNoisePatterns().stream()
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    /**
     * Split a raw blob into cleaned, non-empty lines without applying the length
     * and noise filters. Used where long prose matters (the About section).
     *
     * @param rawText captured text or HTML, may be null
     * @return cleaned lines in capture order
     */
    public List<String> splitLines(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return List.of();
        }

        String text = htmlTextExtractor.looksLikeHtml(rawText)
                ? htmlTextExtractor.toText(rawText)
                : rawText;

        List<String> lines = new ArrayList<>();
        for (String line : LINE_BREAK.split(text)) {
            String cleaned = clean(line);
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }
        return lines;
    }

    /**
     * Normalize a raw blob into indexed candidate lines.
     *
     * @param rawText captured text or HTML, may be null
     * @return candidate lines; empty for empty input
     */
    public List<TextLine> normalize(String rawText) {
        return normalizeLines(splitLines(rawText));
    }

    /**
     * Normalize pre-split lines into indexed candidate lines.
     *
     * @param rawLines lines as captured, may be null
     * @return candidate lines; indices are positions in the cleaned sequence
     */
    public List<TextLine> normalizeLines(List<String> rawLines) {
        if (rawLines == null || rawLines.isEmpty()) {
            return List.of();
        }

        List<TextLine> result = new ArrayList<>();
        String previous = null;
        int dropped = 0;

        for (String rawLine : rawLines) {
            String line = duplicationRepairer.repair(clean(rawLine));
            if (line == null || !hasAcceptedLength(line) || isNoise(line)) {
                dropped++;
                continue;
            }
            // The capture often repeats a line verbatim right after itself
            if (line.equals(previous)) {
                dropped++;
                continue;
            }
            result.add(new TextLine(line, result.size()));
            previous = line;
        }

        log.debug("Normalized {} raw lines into {} candidate lines ({} dropped)",
                rawLines.size(), result.size(), dropped);
        return result;
    }

    /**
     * Check if a line is UI chrome (pagination, follow buttons, counters...).
     */
    public boolean isNoise(String line) {
        if (line == null) {
            return true;
        }
        for (Pattern pattern : noisePatterns) {
            if (pattern.matcher(line).matches()) {
                return true;
            }
        }
        return false;
    }

    private boolean hasAcceptedLength(String line) {
        int length = line.length();
        return length >= config.getMinLineLength() && length <= config.getMaxLineLength();
    }

    private String clean(String line) {
        if (line == null) {
            return "";
        }
        String result = Normalizer.normalize(line, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        return result.strip();
    }
}
