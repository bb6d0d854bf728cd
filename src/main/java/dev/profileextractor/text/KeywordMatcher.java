package dev.profileextractor.text;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive matcher over a keyword list.
 * Latin keywords match on word boundaries so "java" does not match "javascript";
 * keywords in scripts without word spacing (Japanese) match as substrings.
 */
public final class KeywordMatcher {

    private final Pattern boundedPattern;
    private final List<String> substrings;

    private KeywordMatcher(Pattern boundedPattern, List<String> substrings) {
        this.boundedPattern = boundedPattern;
        this.substrings = substrings;
    }

    public static KeywordMatcher of(Collection<String> keywords) {
        List<String> bounded = new ArrayList<>();
        List<String> substrings = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String trimmed = keyword.trim();
            if (isUnspacedScript(trimmed)) {
                substrings.add(trimmed);
            } else {
                bounded.add(trimmed);
            }
        }

        Pattern pattern = null;
        if (!bounded.isEmpty()) {
            String alternatives = bounded.stream()
                    .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|"));
            pattern = Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternatives + ")(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        }
        return new KeywordMatcher(pattern, List.copyOf(substrings));
    }

    /**
     * Check if the text contains any of the keywords.
     */
    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (boundedPattern != null && boundedPattern.matcher(text).find()) {
            return true;
        }
        if (substrings.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : substrings) {
            if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUnspacedScript(String keyword) {
        return keyword.codePoints().anyMatch(cp -> {
            Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            return script == Character.UnicodeScript.HAN
                    || script == Character.UnicodeScript.HIRAGANA
                    || script == Character.UnicodeScript.KATAKANA;
        });
    }
}
