package dev.profileextractor.text;

import java.util.Locale;

/**
 * Cheap positional similarity used to spot near-duplicate titles.
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * Normalized character-overlap ratio: characters equal at the same position,
     * divided by the length of the longer string. Case-insensitive; two empty
     * strings are identical.
     *
     * @return ratio in [0, 1]
     */
    public static double overlapRatio(String first, String second) {
        String a = first == null ? "" : first.trim().toLowerCase(Locale.ROOT);
        String b = second == null ? "" : second.trim().toLowerCase(Locale.ROOT);
        String longer = a.length() >= b.length() ? a : b;
        String shorter = a.length() >= b.length() ? b : a;

        if (longer.isEmpty()) {
            return 1.0;
        }

        int matches = 0;
        for (int i = 0; i < shorter.length(); i++) {
            if (shorter.charAt(i) == longer.charAt(i)) {
                matches++;
            }
        }
        return (double) matches / longer.length();
    }
}
