package dev.profileextractor.text;

import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Collapses text doubled by the page capture, e.g. "Embassy SuitesEmbassy Suites"
 * (visible and screen-reader copies of the same span concatenated).
 */
@Component
public class DuplicationRepairer {

    private static final int MIN_DOUBLED_LENGTH = 6;

    /**
     * Repair a doubled string.
     *
     * @param text captured text, may be null
     * @return the single copy, or the input unchanged when no doubling is found
     */
    public String repair(String text) {
        if (text == null) {
            return null;
        }
        String value = text.trim();
        int length = value.length();

        // Literal doubling: "AbcAbc"
        if (length > MIN_DOUBLED_LENGTH && length % 2 == 0) {
            String firstHalf = value.substring(0, length / 2);
            if (firstHalf.equals(value.substring(length / 2))) {
                return firstHalf;
            }
        }

        // Token doubling: "Senior Engineer Senior Engineer Tokyo" -> "Senior Engineer Tokyo"
        String[] tokens = value.split("\\s+");
        for (int k = 1; 2 * k <= tokens.length; k++) {
            if (Arrays.equals(tokens, 0, k, tokens, k, 2 * k)) {
                String[] kept = new String[tokens.length - k];
                System.arraycopy(tokens, 0, kept, 0, k);
                System.arraycopy(tokens, 2 * k, kept, k, tokens.length - 2 * k);
                return String.join(" ", kept);
            }
        }
        return value;
    }
}
