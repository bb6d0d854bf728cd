package dev.profileextractor.strategy;

import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.ProfileCapture;

/**
 * Input of one strategy run: the capture and, for draft-dependent strategies,
 * the merged draft of the independent ones.
 */
public record ExtractionRequest(ProfileCapture capture, CareerProfile draft) {

    public static ExtractionRequest of(ProfileCapture capture) {
        return new ExtractionRequest(capture, null);
    }

    public ExtractionRequest withDraft(CareerProfile draft) {
        return new ExtractionRequest(capture, draft);
    }

    /**
     * The captured text as one blob.
     */
    public String rawText() {
        if (capture.getRawText() != null && !capture.getRawText().isBlank()) {
            return capture.getRawText();
        }
        return capture.getLines() == null ? "" : String.join("\n", capture.getLines());
    }
}
