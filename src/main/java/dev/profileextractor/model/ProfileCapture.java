package dev.profileextractor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Input delivered by the text-acquisition collaborator: the captured text
 * blob, optionally already split into lines, plus structural hints.
 */
@Data
@Builder
public class ProfileCapture {

    private String rawText;

    /** Pre-split lines; when present they take precedence over rawText. */
    private List<String> lines;

    private StructuralHints hints;

    public static ProfileCapture ofText(String rawText) {
        return ProfileCapture.builder().rawText(rawText).build();
    }

    @JsonIgnore
    public boolean hasHints() {
        return hints != null && !hints.isEmpty();
    }

    @JsonIgnore
    public boolean hasText() {
        return (rawText != null && !rawText.isBlank()) || (lines != null && !lines.isEmpty());
    }
}
