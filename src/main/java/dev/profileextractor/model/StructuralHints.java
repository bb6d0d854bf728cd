package dev.profileextractor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Values the capture collaborator read from known page elements (name heading,
 * experience list items, ...). They only pre-seed guesses; the classifier
 * re-validates every hinted title and company.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StructuralHints {

    @JsonProperty("personal_info")
    private PersonalInfo personalInfo;

    private String summary;

    @Builder.Default
    private List<CandidateRecord> experience = new ArrayList<>();

    @Builder.Default
    private List<CandidateRecord> education = new ArrayList<>();

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    private List<Certification> certifications = new ArrayList<>();

    @JsonIgnore
    public boolean isEmpty() {
        return personalInfo == null
                && (summary == null || summary.isBlank())
                && isEmpty(experience)
                && isEmpty(education)
                && isEmpty(skills)
                && isEmpty(certifications);
    }

    @JsonIgnore
    public List<String> getTitleHints() {
        return experience == null ? List.of() : experience.stream()
                .filter(Objects::nonNull)
                .map(CandidateRecord::getTitle)
                .filter(title -> title != null && !title.isBlank())
                .toList();
    }

    @JsonIgnore
    public List<String> getCompanyHints() {
        return experience == null ? List.of() : experience.stream()
                .filter(Objects::nonNull)
                .map(CandidateRecord::getOrganization)
                .filter(company -> company != null && !company.isBlank())
                .toList();
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}
