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

/**
 * A career profile: the draft produced by one strategy, or the reconciled
 * result handed back to the caller.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CareerProfile {

    @JsonProperty("personal_info")
    @Builder.Default
    private PersonalInfo personalInfo = new PersonalInfo();

    private String summary;

    @JsonProperty("work_experience")
    @Builder.Default
    private List<CandidateRecord> workExperience = new ArrayList<>();

    @Builder.Default
    private List<CandidateRecord> education = new ArrayList<>();

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    private List<Certification> certifications = new ArrayList<>();

    public static CareerProfile empty() {
        return CareerProfile.builder().build();
    }

    /**
     * Total number of work and education records.
     */
    @JsonIgnore
    public int getRecordCount() {
        return sizeOf(workExperience) + sizeOf(education);
    }

    /**
     * Deep copy; nothing in the copy is shared with this profile.
     */
    public CareerProfile copy() {
        return CareerProfile.builder()
                .personalInfo(personalInfo == null ? new PersonalInfo() : personalInfo.copy())
                .summary(summary)
                .workExperience(workExperience == null ? new ArrayList<>()
                        : new ArrayList<>(workExperience.stream().map(CandidateRecord::copy).toList()))
                .education(education == null ? new ArrayList<>()
                        : new ArrayList<>(education.stream().map(CandidateRecord::copy).toList()))
                .skills(skills == null ? new ArrayList<>() : new ArrayList<>(skills))
                .certifications(certifications == null ? new ArrayList<>()
                        : new ArrayList<>(certifications.stream().map(Certification::copy).toList()))
                .build();
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
