package dev.profileextractor.service;

import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.Certification;
import dev.profileextractor.model.PersonalInfo;
import dev.profileextractor.model.RecordKind;
import dev.profileextractor.text.DuplicationRepairer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Enforces record and profile invariants on a draft profile.
 * Invalid sub-records are dropped; validation never fails the whole profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileValidator {

    private final ExtractionConfig config;
    private final DuplicationRepairer duplicationRepairer;

    /**
     * Validate and sanitize a draft.
     *
     * @param draft profile from any strategy, may be null
     * @return a new, validated profile; the draft is not modified
     */
    public CareerProfile validate(CareerProfile draft) {
        if (draft == null) {
            return CareerProfile.empty();
        }

        CareerProfile profile = CareerProfile.builder()
                .personalInfo(validatePersonalInfo(draft.getPersonalInfo()))
                .summary(capSummary(trimToNull(draft.getSummary())))
                .workExperience(validateRecords(draft.getWorkExperience(), RecordKind.WORK))
                .education(validateRecords(draft.getEducation(), RecordKind.EDUCATION))
                .skills(validateSkills(draft.getSkills()))
                .certifications(validateCertifications(draft.getCertifications()))
                .build();

        log.debug("Validated profile: {} work, {} education, {} skills, {} certifications",
                profile.getWorkExperience().size(), profile.getEducation().size(),
                profile.getSkills().size(), profile.getCertifications().size());
        return profile;
    }

    /**
     * Sanitize one record.
     *
     * @return the cleaned copy, or null when the record is invalid
     */
    public CandidateRecord validateRecord(CandidateRecord candidate, RecordKind kind) {
        if (candidate == null) {
            return null;
        }

        String title = clean(candidate.getTitle());
        String organization = clean(candidate.getOrganization());

        if (!hasLength(title, config.getTitleMinLength(), config.getTitleMaxLength())) {
            log.debug("Rejected {} record: title '{}' out of bounds", kind, title);
            return null;
        }
        if (!hasLength(organization, config.getOrgMinLength(), config.getOrgMaxLength())) {
            log.debug("Rejected {} record '{}': organization '{}' out of bounds", kind, title, organization);
            return null;
        }
        if (title.equalsIgnoreCase(organization)) {
            log.debug("Rejected {} record: title equals organization '{}'", kind, title);
            return null;
        }

        String description = trimToNull(candidate.getDescription());
        return CandidateRecord.builder()
                .kind(kind)
                .title(title)
                .organization(organization)
                .dateRange(clean(candidate.getDateRange()))
                .location(clean(candidate.getLocation()))
                .description(description != null ? description : title + " at " + organization)
                .build();
    }

    private List<CandidateRecord> validateRecords(List<CandidateRecord> records, RecordKind kind) {
        List<CandidateRecord> valid = new ArrayList<>();
        if (records == null) {
            return valid;
        }
        for (CandidateRecord record : records) {
            CandidateRecord cleaned = validateRecord(record, kind);
            if (cleaned != null && !valid.contains(cleaned)) {
                valid.add(cleaned);
            }
        }
        return valid;
    }

    private PersonalInfo validatePersonalInfo(PersonalInfo info) {
        if (info == null) {
            return new PersonalInfo();
        }

        PersonalInfo cleaned = PersonalInfo.builder()
                .fullName(clean(info.getFullName()))
                .firstName(clean(info.getFirstName()))
                .lastName(clean(info.getLastName()))
                .headline(clean(info.getHeadline()))
                .location(clean(info.getLocation()))
                .email(clean(info.getEmail()))
                .phone(clean(info.getPhone()))
                .website(clean(info.getWebsite()))
                .linkedin(clean(info.getLinkedin()))
                .build();

        String email = cleaned.getEmail();
        if (email != null && !(email.contains("@") && email.contains("."))) {
            log.debug("Dropping malformed email '{}'", email);
            cleaned.setEmail(null);
        }
        return cleaned;
    }

    private List<String> validateSkills(List<String> skills) {
        List<String> valid = new ArrayList<>();
        if (skills == null) {
            return valid;
        }
        Set<String> seen = new HashSet<>();
        for (String skill : skills) {
            String cleaned = clean(skill);
            if (cleaned == null || cleaned.length() > config.getSkillMaxLength()) {
                continue;
            }
            if (seen.add(cleaned.toLowerCase(Locale.ROOT))) {
                valid.add(cleaned);
            }
        }
        return valid;
    }

    private List<Certification> validateCertifications(List<Certification> certifications) {
        List<Certification> valid = new ArrayList<>();
        if (certifications == null) {
            return valid;
        }
        Set<String> seen = new HashSet<>();
        for (Certification certification : certifications) {
            if (certification == null) {
                continue;
            }
            String name = clean(certification.getName());
            if (name == null || name.length() < config.getTitleMinLength()) {
                continue;
            }
            if (seen.add(name.toLowerCase(Locale.ROOT))) {
                valid.add(new Certification(name, clean(certification.getIssuer())));
            }
        }
        return valid;
    }

    private String capSummary(String summary) {
        int max = config.getSummaryMaxLength();
        if (summary == null || summary.length() <= max) {
            return summary;
        }
        String marker = config.getTruncationMarker();
        return summary.substring(0, Math.max(0, max - marker.length())) + marker;
    }

    /**
     * Trim and repair doubling; blank becomes null.
     */
    private String clean(String value) {
        if (value == null) {
            return null;
        }
        String repaired = duplicationRepairer.repair(value);
        return repaired.isEmpty() ? null : repaired;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static boolean hasLength(String value, int min, int max) {
        return value != null && value.length() >= min && value.length() <= max;
    }
}
