package dev.profileextractor.service;

import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.Certification;
import dev.profileextractor.model.PersonalInfo;
import dev.profileextractor.text.TextSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;

/**
 * Reconciles profiles produced by independent strategies into one profile.
 * <p>
 * Profiles are folded in trust order (lower rank = more trusted). A more trusted
 * scalar wins unless the less trusted one is strictly better by a field rule;
 * lists are unioned with duplicate detection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileMergeService {

    private final ExtractionConfig config;
    private final ProfileValidator validator;

    /**
     * Merge strategy outputs.
     *
     * @param profiles   one or more profiles
     * @param trustRanks trust rank per profile, same size; ties keep input order
     * @return the reconciled profile
     * @throws IllegalArgumentException when the list is empty or the sizes differ
     */
    public CareerProfile merge(List<CareerProfile> profiles, List<Integer> trustRanks) {
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalArgumentException("At least one profile is required for merging");
        }
        if (trustRanks == null || trustRanks.size() != profiles.size()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d trust ranks, got %d", profiles.size(), trustRanks == null ? 0 : trustRanks.size()));
        }

        if (profiles.size() == 1) {
            return validator.validate(profiles.get(0));
        }

        List<CareerProfile> ordered = IntStream.range(0, profiles.size())
                .boxed()
                .sorted(Comparator.comparingInt(trustRanks::get))
                .map(i -> validator.validate(profiles.get(i)))
                .toList();

        CareerProfile merged = ordered.get(0);
        for (int i = 1; i < ordered.size(); i++) {
            merged = mergePair(merged, ordered.get(i));
        }

        log.info("Merged {} profiles: {} work, {} education, {} skills",
                profiles.size(), merged.getWorkExperience().size(), merged.getEducation().size(),
                merged.getSkills().size());
        return merged;
    }

    /**
     * Merge a less trusted profile into a more trusted one. Both must be validated.
     */
    CareerProfile mergePair(CareerProfile trusted, CareerProfile other) {
        return CareerProfile.builder()
                .personalInfo(mergePersonalInfo(trusted.getPersonalInfo(), other.getPersonalInfo()))
                .summary(emptyToNull(preferLonger(trusted.getSummary(), other.getSummary(), Integer.MAX_VALUE)))
                .workExperience(mergeRecords(trusted.getWorkExperience(), other.getWorkExperience()))
                .education(mergeRecords(trusted.getEducation(), other.getEducation()))
                .skills(unionIgnoreCase(trusted.getSkills(), other.getSkills(),
                        Function.identity(), UnaryOperator.identity()))
                .certifications(unionIgnoreCase(trusted.getCertifications(), other.getCertifications(),
                        Certification::getName, Certification::copy))
                .build();
    }

    private PersonalInfo mergePersonalInfo(PersonalInfo trusted, PersonalInfo other) {
        PersonalInfo merged = trusted.copy();

        String fullName = emptyToNull(
                preferLonger(trusted.getFullName(), other.getFullName(), config.getNameMaxLength()));
        merged.setFullName(fullName);
        if (fullName != null && !fullName.equals(trusted.getFullName())) {
            // Name parts follow the full name they came with
            merged.setFirstName(other.getFirstName());
            merged.setLastName(other.getLastName());
        } else {
            merged.setFirstName(firstNonEmpty(trusted.getFirstName(), other.getFirstName()));
            merged.setLastName(firstNonEmpty(trusted.getLastName(), other.getLastName()));
        }

        merged.setHeadline(emptyToNull(
                preferLonger(trusted.getHeadline(), other.getHeadline(), config.getHeadlineMaxLength())));
        merged.setLocation(preferLocation(trusted.getLocation(), other.getLocation()));
        merged.setEmail(firstNonEmpty(trusted.getEmail(), other.getEmail()));
        merged.setPhone(firstNonEmpty(trusted.getPhone(), other.getPhone()));
        merged.setWebsite(firstNonEmpty(trusted.getWebsite(), other.getWebsite()));
        merged.setLinkedin(firstNonEmpty(trusted.getLinkedin(), other.getLinkedin()));
        return merged;
    }

    /**
     * Trusted value unless empty, or the other is longer and within the cap.
     * The cap only limits replacing a value; it never blanks a field.
     * Returns "" when both are empty.
     */
    private static String preferLonger(String trusted, String other, int maxLength) {
        String a = trusted == null ? "" : trusted;
        String b = other == null ? "" : other;
        if (a.isEmpty()) {
            return b;
        }
        if (b.length() > a.length() && b.length() <= maxLength) {
            return b;
        }
        return a;
    }

    /**
     * "City, Region" beats a bare city.
     */
    private static String preferLocation(String trusted, String other) {
        if (isEmpty(trusted)) {
            return emptyToNull(other);
        }
        if (!isEmpty(other) && !trusted.contains(",") && other.contains(",")) {
            return other;
        }
        return trusted;
    }

    private List<CandidateRecord> mergeRecords(List<CandidateRecord> trusted, List<CandidateRecord> other) {
        List<CandidateRecord> merged = new ArrayList<>();
        trusted.forEach(record -> merged.add(record.copy()));

        for (CandidateRecord candidate : other) {
            boolean duplicate = merged.stream().anyMatch(existing -> isSameRecord(existing, candidate));
            if (duplicate) {
                log.debug("Skipping duplicate record '{}' at '{}'", candidate.getTitle(), candidate.getOrganization());
            } else {
                merged.add(candidate.copy());
            }
        }
        return merged;
    }

    /**
     * Same organization and the same (or a near-identical) title.
     */
    boolean isSameRecord(CandidateRecord first, CandidateRecord second) {
        if (!equalsIgnoreCase(first.getOrganization(), second.getOrganization())) {
            return false;
        }
        return equalsIgnoreCase(first.getTitle(), second.getTitle())
                || TextSimilarity.overlapRatio(first.getTitle(), second.getTitle())
                >= config.getTitleSimilarityThreshold();
    }

    private static <T> List<T> unionIgnoreCase(List<T> trusted, List<T> other,
                                               Function<T, String> key, UnaryOperator<T> copier) {
        List<T> merged = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (List<T> source : List.of(trusted, other)) {
            for (T item : source) {
                if (seen.add(key.apply(item).toLowerCase(Locale.ROOT))) {
                    merged.add(copier.apply(item));
                }
            }
        }
        return merged;
    }

    private static String firstNonEmpty(String trusted, String other) {
        return isEmpty(trusted) ? emptyToNull(other) : trusted;
    }

    private static boolean equalsIgnoreCase(String a, String b) {
        return a != null && a.equalsIgnoreCase(b);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static String emptyToNull(String value) {
        return isEmpty(value) ? null : value;
    }
}
