package dev.profileextractor.service;

import dev.profileextractor.TestFixtures;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.Certification;
import dev.profileextractor.model.PersonalInfo;
import dev.profileextractor.model.ProfileCapture;
import dev.profileextractor.model.TextLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileDetailsExtractorTest {

    private final TestFixtures fixtures = new TestFixtures();
    private final ProfileDetailsExtractor extractor = fixtures.detailsExtractor;

    private CareerProfile extract(String text) {
        ProfileCapture capture = ProfileCapture.ofText(text);
        return extractor.extract(fixtures.pipeline.rawLines(capture), fixtures.pipeline.normalize(capture));
    }

    private static List<TextLine> lines(String... contents) {
        return java.util.stream.IntStream.range(0, contents.length)
                .mapToObj(i -> new TextLine(contents[i], i))
                .toList();
    }

    @Nested
    @DisplayName("Full capture")
    class FixtureTests {

        private CareerProfile profile;

        @BeforeEach
        void setUp() {
            profile = extract(TestFixtures.readFixture("profile_en.txt"));
        }

        @Test
        @DisplayName("Should read name, headline and location from the header")
        void shouldExtractHeader() {
            PersonalInfo info = profile.getPersonalInfo();

            assertThat(info.getFullName()).isEqualTo("Jane Doe");
            assertThat(info.getFirstName()).isEqualTo("Jane");
            assertThat(info.getLastName()).isEqualTo("Doe");
            assertThat(info.getHeadline()).isEqualTo("Senior Software Engineer at Acme Corporation");
            assertThat(info.getLocation()).isEqualTo("San Francisco Bay Area");
        }

        @Test
        @DisplayName("Should read contact details")
        void shouldExtractContacts() {
            PersonalInfo info = profile.getPersonalInfo();

            assertThat(info.getEmail()).isEqualTo("jane.doe@example.com");
            assertThat(info.getPhone()).isEqualTo("+1 415 555 0132");
            assertThat(info.getLinkedin()).isEqualTo("https://linkedin.com/in/janedoe");
            assertThat(info.getWebsite()).isNull();
        }

        @Test
        @DisplayName("Should keep the long About paragraph")
        void shouldExtractSummary() {
            assertThat(profile.getSummary())
                    .startsWith("Backend engineer focused on distributed systems")
                    .endsWith("mostly on the JVM.");
        }

        @Test
        @DisplayName("Should read skills and certifications")
        void shouldExtractSkillsAndCertifications() {
            assertThat(profile.getSkills()).containsExactly("Java", "Spring Boot", "Kubernetes", "java");
            assertThat(profile.getCertifications()).containsExactly(
                    new Certification("AWS Certified Solutions Architect", "Amazon Web Services Inc"));
        }

        @Test
        @DisplayName("Should not produce records")
        void shouldLeaveRecordsEmpty() {
            assertThat(profile.getRecordCount()).isZero();
        }
    }

    @Test
    @DisplayName("Should split skills listed on one line")
    void shouldSplitInlineSkills() {
        List<String> skills = extractor.extractSkills(lines("Java · Kotlin", "SQL, Terraform | Go", "Endorsed by 3 colleagues"));

        assertThat(skills).containsExactly("Java", "Kotlin", "SQL", "Terraform", "Go");
    }

    @Test
    @DisplayName("Should skip credential lines between certifications")
    void shouldSkipCredentialLines() {
        List<Certification> certifications = extractor.extractCertifications(lines(
                "Certified Kubernetes Administrator",
                "Issued Mar 2022 · Expires Mar 2025",
                "Credential ID 1234",
                "Oracle Certified Professional Java Programmer",
                "Oracle Corporation"));

        assertThat(certifications).containsExactly(
                new Certification("Certified Kubernetes Administrator", null),
                new Certification("Oracle Certified Professional Java Programmer", "Oracle Corporation"));
    }

    @Test
    @DisplayName("Should ignore short phone-like numbers and find a website")
    void shouldFilterContacts() {
        CareerProfile profile = extract("Jane Doe\nOrder 12345\nhttps://janedoe.dev");

        assertThat(profile.getPersonalInfo().getPhone()).isNull();
        assertThat(profile.getPersonalInfo().getWebsite()).isEqualTo("https://janedoe.dev");
    }

    @Test
    @DisplayName("Should leave the summary empty without section headings")
    void shouldNotGuessSummary() {
        assertThat(extract("Jane Doe\nSoftware Engineer").getSummary()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Software Engineer", "Acme Corporation", "Tokyo, Japan", "jane doe", "Jane", "R2 D2"})
    @DisplayName("Should not take roles, companies or places for a name")
    void shouldRejectNonNames(String line) {
        assertThat(extractor.looksLikeName(line)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Jane Doe", "Mary-Jane O'Neil", "山田 太郎"})
    @DisplayName("Should accept names")
    void shouldAcceptNames(String line) {
        assertThat(extractor.looksLikeName(line)).isTrue();
    }
}
