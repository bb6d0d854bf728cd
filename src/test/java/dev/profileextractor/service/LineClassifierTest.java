package dev.profileextractor.service;

import dev.profileextractor.TestFixtures;
import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.model.LineLabel;
import dev.profileextractor.model.StructuralHints;
import dev.profileextractor.model.TextLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineClassifierTest {

    private final LineClassifier classifier = new TestFixtures().classifier;

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Software Engineer, TITLE",
            "Front Desk Agent, TITLE",
            "Acme Corporation, COMPANY",
            "Embassy Suites, COMPANY",
            "Hotel Manager, COMPANY",
            "Northwind Traders, COMPANY",
            "Jan 2020 - Present, DATE_RANGE",
            "2 yrs 3 mos, DATE_RANGE",
            "2015 - 2019, DATE_RANGE",
            "Full-time, METADATA",
            "Acme Corp · Full-time, METADATA",
            "'Tokyo, Japan', METADATA",
            "Greater Boston Area, METADATA",
            "Endorsed by 3 colleagues, METADATA",
            "shipped features every week, UNCLASSIFIED",
            "ソフトウェアエンジニア, TITLE",
            "株式会社テスト, COMPANY",
            "月島機械株式会社, COMPANY",
            "4月 - 12月, DATE_RANGE",
            "2020年4月 - 現在, DATE_RANGE"
    })
    @DisplayName("Should label lines by ordered rules")
    void shouldClassifyLines(String line, LineLabel expected) {
        assertThat(classifier.classify(line)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should keep one label per input line in order")
    void shouldClassifyListInOrder() {
        List<ClassifiedLine> lines = classifier.classify(List.of(
                new TextLine("Software Engineer", 0),
                new TextLine("Acme Corporation", 1),
                new TextLine("Jan 2020 - Present", 2)));

        assertThat(lines).extracting(ClassifiedLine::label)
                .containsExactly(LineLabel.TITLE, LineLabel.COMPANY, LineLabel.DATE_RANGE);
        assertThat(lines).extracting(ClassifiedLine::index).containsExactly(0, 1, 2);
    }

    @Nested
    @DisplayName("Structural hints")
    class HintTests {

        private final StructuralHints hints = StructuralHints.builder()
                .experience(List.of(CandidateRecord.builder()
                        .title("Founding Member")
                        .organization("Acme")
                        .build()))
                .build();

        @Test
        @DisplayName("Should promote a hinted title the rules only guessed as a company")
        void shouldPromoteHintedTitle() {
            List<ClassifiedLine> lines = classifier.classify(List.of(new TextLine("Founding Member", 0)), hints);

            assertThat(classifier.classify("Founding Member")).isEqualTo(LineLabel.COMPANY);
            assertThat(lines.get(0).label()).isEqualTo(LineLabel.TITLE);
        }

        @Test
        @DisplayName("Should promote an unclassified hinted company")
        void shouldPromoteHintedCompany() {
            List<ClassifiedLine> lines = classifier.classify(List.of(new TextLine("acme", 0)), hints);

            assertThat(lines.get(0).label()).isEqualTo(LineLabel.COMPANY);
        }

        @Test
        @DisplayName("Should never let a hint override a rule match")
        void shouldNotOverrideRules() {
            StructuralHints dateAsTitle = StructuralHints.builder()
                    .experience(List.of(CandidateRecord.builder().title("Jan 2020 - Present").build()))
                    .build();

            List<ClassifiedLine> lines = classifier.classify(List.of(new TextLine("Jan 2020 - Present", 0)), dateAsTitle);

            assertThat(lines.get(0).label()).isEqualTo(LineLabel.DATE_RANGE);
        }
    }

    @Nested
    @DisplayName("Education lines")
    class EducationTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "University of Tokyo, SCHOOL",
                "Bachelor of Science, DEGREE",
                "2015 - 2019, DATE_RANGE",
                "Computer Science, UNCLASSIFIED",
                "東京大学, SCHOOL",
                "工学部 学士, DEGREE"
        })
        void shouldClassifyEducationLines(String line, LineLabel expected) {
            assertThat(classifier.classifyEducation(line)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Company recovery from metadata")
    class MetadataCompanyTests {

        @Test
        void shouldRecoverCompanyBeforeEmploymentType() {
            assertThat(classifier.companyFromMetadata("Acme Corp · Full-time")).contains("Acme Corp");
        }

        @Test
        void shouldRepairDoubledCompany() {
            assertThat(classifier.companyFromMetadata("Embassy SuitesEmbassy Suites · Part-time"))
                    .contains("Embassy Suites");
        }

        @Test
        void shouldIgnoreOtherMetadataShapes() {
            assertThat(classifier.companyFromMetadata("Full-time · 2 yrs")).isEmpty();
            assertThat(classifier.companyFromMetadata("Java · Spring")).isEmpty();
            assertThat(classifier.companyFromMetadata("Senior Engineer · Full-time")).isEmpty();
            assertThat(classifier.companyFromMetadata("Acme Corporation")).isEmpty();
        }
    }
}
