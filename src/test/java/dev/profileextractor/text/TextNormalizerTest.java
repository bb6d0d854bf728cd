package dev.profileextractor.text;

import dev.profileextractor.TestFixtures;
import dev.profileextractor.model.TextLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TestFixtures().normalizer;

    private static List<String> contents(List<TextLine> lines) {
        return lines.stream().map(TextLine::content).toList();
    }

    @Nested
    @DisplayName("Line filtering")
    class FilteringTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\n\n\t"})
        @DisplayName("Should return no lines for empty input")
        void shouldReturnEmptyForBlankInput(String input) {
            assertThat(normalizer.normalize(input)).isEmpty();
        }

        @Test
        @DisplayName("Should drop lines outside the length bounds")
        void shouldDropShortAndLongLines() {
            String longLine = "x".repeat(151);
            List<TextLine> lines = normalizer.normalize("ab\nSoftware Engineer\n" + longLine + "\nabc");

            assertThat(contents(lines)).containsExactly("Software Engineer", "abc");
        }

        @Test
        @DisplayName("Should drop UI chrome lines")
        void shouldDropNoise() {
            String raw = String.join("\n",
                    "Software Engineer",
                    "500+ connections",
                    "Show all 12 experiences",
                    "Message",
                    "Follow",
                    "1234",
                    "Page 2 of 5",
                    "Acme Corporation");

            assertThat(contents(normalizer.normalize(raw)))
                    .containsExactly("Software Engineer", "Acme Corporation");
        }

        @Test
        @DisplayName("Should not treat lines that merely contain noise words as noise")
        void shouldKeepLinesContainingNoiseWords() {
            assertThat(normalizer.isNoise("Message queue platform")).isFalse();
            assertThat(normalizer.isNoise("Follow")).isTrue();
        }
    }

    @Nested
    @DisplayName("Cleaning")
    class CleaningTests {

        @Test
        @DisplayName("Should trim, collapse spaces and strip invisible characters")
        void shouldCleanWhitespace() {
            List<TextLine> lines = normalizer.normalize("  Software\u200B   Engineer \r\n\tAcme Corporation  ");

            assertThat(contents(lines)).containsExactly("Software Engineer", "Acme Corporation");
        }

        @Test
        @DisplayName("Should repair doubled lines before filtering")
        void shouldRepairDoubling() {
            assertThat(contents(normalizer.normalize("Embassy SuitesEmbassy Suites")))
                    .containsExactly("Embassy Suites");
        }

        @Test
        @DisplayName("Should collapse a line repeated right after itself")
        void shouldCollapseConsecutiveRepeats() {
            List<TextLine> lines = normalizer.normalize("Acme Corporation\nAcme Corporation\nSoftware Engineer");

            assertThat(contents(lines)).containsExactly("Acme Corporation", "Software Engineer");
        }

        @Test
        @DisplayName("Should index lines by position in the cleaned sequence")
        void shouldIndexSequentially() {
            List<TextLine> lines = normalizer.normalize("Software Engineer\nx\nAcme Corporation\n\nJan 2020 - Present");

            assertThat(lines).extracting(TextLine::index).containsExactly(0, 1, 2);
        }
    }

    @Test
    @DisplayName("Should accept pre-split lines")
    void shouldNormalizePreSplitLines() {
        List<TextLine> lines = normalizer.normalizeLines(List.of(" Software Engineer ", "", "Acme Corporation"));

        assertThat(contents(lines)).containsExactly("Software Engineer", "Acme Corporation");
    }

    @Test
    @DisplayName("Should keep long lines when splitting without filters")
    void shouldSplitWithoutFilters() {
        String paragraph = "word ".repeat(60).trim();

        assertThat(normalizer.splitLines("About\n" + paragraph)).containsExactly("About", paragraph);
    }

    @Test
    @DisplayName("Should give identical output for identical input")
    void shouldBePure() {
        String raw = TestFixtures.readFixture("profile_en.txt");

        assertThat(normalizer.normalize(raw)).isEqualTo(normalizer.normalize(raw));
    }
}
