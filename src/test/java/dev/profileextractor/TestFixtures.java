package dev.profileextractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.profileextractor.config.ExtractionConfig;
import dev.profileextractor.config.KeywordConfig;
import dev.profileextractor.config.KeywordTable;
import dev.profileextractor.model.ClassifiedLine;
import dev.profileextractor.model.ProfileCapture;
import dev.profileextractor.model.StructuralHints;
import dev.profileextractor.service.ExperienceExtractionService;
import dev.profileextractor.service.ExtractionPipeline;
import dev.profileextractor.service.LineClassifier;
import dev.profileextractor.service.NestedGroupResolver;
import dev.profileextractor.service.ProfileDetailsExtractor;
import dev.profileextractor.service.ProfileMergeService;
import dev.profileextractor.service.ProfileValidator;
import dev.profileextractor.service.ProximityAssociator;
import dev.profileextractor.service.SectionSplitter;
import dev.profileextractor.text.DuplicationRepairer;
import dev.profileextractor.text.HtmlTextExtractor;
import dev.profileextractor.text.TextNormalizer;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Wires the extraction components by hand for unit tests.
 */
public final class TestFixtures {

    private static final KeywordTable KEYWORDS =
            KeywordConfig.loadTables(new ObjectMapper(), List.of("en", "ja"));

    public final ExtractionConfig config;
    public final DuplicationRepairer repairer = new DuplicationRepairer();
    public final TextNormalizer normalizer;
    public final LineClassifier classifier;
    public final SectionSplitter sectionSplitter;
    public final ProximityAssociator associator;
    public final NestedGroupResolver nestedGroupResolver;
    public final ExperienceExtractionService experienceService;
    public final ProfileValidator validator;
    public final ProfileMergeService mergeService;
    public final ProfileDetailsExtractor detailsExtractor;
    public final ExtractionPipeline pipeline;

    public TestFixtures() {
        this(new ExtractionConfig());
    }

    public TestFixtures(ExtractionConfig config) {
        this.config = config;
        this.normalizer = new TextNormalizer(config, KEYWORDS, repairer, new HtmlTextExtractor());
        this.classifier = new LineClassifier(config, KEYWORDS, repairer);
        this.sectionSplitter = new SectionSplitter(KEYWORDS);
        this.associator = new ProximityAssociator(config, classifier);
        this.nestedGroupResolver = new NestedGroupResolver(config, associator);
        this.experienceService = new ExperienceExtractionService(
                classifier, sectionSplitter, nestedGroupResolver, associator);
        this.validator = new ProfileValidator(config, repairer);
        this.mergeService = new ProfileMergeService(config, validator);
        this.detailsExtractor = new ProfileDetailsExtractor(config, classifier, sectionSplitter, normalizer);
        this.pipeline = new ExtractionPipeline(normalizer, classifier, experienceService, validator, mergeService);
    }

    /**
     * Classify lines as given, without normalization.
     */
    public List<ClassifiedLine> classified(String... lines) {
        return pipeline.normalizeAndClassify(String.join("\n", lines));
    }

    /**
     * The English sample profile text with its structural hints.
     */
    public static ProfileCapture sampleCapture(ObjectMapper objectMapper) throws IOException {
        return ProfileCapture.builder()
                .rawText(readFixture("profile_en.txt"))
                .hints(objectMapper.readValue(readFixture("hints_en.json"), StructuralHints.class))
                .build();
    }

    public static String readFixture(String name) {
        try {
            return new ClassPathResource("fixtures/" + name).getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
