package dev.profileextractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.profileextractor.ai.FileProfileEnhancer;
import dev.profileextractor.ai.ProfileEnhancer;
import dev.profileextractor.model.CandidateRecord;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.service.ProfileExtractionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class EnhancedProfileExtractionIntegrationTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ProfileExtractionService extractionService;

  @Autowired
  private ProfileEnhancer profileEnhancer;

  @Autowired
  private ObjectMapper objectMapper;

  @DynamicPropertySource
  static void enhancementProperties(DynamicPropertyRegistry registry) {
    registry.add("app.enhancement.provider", () -> "file");
    registry.add("app.enhancement.file.path", () -> {
      try {
        return new ClassPathResource("fixtures/enhanced_profile.json").getFile().getAbsolutePath();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    });
  }

  @Test
  @DisplayName("Should merge the enhanced profile as the least trusted source")
  void shouldMergeEnhancedProfile() throws IOException {
    assertThat(profileEnhancer).isInstanceOf(FileProfileEnhancer.class);

    CareerProfile profile = extractionService.extract(TestFixtures.sampleCapture(objectMapper)).block();

    assertThat(profile).isNotNull();
    assertThat(profile.getPersonalInfo().getHeadline())
        .isEqualTo("Senior Software Engineer building payment platforms");
    assertThat(profile.getWorkExperience())
        .extracting(CandidateRecord::getTitle)
        .containsExactly("Senior Software Engineer", "Software Engineer", "Data Analyst", "Teaching Assistant");
    assertThat(profile.getSkills()).containsExactly("Java", "Go", "Spring Boot", "Kubernetes", "Terraform");
  }
}
