package dev.profileextractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.profileextractor.model.CareerProfile;
import dev.profileextractor.model.ProfileCapture;
import dev.profileextractor.model.StructuralHints;
import dev.profileextractor.service.ProfileExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Orchestrates one extraction run: reads the capture from disk, extracts,
 * and writes (or logs) the resulting profile JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final ProfileExtractionService extractionService;
  private final ObjectMapper objectMapper;

  @Value("${app.input.text-file:}")
  private String textFile;

  @Value("${app.input.hints-file:}")
  private String hintsFile;

  @Value("${app.output.file:}")
  private String outputFile;

  /**
   * Executes the extraction pipeline.
   *
   * @return Number of work and education records extracted
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Profile Extractor Starting");
    log.info(SEPARATOR);

    try {
      ProfileCapture capture = readCapture();
      CareerProfile profile = extractionService.extract(capture).block();
      int count = profile != null ? profile.getRecordCount() : 0;

      writeProfile(profile != null ? profile : CareerProfile.empty());

      log.info(SEPARATOR);
      log.info("Profile Extractor Completed Successfully");
      log.info("Records extracted: {}", count);
      log.info(SEPARATOR);

      return count;
    } catch (Exception e) {
      log.error("Profile Extractor failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  private ProfileCapture readCapture() throws IOException {
    if (textFile == null || textFile.isBlank()) {
      throw new IllegalStateException("No input configured (app.input.text-file)");
    }

    String rawText = Files.readString(Path.of(textFile), StandardCharsets.UTF_8);
    StructuralHints hints = null;
    if (hintsFile != null && !hintsFile.isBlank()) {
      hints = objectMapper.readValue(Path.of(hintsFile).toFile(), StructuralHints.class);
    }

    log.info("Read {} chars from {}{}", rawText.length(), textFile,
        hints != null ? " with hints from " + hintsFile : "");
    return ProfileCapture.builder().rawText(rawText).hints(hints).build();
  }

  private void writeProfile(CareerProfile profile) throws IOException {
    String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile);
    if (outputFile == null || outputFile.isBlank()) {
      log.info("Extracted profile:\n{}", json);
      return;
    }
    Files.writeString(Path.of(outputFile), json, StandardCharsets.UTF_8);
    log.info("Profile written to {}", outputFile);
  }
}
