package com.flamingo.ai.extractionqa.config;

import com.flamingo.ai.extractionqa.service.validation.ProblemType;
import com.flamingo.ai.extractionqa.service.validation.SimilarityMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for extraction validation and table reconciliation. */
@Configuration
@ConfigurationProperties(prefix = "extraction-qa")
@Validated
@Getter
@Setter
@Slf4j
public class ValidationConfig {

  @Valid private CrossValidation crossValidation = new CrossValidation();
  @Valid private Prompts prompts = new Prompts();
  @Valid private Tables tables = new Tables();

  @Getter
  @Setter
  public static class CrossValidation {

    /** Master switch; when off no page is sent to the secondary extractor. */
    private boolean enabled = true;

    /** Name of the secondary extractor, used for logging only. */
    private String provider = "openai";

    @NotNull private SimilarityMethod similarityMethod = SimilarityMethod.NUMBER_FREQUENCY;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.95;

    /** Validate every Nth clean page when query filtering is active. */
    @Min(1)
    private int sampleRate = 5;

    /** Never sample clean pages; only problem pages are re-extracted. */
    private boolean skipSampleIfClean = true;

    /** Problem names to run, or the single entry {@code all}. */
    private List<String> enabledProblems =
        new ArrayList<>(
            List.of(
                "empty_tables",
                "low_content_density",
                "missing_numbers",
                "inconsistent_columns",
                "garbled_text",
                "missing_keywords",
                "repetitive_numbers"));

    @NotNull private Duration pageTimeout = Duration.ofSeconds(60);

    @Min(1)
    private int detectionParallelism = Runtime.getRuntime().availableProcessors();

    @Min(1)
    private int extractionConcurrency = 8;

    private int avgTokensPerPage = 500;
    private double costPerThousandTokens = 0.01;

    /**
     * Resolves the configured names into an immutable snapshot. Callers take one snapshot per run
     * so a batch never observes a configuration change halfway through.
     */
    public Set<ProblemType> resolveEnabledProblems() {
      if (enabledProblems == null || enabledProblems.isEmpty()) {
        return Set.of();
      }
      if (enabledProblems.size() == 1 && "all".equalsIgnoreCase(enabledProblems.get(0).trim())) {
        return ProblemType.detectable();
      }
      EnumSet<ProblemType> resolved = EnumSet.noneOf(ProblemType.class);
      for (String name : enabledProblems) {
        Optional<ProblemType> type = ProblemType.fromName(name);
        if (type.isPresent()) {
          resolved.add(type.get());
        } else {
          log.warn("Unknown problem pattern '{}' - skipping", name);
        }
      }
      return Set.copyOf(resolved);
    }

    public double estimateCost(int validatedPages) {
      return validatedPages * avgTokensPerPage * costPerThousandTokens / 1000.0;
    }
  }

  /** Prompt pairs handed to the secondary extractor for pages that embed images. */
  @Getter
  @Setter
  public static class Prompts {

    /** Workflow name that switches image pages to the finance prompt pair. */
    private String financeWorkflow = "01_Fin_Reports";

    private String imageSystemPrompt =
        "You are an expert PDF content extractor specializing in documents with charts, diagrams,"
            + " and images. Extract ALL text content and describe every visual element, including"
            + " any data values it shows.";

    private String imageUserPromptTemplate =
        "Extract all text content from this PDF page (originally page {page_number}) and convert"
            + " it to markdown format. This page contains images, charts, or diagrams - describe"
            + " them thoroughly and extract any visible data values. Include tables with proper"
            + " markdown syntax. Do not skip any content.";

    private String financeImageSystemPrompt =
        "You are an expert at extracting financial and real estate TEXT and TABLES from PDF"
            + " documents. Reproduce every number exactly as printed and keep table structure.";

    private String financeImageUserPromptTemplate =
        "Extract all text and tables from this PDF page (originally page {page_number}) as"
            + " markdown. Transcribe figures inside charts as tables. Do not round or omit any"
            + " number.";
  }

  @Getter
  @Setter
  public static class Tables {

    /** Allow numeric continuity to merge fragments whose headers differ. */
    private boolean numericalValidationEnabled = true;

    /** Balance difference treated as "unchanged" (rounding). */
    @DecimalMin("0.0")
    private double balanceTolerance = 0.01;

    /**
     * Largest relative balance swing still accepted as one transaction. Tuned value, not a domain
     * rule.
     */
    @DecimalMin("0.0")
    private double maxBalanceChangeRatio = 0.5;

    /** Largest absolute balance accepted as a starting state after a zero balance. */
    @DecimalMin("0.0")
    private double zeroBalanceCeiling = 1_000_000;

    /** Share of numeric column positions that must coincide for the alignment fallback. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double columnOverlapRatio = 0.5;
  }
}
