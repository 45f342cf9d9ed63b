package com.flamingo.ai.extractionqa.service.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.extractionqa.config.ValidationConfig;
import com.flamingo.ai.extractionqa.exception.SecondaryExtractionException;
import com.flamingo.ai.extractionqa.service.validation.model.CrossValidationReport;
import com.flamingo.ai.extractionqa.service.validation.model.PageContent;
import com.flamingo.ai.extractionqa.service.validation.model.ProblemDetection;
import com.flamingo.ai.extractionqa.service.validation.model.PromptOverride;
import com.flamingo.ai.extractionqa.service.validation.model.ValidationResult;
import com.flamingo.ai.extractionqa.service.validation.model.ValidationStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CrossValidationService Tests")
class CrossValidationServiceTest {

  private static final byte[] DOCUMENT = new byte[] {1, 2, 3};
  private static final int FIXED_OFFSET = 1;

  @Mock private ProblemDetector problemDetector;
  @Mock private SecondaryPageExtractor extractor;

  private ValidationConfig validationConfig;
  private SimpleMeterRegistry meterRegistry;
  private ScheduledExecutorService scheduler;
  private CrossValidationService service;

  @BeforeEach
  void setUp() {
    validationConfig = new ValidationConfig();
    meterRegistry = new SimpleMeterRegistry();
    scheduler = Executors.newSingleThreadScheduledExecutor();
    service = createService(extractor, Runnable::run);

    lenient()
        .when(problemDetector.hasAnyProblem(anyString(), any()))
        .thenReturn(ProblemDetection.clean());
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  private CrossValidationService createService(
      SecondaryPageExtractor secondaryExtractor, Executor extraction) {
    SimilarityCalculator similarityCalculator =
        new SimilarityCalculator(new ContentNormalizer(), validationConfig);
    return new CrossValidationService(
        problemDetector,
        similarityCalculator,
        validationConfig,
        secondaryExtractor,
        Runnable::run,
        extraction,
        scheduler,
        meterRegistry,
        bound -> FIXED_OFFSET);
  }

  private void markProblem(String text, ProblemType... problems) {
    lenient()
        .when(problemDetector.hasAnyProblem(eq(text), any()))
        .thenReturn(ProblemDetection.of(Set.of(problems)));
  }

  private static List<PageContent> cleanPages(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> new PageContent(i, "Page " + i + " total 1,000"))
        .toList();
  }

  @Nested
  @DisplayName("Problem pages")
  class ProblemPages {

    @Test
    @DisplayName("Should replace a problem page with the secondary extraction unconditionally")
    void shouldReplaceProblemPage() {
      markProblem("broken", ProblemType.EMPTY_TABLES);
      when(extractor.extractPage(any(), eq(0), any())).thenReturn("repaired text");

      CrossValidationReport report =
          service.crossValidatePages(
              List.of(new PageContent(0, "broken"), new PageContent(1, "Page 1 total 1,000")),
              DOCUMENT,
              false);

      assertThat(report.results()).hasSize(1);
      ValidationResult result = report.results().get(0);
      assertThat(result.pageNumber()).isEqualTo(0);
      assertThat(result.hadProblem()).isTrue();
      assertThat(result.replacementText()).isEqualTo("repaired text");
      assertThat(result.similarityScore()).isEqualTo(0.0);
      assertThat(result.detectedProblems()).containsExactly(ProblemType.EMPTY_TABLES);
      assertThat(report.problemPages()).containsExactly(0);
      assertThat(report.status()).isEqualTo(ValidationStatus.PROBLEMS_FIXED);
      verify(extractor, never()).extractPage(any(), eq(1), any());
    }

    @Test
    @DisplayName("Should validate every problem page even without query filtering")
    void shouldValidateAllProblemPages() {
      markProblem("bad a", ProblemType.GARBLED_TEXT);
      markProblem("bad b", ProblemType.LOW_CONTENT_DENSITY);
      when(extractor.extractPage(any(), anyInt(), any())).thenReturn("fixed");

      CrossValidationReport report =
          service.crossValidatePages(
              List.of(
                  new PageContent(0, "bad a"),
                  new PageContent(1, "clean page 1,000"),
                  new PageContent(2, "bad b")),
              DOCUMENT,
              false);

      assertThat(report.validatedPages()).isEqualTo(2);
      assertThat(report.problemPages()).containsExactly(0, 2);
      assertThat(report.replacedPages()).containsExactly(0, 2);
    }

    @Test
    @DisplayName("Should keep results in page order")
    void shouldOrderResultsByPage() {
      markProblem("p2", ProblemType.GARBLED_TEXT);
      markProblem("p0", ProblemType.GARBLED_TEXT);
      markProblem("p1", ProblemType.GARBLED_TEXT);
      when(extractor.extractPage(any(), anyInt(), any())).thenReturn("fixed");

      CrossValidationReport report =
          service.crossValidatePages(
              List.of(
                  new PageContent(2, "p2"), new PageContent(0, "p0"), new PageContent(1, "p1")),
              DOCUMENT,
              false);

      assertThat(report.results())
          .extracting(ValidationResult::pageNumber)
          .containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("Should record problem and validation counters")
    void shouldRecordCounters() {
      markProblem("broken", ProblemType.EMPTY_TABLES);
      when(extractor.extractPage(any(), eq(0), any())).thenReturn("repaired");

      service.crossValidatePages(List.of(new PageContent(0, "broken")), DOCUMENT, false);

      assertThat(meterRegistry.counter("validation.pages.detected_problems").count())
          .isEqualTo(1.0);
      assertThat(meterRegistry.counter("validation.pages.validated").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("validation.pages.errors").count()).isEqualTo(0.0);
    }
  }

  @Nested
  @DisplayName("Sampling")
  class Sampling {

    @BeforeEach
    void enableSampling() {
      validationConfig.getCrossValidation().setSkipSampleIfClean(false);
      validationConfig.getCrossValidation().setSampleRate(2);
    }

    @Test
    @DisplayName("Should sample every Nth clean page starting at the run offset")
    void shouldSampleOnCadence() {
      List<PageContent> pages = cleanPages(5);
      when(extractor.extractPage(any(), anyInt(), any()))
          .thenAnswer(inv -> pages.get(inv.getArgument(1, Integer.class)).text());

      CrossValidationReport report = service.crossValidatePages(pages, DOCUMENT, true);

      assertThat(report.results()).extracting(ValidationResult::pageNumber).containsExactly(1, 3);
      assertThat(report.results()).allMatch(ValidationResult::passed);
      assertThat(report.replacedPages()).isEmpty();
      assertThat(report.status()).isEqualTo(ValidationStatus.PASSED);
      verify(extractor, times(2)).extractPage(any(), anyInt(), any());
    }

    @Test
    @DisplayName("Should not sample clean pages when query filtering is inactive")
    void shouldNotSampleWithoutQueryFiltering() {
      CrossValidationReport report = service.crossValidatePages(cleanPages(5), DOCUMENT, false);

      assertThat(report.validatedPages()).isZero();
      verify(extractor, never()).extractPage(any(), anyInt(), any());
    }

    @Test
    @DisplayName("Should not sample clean pages when skip-if-clean is set")
    void shouldNotSampleWhenSkipIfClean() {
      validationConfig.getCrossValidation().setSkipSampleIfClean(true);

      CrossValidationReport report = service.crossValidatePages(cleanPages(5), DOCUMENT, true);

      assertThat(report.validatedPages()).isZero();
      verify(extractor, never()).extractPage(any(), anyInt(), any());
    }

    @Test
    @DisplayName("Should replace a sampled page that falls below the threshold")
    void shouldReplaceSampledPageBelowThreshold() {
      List<PageContent> pages =
          List.of(new PageContent(0, "Total 100 200"), new PageContent(1, "Total 100 200"));
      when(extractor.extractPage(any(), eq(1), any())).thenReturn("Total 999 888");

      CrossValidationReport report = service.crossValidatePages(pages, DOCUMENT, true);

      ValidationResult result = report.results().get(0);
      assertThat(result.pageNumber()).isEqualTo(1);
      assertThat(result.passed()).isFalse();
      assertThat(result.hadProblem()).isFalse();
      assertThat(result.similarityScore()).isLessThan(0.95);
      assertThat(result.replacementText()).isEqualTo("Total 999 888");
      assertThat(report.failedValidations()).containsExactly(1);
      assertThat(report.status()).isEqualTo(ValidationStatus.WARNINGS);
    }

    @Test
    @DisplayName("Should pick pages by floor modulo of index minus offset")
    void shouldComputeSamplingPredicate() {
      assertThat(service.shouldSamplePage(5, false, 0, 5)).isFalse();
      assertThat(service.shouldSamplePage(5, true, 0, 5)).isTrue();
      assertThat(service.shouldSamplePage(3, true, 3, 5)).isTrue();
      assertThat(service.shouldSamplePage(2, true, 3, 5)).isFalse();
      assertThat(service.shouldSamplePage(1, true, 3, 2)).isTrue();
    }
  }

  @Nested
  @DisplayName("Failure handling")
  class FailureHandling {

    @Test
    @DisplayName("Should isolate a failing page and continue with the others")
    void shouldIsolatePageFailure() {
      markProblem("bad a", ProblemType.GARBLED_TEXT);
      markProblem("bad b", ProblemType.GARBLED_TEXT);
      when(extractor.extractPage(any(), eq(1), any())).thenReturn("fixed");
      when(extractor.extractPage(any(), eq(0), any()))
          .thenThrow(new SecondaryExtractionException(0, "provider unavailable"));

      CrossValidationReport report =
          service.crossValidatePages(
              List.of(new PageContent(0, "bad a"), new PageContent(1, "bad b")), DOCUMENT, false);

      ValidationResult failed = report.results().get(0);
      assertThat(failed.passed()).isFalse();
      assertThat(failed.replacementText()).isNull();
      assertThat(failed.error())
          .contains("Secondary extraction failed for page 0")
          .contains("provider unavailable");
      assertThat(report.results().get(1).replacementText()).isEqualTo("fixed");
      assertThat(report.failedValidations()).contains(0);
      assertThat(report.replacedPages()).containsExactly(1);
      assertThat(meterRegistry.counter("validation.pages.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record a timeout as a page error")
    void shouldRecordTimeout() {
      validationConfig.getCrossValidation().setPageTimeout(Duration.ofMillis(100));
      ExecutorService slowPool = Executors.newSingleThreadExecutor();
      try {
        CrossValidationService timed = createService(extractor, slowPool);
        markProblem("bad", ProblemType.GARBLED_TEXT);
        when(extractor.extractPage(any(), eq(0), any()))
            .thenAnswer(
                inv -> {
                  try {
                    Thread.sleep(2_000);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SecondaryExtractionException(0, "interrupted", e);
                  }
                  return "too late";
                });

        CrossValidationReport report =
            timed.crossValidatePages(List.of(new PageContent(0, "bad")), DOCUMENT, false);

        ValidationResult result = report.results().get(0);
        assertThat(result.hasError()).isTrue();
        assertThat(result.replacementText()).isNull();
        assertThat(result.passed()).isFalse();
      } finally {
        slowPool.shutdownNow();
      }
    }

    @Test
    @DisplayName("Should start the page timeout when the extraction starts, not when it is queued")
    void shouldNotCountQueueWaitTowardsTimeout() {
      validationConfig.getCrossValidation().setPageTimeout(Duration.ofMillis(500));
      ExecutorService singleWorker = Executors.newSingleThreadExecutor();
      try {
        CrossValidationService timed = createService(extractor, singleWorker);
        List<PageContent> pages =
            IntStream.range(0, 6).mapToObj(i -> new PageContent(i, "bad " + i)).toList();
        pages.forEach(page -> markProblem(page.text(), ProblemType.GARBLED_TEXT));
        when(extractor.extractPage(any(), anyInt(), any()))
            .thenAnswer(
                inv -> {
                  Thread.sleep(200);
                  return "fixed " + inv.getArgument(1);
                });

        CrossValidationReport report = timed.crossValidatePages(pages, DOCUMENT, false);

        assertThat(report.results()).hasSize(6).noneMatch(ValidationResult::hasError);
        assertThat(report.replacedPages()).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(meterRegistry.counter("validation.pages.errors").count()).isZero();
      } finally {
        singleWorker.shutdownNow();
      }
    }

    @Test
    @DisplayName("Should interrupt a timed-out extraction so the worker serves the next page")
    void shouldInterruptTimedOutExtraction() {
      validationConfig.getCrossValidation().setPageTimeout(Duration.ofMillis(200));
      ExecutorService singleWorker = Executors.newSingleThreadExecutor();
      AtomicBoolean interrupted = new AtomicBoolean();
      try {
        CrossValidationService timed = createService(extractor, singleWorker);
        markProblem("stuck", ProblemType.GARBLED_TEXT);
        markProblem("bad", ProblemType.GARBLED_TEXT);
        when(extractor.extractPage(any(), eq(0), any()))
            .thenAnswer(
                inv -> {
                  try {
                    Thread.sleep(5_000);
                  } catch (InterruptedException e) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                    throw new SecondaryExtractionException(0, "interrupted", e);
                  }
                  return "too late";
                });
        when(extractor.extractPage(any(), eq(1), any())).thenReturn("fixed");

        long start = System.nanoTime();
        CrossValidationReport report =
            timed.crossValidatePages(
                List.of(new PageContent(0, "stuck"), new PageContent(1, "bad")), DOCUMENT, false);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(interrupted).isTrue();
        assertThat(elapsed).isLessThan(Duration.ofSeconds(4));
        assertThat(report.results().get(0).hasError()).isTrue();
        assertThat(report.results().get(1).hasError()).isFalse();
        assertThat(report.replacedPages()).containsExactly(1);
      } finally {
        singleWorker.shutdownNow();
      }
    }

    @Test
    @DisplayName("Should treat a page as clean when its problem detection fails")
    void shouldIsolateDetectionFailure() {
      when(problemDetector.hasAnyProblem(eq("unparseable"), any()))
          .thenThrow(new StackOverflowError());
      markProblem("bad", ProblemType.EMPTY_TABLES);
      when(extractor.extractPage(any(), eq(1), any())).thenReturn("fixed");

      CrossValidationReport report =
          service.crossValidatePages(
              List.of(new PageContent(0, "unparseable"), new PageContent(1, "bad")),
              DOCUMENT,
              false);

      assertThat(report.problemPages()).containsExactly(1);
      assertThat(report.replacedPages()).containsExactly(1);
      assertThat(meterRegistry.counter("validation.pages.detection_errors").count())
          .isEqualTo(1.0);
      verify(extractor, never()).extractPage(any(), eq(0), any());
    }

    @Test
    @DisplayName("Should skip validation when no secondary extractor is configured")
    void shouldSkipWithoutExtractor() {
      CrossValidationService unavailable = createService(null, Runnable::run);

      CrossValidationReport report =
          unavailable.crossValidatePages(cleanPages(3), DOCUMENT, true);

      assertThat(unavailable.isAvailable()).isFalse();
      assertThat(report.validatorAvailable()).isFalse();
      assertThat(report.totalPages()).isEqualTo(3);
      assertThat(report.validatedPages()).isZero();
      assertThat(report.summary().enabled()).isFalse();
    }

    @Test
    @DisplayName("Should skip validation when disabled in configuration")
    void shouldSkipWhenDisabled() {
      validationConfig.getCrossValidation().setEnabled(false);

      CrossValidationReport report = service.crossValidatePages(cleanPages(2), DOCUMENT, true);

      assertThat(report.validatorAvailable()).isFalse();
      verify(extractor, never()).extractPage(any(), anyInt(), any());
    }

    @Test
    @DisplayName("Should handle an empty page list")
    void shouldHandleEmptyDocument() {
      CrossValidationReport report = service.crossValidatePages(List.of(), DOCUMENT, true);

      assertThat(report.totalPages()).isZero();
      assertThat(report.results()).isEmpty();
      assertThat(report.status()).isEqualTo(ValidationStatus.PASSED);
    }
  }

  @Nested
  @DisplayName("Image prompts")
  class ImagePrompts {

    @Test
    @DisplayName("Should use the finance image prompts for the finance workflow")
    void shouldUseFinancePrompts() {
      markProblem("![chart](c.png)", ProblemType.MARKDOWN_IMAGES);
      when(extractor.extractPage(any(), eq(0), any())).thenReturn("described chart");

      service.crossValidatePages(
          List.of(new PageContent(0, "![chart](c.png)")), DOCUMENT, false, "01_Fin_Reports");

      ArgumentCaptor<PromptOverride> prompt = ArgumentCaptor.forClass(PromptOverride.class);
      verify(extractor).extractPage(any(), eq(0), prompt.capture());
      ValidationConfig.Prompts prompts = validationConfig.getPrompts();
      assertThat(prompt.getValue().systemPrompt()).isEqualTo(prompts.getFinanceImageSystemPrompt());
      assertThat(prompt.getValue().renderUserPrompt(0)).contains("originally page 0");
    }

    @Test
    @DisplayName("Should use the generic image prompts for other workflows")
    void shouldUseGenericPrompts() {
      markProblem("![chart](c.png)", ProblemType.MARKDOWN_IMAGES);
      when(extractor.extractPage(any(), eq(0), any())).thenReturn("described chart");

      service.crossValidatePages(
          List.of(new PageContent(0, "![chart](c.png)")), DOCUMENT, false, "02_Legal");

      ArgumentCaptor<PromptOverride> prompt = ArgumentCaptor.forClass(PromptOverride.class);
      verify(extractor).extractPage(any(), eq(0), prompt.capture());
      assertThat(prompt.getValue().systemPrompt())
          .isEqualTo(validationConfig.getPrompts().getImageSystemPrompt());
    }

    @Test
    @DisplayName("Should pass no prompt override for pages without images")
    void shouldPassNoPromptWithoutImages() {
      markProblem("broken", ProblemType.EMPTY_TABLES);
      when(extractor.extractPage(any(), eq(0), any())).thenReturn("fixed");

      service.crossValidatePages(
          List.of(new PageContent(0, "broken")), DOCUMENT, false, "01_Fin_Reports");

      verify(extractor).extractPage(any(), eq(0), isNull());
    }
  }
}
