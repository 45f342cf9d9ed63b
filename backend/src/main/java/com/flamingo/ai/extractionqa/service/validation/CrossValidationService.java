package com.flamingo.ai.extractionqa.service.validation;

import com.flamingo.ai.extractionqa.config.ValidationConfig;
import com.flamingo.ai.extractionqa.exception.SecondaryExtractionException;
import com.flamingo.ai.extractionqa.service.validation.model.CrossValidationReport;
import com.flamingo.ai.extractionqa.service.validation.model.PageContent;
import com.flamingo.ai.extractionqa.service.validation.model.ProblemDetection;
import com.flamingo.ai.extractionqa.service.validation.model.PromptOverride;
import com.flamingo.ai.extractionqa.service.validation.model.ValidationResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntUnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Cross-validates the pages of one document against a secondary extractor.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Run problem detection on every page in parallel (CPU pool)
 *   <li>Queue every problem page for repair; queue clean pages for sampling only when query
 *       filtering is active, sampling of clean pages is allowed, and the page falls on the
 *       every-Nth cadence starting at a per-run random offset
 *   <li>Re-extract queued pages in parallel (I/O pool, per-page timeout)
 *   <li>Problem pages take the re-extraction unconditionally; sampled pages take it only when the
 *       similarity is below the threshold
 *   <li>Assemble a report in page order
 * </ol>
 *
 * <p>A failure on one page is recorded on that page's result and never aborts the run.
 */
@Service
@Slf4j
public class CrossValidationService {

  private final ProblemDetector problemDetector;
  private final SimilarityCalculator similarityCalculator;
  private final ValidationConfig validationConfig;
  private final SecondaryPageExtractor secondaryExtractor;
  private final Executor detectionExecutor;
  private final Executor extractionExecutor;
  private final ScheduledExecutorService timeoutScheduler;
  private final MeterRegistry meterRegistry;
  private final IntUnaryOperator offsetSource;
  private final TimeLimiter timeLimiter;

  @Autowired
  public CrossValidationService(
      ProblemDetector problemDetector,
      SimilarityCalculator similarityCalculator,
      ValidationConfig validationConfig,
      ObjectProvider<SecondaryPageExtractor> secondaryExtractor,
      @Qualifier("problemDetectionExecutor") Executor detectionExecutor,
      @Qualifier("secondaryExtractionExecutor") Executor extractionExecutor,
      @Qualifier("validationTimeoutScheduler") ThreadPoolTaskScheduler timeoutScheduler,
      MeterRegistry meterRegistry) {
    this(
        problemDetector,
        similarityCalculator,
        validationConfig,
        secondaryExtractor.getIfAvailable(),
        detectionExecutor,
        extractionExecutor,
        timeoutScheduler.getScheduledExecutor(),
        meterRegistry,
        bound -> ThreadLocalRandom.current().nextInt(bound));
  }

  CrossValidationService(
      ProblemDetector problemDetector,
      SimilarityCalculator similarityCalculator,
      ValidationConfig validationConfig,
      SecondaryPageExtractor secondaryExtractor,
      Executor detectionExecutor,
      Executor extractionExecutor,
      ScheduledExecutorService timeoutScheduler,
      MeterRegistry meterRegistry,
      IntUnaryOperator offsetSource) {
    this.problemDetector = problemDetector;
    this.similarityCalculator = similarityCalculator;
    this.validationConfig = validationConfig;
    this.secondaryExtractor = secondaryExtractor;
    this.detectionExecutor = detectionExecutor;
    this.extractionExecutor = extractionExecutor;
    this.timeoutScheduler = timeoutScheduler;
    this.meterRegistry = meterRegistry;
    this.offsetSource = offsetSource;
    this.timeLimiter =
        TimeLimiter.of(
            "secondary-extraction",
            TimeLimiterConfig.custom()
                .timeoutDuration(validationConfig.getCrossValidation().getPageTimeout())
                .cancelRunningFuture(true)
                .build());

    ValidationConfig.CrossValidation cv = validationConfig.getCrossValidation();
    log.info(
        "Validation configuration: provider={}, available={}, method={}, threshold={}, "
            + "sampleRate=1/{}, skipSampleIfClean={}, problems={}",
        cv.getProvider(),
        secondaryExtractor != null,
        cv.getSimilarityMethod(),
        cv.getSimilarityThreshold(),
        cv.getSampleRate(),
        cv.isSkipSampleIfClean(),
        cv.resolveEnabledProblems());
  }

  /** Whether this instance can validate at all. */
  public boolean isAvailable() {
    return validationConfig.getCrossValidation().isEnabled() && secondaryExtractor != null;
  }

  public CrossValidationReport crossValidatePages(
      List<PageContent> pages, byte[] documentBytes, boolean queryFilteringActive) {
    return crossValidatePages(pages, documentBytes, queryFilteringActive, null);
  }

  /**
   * Cross-validates all pages of one document.
   *
   * @param pages primary extraction output
   * @param documentBytes raw document handed to the secondary extractor
   * @param queryFilteringActive whether query filtering is active (enables sampling)
   * @param workflowName workflow name, selects finance prompts for image pages; may be null
   * @return report with per-page results in page order
   */
  @Timed(value = "validation.cross_validate", description = "Time to cross-validate a document")
  public CrossValidationReport crossValidatePages(
      List<PageContent> pages,
      byte[] documentBytes,
      boolean queryFilteringActive,
      String workflowName) {
    if (!isAvailable()) {
      log.warn("Validator not available - skipping validation of {} pages", pages.size());
      return CrossValidationReport.skipped(pages.size());
    }

    long start = System.nanoTime();
    ValidationConfig.CrossValidation cv = validationConfig.getCrossValidation();

    // one snapshot per run
    Set<ProblemType> enabled = cv.resolveEnabledProblems();
    int sampleRate = cv.getSampleRate();
    boolean skipSampleIfClean = cv.isSkipSampleIfClean();
    double threshold = cv.getSimilarityThreshold();
    int offset = offsetSource.applyAsInt(sampleRate);

    log.info("Starting cross-validation for {} pages", pages.size());
    if (queryFilteringActive) {
      log.info("Query filtering active - sample validation every {}th page", sampleRate);
    }
    log.debug("Sample validation offset: {}", offset);

    List<ProblemDetection> detections = detectProblems(pages, enabled);

    SortedSet<Integer> problemPages = new TreeSet<>();
    List<CompletableFuture<ValidationResult>> tasks = new ArrayList<>();

    for (int i = 0; i < pages.size(); i++) {
      PageContent page = pages.get(i);
      ProblemDetection detection = detections.get(i);

      if (detection.hasProblem()) {
        problemPages.add(page.index());
        log.info(
            "[Page {}] Queued for validation (problems detected: {})",
            page.index(),
            detection.problems());
      } else if (!skipSampleIfClean
          && shouldSamplePage(page.index(), queryFilteringActive, offset, sampleRate)) {
        log.info("[Page {}] Queued for validation (sample validation)", page.index());
      } else {
        continue;
      }
      PromptOverride prompt = promptFor(detection, workflowName);
      tasks.add(validatePage(page, detection, documentBytes, prompt, threshold));
    }

    log.info("Validating {} pages in parallel...", tasks.size());
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();

    List<ValidationResult> results =
        tasks.stream()
            .map(CompletableFuture::join)
            .sorted(Comparator.comparingInt(ValidationResult::pageNumber))
            .toList();

    SortedSet<Integer> failed = new TreeSet<>();
    results.stream().filter(r -> !r.passed()).forEach(r -> failed.add(r.pageNumber()));

    Duration totalTime = Duration.ofNanos(System.nanoTime() - start);
    double cost = cv.estimateCost(results.size());

    meterRegistry.counter("validation.pages.detected_problems").increment(problemPages.size());
    meterRegistry.counter("validation.pages.validated").increment(results.size());
    meterRegistry.counter("validation.pages.failed").increment(failed.size());

    log.info(
        "Cross-validation complete: total={}, validated={}, problemPages={}, failed={}, "
            + "time={}ms, estimatedCost=${}",
        pages.size(),
        results.size(),
        problemPages.size(),
        failed.size(),
        totalTime.toMillis(),
        String.format("%.4f", cost));

    return new CrossValidationReport(
        pages.size(), results.size(), problemPages, failed, results, totalTime, cost, true);
  }

  /**
   * Whether a clean page falls on the sampling cadence: every {@code sampleRate}th page starting
   * at {@code offset}. Never true without query filtering.
   */
  public boolean shouldSamplePage(
      int pageIndex, boolean queryFilteringActive, int offset, int sampleRate) {
    if (!queryFilteringActive) {
      return false;
    }
    return Math.floorMod(pageIndex - offset, sampleRate) == 0;
  }

  private List<ProblemDetection> detectProblems(List<PageContent> pages, Set<ProblemType> enabled) {
    log.info("Running problem detection in parallel for {} pages...", pages.size());
    List<CompletableFuture<ProblemDetection>> futures =
        pages.stream()
            .map(
                page ->
                    CompletableFuture.supplyAsync(
                            () -> problemDetector.hasAnyProblem(page.text(), enabled),
                            detectionExecutor)
                        .exceptionally(
                            throwable -> {
                              Throwable cause = unwrap(throwable);
                              log.warn(
                                  "[Page {}] Problem detection failed, treating page as clean: {}",
                                  page.index(),
                                  describe(cause));
                              meterRegistry
                                  .counter("validation.pages.detection_errors")
                                  .increment();
                              return ProblemDetection.clean();
                            }))
            .toList();
    List<ProblemDetection> detections = futures.stream().map(CompletableFuture::join).toList();

    List<Integer> flagged = new ArrayList<>();
    for (int i = 0; i < pages.size(); i++) {
      if (detections.get(i).hasProblem()) {
        flagged.add(pages.get(i).index());
      }
    }
    if (flagged.isEmpty()) {
      log.info("Problem detection: All {} pages passed quality checks", pages.size());
    } else {
      log.info(
          "Problem detection: {}/{} pages have quality issues (pages: {})",
          flagged.size(),
          pages.size(),
          flagged);
    }
    return detections;
  }

  private CompletableFuture<ValidationResult> validatePage(
      PageContent page,
      ProblemDetection detection,
      byte[] documentBytes,
      PromptOverride prompt,
      double threshold) {
    long start = System.nanoTime();
    int pageNumber = page.index();

    return CompletableFuture.supplyAsync(
            () -> extractWithinTimeout(documentBytes, pageNumber, prompt), extractionExecutor)
        .thenApply(
            alternative -> {
              Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
              if (detection.hasProblem()) {
                log.info(
                    "[Page {}] Using secondary extraction directly (problems detected)",
                    pageNumber);
                return ValidationResult.repaired(
                    pageNumber, detection.problems(), alternative, elapsed);
              }
              double score = similarityCalculator.similarity(page.text(), alternative);
              boolean passed = score >= threshold;
              log.info(
                  "[Page {}] Similarity: {} - {} (threshold: {})",
                  pageNumber,
                  String.format("%.3f", score),
                  passed ? "PASSED" : "FAILED",
                  String.format("%.3f", threshold));
              return ValidationResult.sampled(pageNumber, score, passed, alternative, elapsed);
            })
        .exceptionally(
            throwable -> {
              Throwable cause = unwrap(throwable);
              int reportedPage =
                  cause instanceof SecondaryExtractionException extraction
                      ? extraction.getPageNumber()
                      : pageNumber;
              log.error(
                  "[Page {}] Validation failed with error: {}", reportedPage, describe(cause));
              meterRegistry.counter("validation.pages.errors").increment();
              return ValidationResult.failed(
                  pageNumber,
                  detection.problems(),
                  Duration.ofNanos(System.nanoTime() - start),
                  describe(cause));
            });
  }

  /**
   * Runs one secondary extraction on the calling worker thread. The time limit starts when the call
   * starts, not when the page was queued. On timeout the worker is interrupted so an
   * interrupt-aware extractor releases its pool slot.
   */
  private String extractWithinTimeout(byte[] documentBytes, int pageNumber, PromptOverride prompt) {
    Thread worker = Thread.currentThread();
    Object lock = new Object();
    AtomicBoolean finished = new AtomicBoolean();
    CompletableFuture<String> call = new CompletableFuture<>();
    CompletableFuture<String> limited =
        timeLimiter.executeCompletionStage(timeoutScheduler, () -> call).toCompletableFuture();
    limited.whenComplete(
        (text, error) -> {
          if (!(unwrap(error) instanceof TimeoutException)) {
            return;
          }
          synchronized (lock) {
            if (!finished.get()) {
              log.warn("[Page {}] Secondary extraction timed out, interrupting call", pageNumber);
              worker.interrupt();
            }
          }
        });

    try {
      call.complete(secondaryExtractor.extractPage(documentBytes, pageNumber, prompt));
    } catch (RuntimeException e) {
      call.completeExceptionally(e);
    } finally {
      synchronized (lock) {
        finished.set(true);
      }
      // an interrupt aimed at this call must not leak into the next task on this worker
      Thread.interrupted();
    }
    return limited.join();
  }

  private PromptOverride promptFor(ProblemDetection detection, String workflowName) {
    if (!detection.problems().contains(ProblemType.MARKDOWN_IMAGES)) {
      return null;
    }
    ValidationConfig.Prompts prompts = validationConfig.getPrompts();
    if (prompts.getFinanceWorkflow().equals(workflowName)) {
      return new PromptOverride(
          prompts.getFinanceImageSystemPrompt(), prompts.getFinanceImageUserPromptTemplate());
    }
    return new PromptOverride(prompts.getImageSystemPrompt(), prompts.getImageUserPromptTemplate());
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(Throwable cause) {
    String message =
        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    if (cause instanceof SecondaryExtractionException extraction) {
      return extraction.getUserMessage() + ": " + message;
    }
    return message;
  }
}
