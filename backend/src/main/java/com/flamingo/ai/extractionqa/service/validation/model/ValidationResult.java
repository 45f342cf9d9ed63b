package com.flamingo.ai.extractionqa.service.validation.model;

import com.flamingo.ai.extractionqa.service.validation.ProblemType;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Result of validating one page against the secondary extractor.
 *
 * <p>A page with a detected problem is replaced unconditionally and carries a score of 0. A
 * sampled clean page carries a replacement only when it failed the similarity threshold. A page
 * whose validation errored carries neither.
 *
 * @param pageNumber zero-based page index
 * @param similarityScore similarity between the two extractions (0 for problem pages)
 * @param passed whether the original extraction can be kept
 * @param hadProblem whether problem detection flagged the page
 * @param detectedProblems the checks that fired
 * @param replacementText text to use instead of the original, or null
 * @param processingTime wall time spent on this page
 * @param error failure description when validation could not complete, or null
 */
public record ValidationResult(
    int pageNumber,
    double similarityScore,
    boolean passed,
    boolean hadProblem,
    Set<ProblemType> detectedProblems,
    String replacementText,
    Duration processingTime,
    String error) {

  public ValidationResult {
    detectedProblems = Set.copyOf(detectedProblems);
    if (hadProblem && error == null && (replacementText == null || similarityScore != 0.0)) {
      throw new IllegalArgumentException(
          "Problem page " + pageNumber + " must carry a replacement and a zero score");
    }
  }

  /** Problem page: the secondary extraction replaces the original without comparison. */
  public static ValidationResult repaired(
      int pageNumber, Set<ProblemType> problems, String alternative, Duration elapsed) {
    return new ValidationResult(
        pageNumber, 0.0, false, true, problems, alternative, elapsed, null);
  }

  /** Clean page spot-check: replacement only when the score is below the threshold. */
  public static ValidationResult sampled(
      int pageNumber, double score, boolean passed, String alternative, Duration elapsed) {
    return new ValidationResult(
        pageNumber, score, passed, false, Set.of(), passed ? null : alternative, elapsed, null);
  }

  public static ValidationResult failed(
      int pageNumber, Set<ProblemType> problems, Duration elapsed, String error) {
    return new ValidationResult(
        pageNumber, 0.0, false, !problems.isEmpty(), problems, null, elapsed, error);
  }

  public Optional<String> replacement() {
    return Optional.ofNullable(replacementText);
  }

  public boolean hasError() {
    return error != null;
  }
}
