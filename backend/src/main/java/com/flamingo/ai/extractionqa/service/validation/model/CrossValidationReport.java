package com.flamingo.ai.extractionqa.service.validation.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Aggregate report of one document validation run.
 *
 * @param totalPages pages in the document
 * @param validatedPages pages sent to the secondary extractor
 * @param problemPages indices of pages where problem detection fired
 * @param failedValidations indices of validated pages that did not pass
 * @param results per-page results in page order
 * @param totalTime wall time of the run
 * @param estimatedCost estimated secondary extraction cost in USD
 * @param validatorAvailable false when validation was skipped because no secondary extractor was
 *     usable; distinct from a run in which pages failed
 */
public record CrossValidationReport(
    int totalPages,
    int validatedPages,
    SortedSet<Integer> problemPages,
    SortedSet<Integer> failedValidations,
    List<ValidationResult> results,
    Duration totalTime,
    double estimatedCost,
    boolean validatorAvailable) {

  public CrossValidationReport {
    problemPages = new TreeSet<>(problemPages);
    failedValidations = new TreeSet<>(failedValidations);
    results = List.copyOf(results);
  }

  /** Report for a run in which no secondary extractor was available. */
  public static CrossValidationReport skipped(int totalPages) {
    return new CrossValidationReport(
        totalPages, 0, new TreeSet<>(), new TreeSet<>(), List.of(), Duration.ZERO, 0.0, false);
  }

  public ValidationStatus status() {
    if (!problemPages.isEmpty()) {
      return ValidationStatus.PROBLEMS_FIXED;
    }
    if (!failedValidations.isEmpty()) {
      return ValidationStatus.WARNINGS;
    }
    return ValidationStatus.PASSED;
  }

  public ValidationSummary summary() {
    return new ValidationSummary(validatorAvailable, status());
  }

  /**
   * Returns a copy of {@code pages} with every available replacement applied. The input list is
   * not modified.
   */
  public List<PageContent> applyTo(List<PageContent> pages) {
    Map<Integer, String> replacements =
        results.stream()
            .filter(r -> r.replacementText() != null)
            .collect(
                Collectors.toMap(
                    ValidationResult::pageNumber, ValidationResult::replacementText, (a, b) -> b));

    List<PageContent> patched = new ArrayList<>(pages.size());
    for (PageContent page : pages) {
      String replacement = replacements.get(page.index());
      patched.add(replacement != null ? page.withText(replacement) : page);
    }
    return patched;
  }

  public Set<Integer> replacedPages() {
    return results.stream()
        .filter(r -> r.replacementText() != null)
        .map(ValidationResult::pageNumber)
        .collect(Collectors.toCollection(TreeSet::new));
  }
}
