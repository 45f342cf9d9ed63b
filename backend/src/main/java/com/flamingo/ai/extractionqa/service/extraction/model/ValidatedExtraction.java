package com.flamingo.ai.extractionqa.service.extraction.model;

import com.flamingo.ai.extractionqa.service.validation.model.CrossValidationReport;
import com.flamingo.ai.extractionqa.service.validation.model.PageContent;
import com.flamingo.ai.extractionqa.service.validation.model.ValidationSummary;
import java.util.List;

/**
 * Extraction output after the validation phase.
 *
 * @param pages pages with replacements applied
 * @param combinedMarkdown pages joined into one document
 * @param summary validation summary, or null when the validation phase itself failed
 * @param report full report, or null when the validation phase itself failed
 */
public record ValidatedExtraction(
    List<PageContent> pages,
    String combinedMarkdown,
    ValidationSummary summary,
    CrossValidationReport report) {

  public ValidatedExtraction {
    pages = List.copyOf(pages);
  }

  public boolean validated() {
    return summary != null;
  }
}
