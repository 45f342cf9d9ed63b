package com.flamingo.ai.extractionqa.service.extraction;

import com.flamingo.ai.extractionqa.service.extraction.model.ValidatedExtraction;
import com.flamingo.ai.extractionqa.service.validation.CrossValidationService;
import com.flamingo.ai.extractionqa.service.validation.model.CrossValidationReport;
import com.flamingo.ai.extractionqa.service.validation.model.PageContent;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers holding a finished primary extraction: validates the pages, patches in
 * replacements, and recombines the document.
 *
 * <p>A failure of the validation phase as a whole never fails the document. The original pages
 * are returned and the summary is left null.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionQualityService {

  static final String SECTION_SEPARATOR = "\n\n---\n\n";
  static final String EMPTY_DOCUMENT = "# No content extracted\n\n";

  private final CrossValidationService crossValidationService;

  public ValidatedExtraction validateAndRepair(
      List<PageContent> pages, byte[] documentBytes, boolean queryFilteringActive) {
    return validateAndRepair(pages, documentBytes, queryFilteringActive, null);
  }

  /**
   * Validates and repairs one document.
   *
   * @param pages primary extraction output in page order
   * @param documentBytes raw document for the secondary extractor
   * @param queryFilteringActive whether query filtering is active
   * @param workflowName workflow name, may be null
   * @return patched pages, combined markdown and the validation outcome
   */
  public ValidatedExtraction validateAndRepair(
      List<PageContent> pages,
      byte[] documentBytes,
      boolean queryFilteringActive,
      String workflowName) {
    CrossValidationReport report;
    try {
      report =
          crossValidationService.crossValidatePages(
              pages, documentBytes, queryFilteringActive, workflowName);
    } catch (RuntimeException e) {
      log.error("Cross-validation failed, keeping original extraction: {}", e.getMessage(), e);
      return new ValidatedExtraction(pages, combineMarkdown(texts(pages)), null, null);
    }

    List<PageContent> patched = report.applyTo(pages);
    Set<Integer> replaced = report.replacedPages();
    if (!replaced.isEmpty()) {
      log.info("Replaced {} page(s) with secondary extraction: {}", replaced.size(), replaced);
    }
    log.info(
        "Validation status: {} ({} of {} pages validated)",
        report.status().wireValue(),
        report.validatedPages(),
        report.totalPages());

    return new ValidatedExtraction(
        patched, combineMarkdown(texts(patched)), report.summary(), report);
  }

  /**
   * Joins page sections with a horizontal rule. Blank sections are dropped when there is more than
   * one section.
   *
   * @param sections page markdown in order
   * @return the combined document, or a placeholder heading when there are no sections
   */
  public static String combineMarkdown(List<String> sections) {
    if (sections.isEmpty()) {
      return EMPTY_DOCUMENT;
    }
    if (sections.size() == 1) {
      return sections.get(0);
    }
    return sections.stream()
        .map(String::strip)
        .filter(section -> !section.isEmpty())
        .collect(Collectors.joining(SECTION_SEPARATOR));
  }

  private static List<String> texts(List<PageContent> pages) {
    return pages.stream().map(PageContent::text).toList();
  }
}
