package com.flamingo.ai.extractionqa.service.validation;

import com.flamingo.ai.extractionqa.service.validation.model.PromptOverride;

/**
 * Second-opinion extractor used to repair or spot-check pages.
 *
 * <p>Implementations wrap a provider client, own its retry/backoff and rate limiting, and must be
 * safe to call concurrently. Calls are blocking; the caller runs them on its own pool. Failures
 * surface as exceptions, typically {@link
 * com.flamingo.ai.extractionqa.exception.SecondaryExtractionException}.
 */
public interface SecondaryPageExtractor {

  /**
   * Extracts one page as markdown.
   *
   * @param documentBytes raw bytes of the whole document
   * @param pageNumber zero-based page index
   * @param prompt custom prompt pair, or null for the provider default
   * @return extracted page text
   */
  String extractPage(byte[] documentBytes, int pageNumber, PromptOverride prompt);

  default String extractPage(byte[] documentBytes, int pageNumber) {
    return extractPage(documentBytes, pageNumber, null);
  }
}
