package com.flamingo.ai.extractionqa.service.validation.model;

/**
 * One page of primary extraction output.
 *
 * @param index zero-based page index within the document
 * @param text extracted markdown (may be empty)
 */
public record PageContent(int index, String text) {

  public PageContent {
    text = text == null ? "" : text;
  }

  public PageContent withText(String replacement) {
    return new PageContent(index, replacement);
  }
}
