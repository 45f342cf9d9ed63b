package com.flamingo.ai.extractionqa.service.validation.model;

/**
 * Custom prompt pair for the secondary extractor, used for pages that embed images.
 *
 * @param systemPrompt system prompt
 * @param userPromptTemplate user prompt containing a {@code {page_number}} placeholder
 */
public record PromptOverride(String systemPrompt, String userPromptTemplate) {

  public String renderUserPrompt(int pageNumber) {
    return userPromptTemplate == null
        ? null
        : userPromptTemplate.replace("{page_number}", String.valueOf(pageNumber));
  }
}
