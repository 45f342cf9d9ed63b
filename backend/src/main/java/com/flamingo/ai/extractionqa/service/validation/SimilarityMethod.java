package com.flamingo.ai.extractionqa.service.validation;

/** Full similarity algorithms selectable through configuration. */
public enum SimilarityMethod {
  /** Cosine similarity over the multiset of normalized numbers; ignores all other text. */
  NUMBER_FREQUENCY,
  /** Character edit distance over the alphanumeric-only form of both texts. */
  LEVENSHTEIN
}
