package com.flamingo.ai.extractionqa.service.validation;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Named heuristic checks signalling a degraded extraction. The wire name is the value used in
 * configuration and in logs.
 */
public enum ProblemType {
  EMPTY_TABLES("empty_tables"),
  LOW_CONTENT_DENSITY("low_content_density"),
  MISSING_NUMBERS("missing_numbers"),
  INCONSISTENT_COLUMNS("inconsistent_columns"),
  REPEATED_CHARACTERS("repeated_characters"),
  GARBLED_TEXT("garbled_text"),
  HEADER_ONLY_TABLES("header_only_tables"),
  VERY_SHORT_PAGES("very_short_pages"),
  MISSING_KEYWORDS("missing_keywords"),
  MALFORMED_STRUCTURE("malformed_structure"),
  DUPLICATE_CONTENT("duplicate_content"),
  UNKNOWN_CHARACTERS("unknown_characters"),
  REPETITIVE_NUMBERS("repetitive_numbers"),
  MARKDOWN_IMAGES("markdown_images"),
  /** Reported for empty page text; never configured. */
  EMPTY_CONTENT("empty_content");

  private final String wireName;

  ProblemType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** All problems that can be enabled through configuration. */
  public static Set<ProblemType> detectable() {
    return Set.copyOf(EnumSet.complementOf(EnumSet.of(EMPTY_CONTENT)));
  }

  public static Optional<ProblemType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type != EMPTY_CONTENT && type.wireName.equals(normalized))
        .findFirst();
  }

  @Override
  public String toString() {
    return wireName;
  }
}
