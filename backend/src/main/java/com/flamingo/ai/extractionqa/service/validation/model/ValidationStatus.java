package com.flamingo.ai.extractionqa.service.validation.model;

/** Document-level outcome of a validation run. */
public enum ValidationStatus {
  PASSED("passed"),
  PROBLEMS_FIXED("problems_fixed"),
  WARNINGS("warnings");

  private final String wireValue;

  ValidationStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
