package com.flamingo.ai.extractionqa.service.validation.model;

/**
 * Caller-facing summary of a validation run.
 *
 * @param enabled whether a secondary extractor took part in the run
 * @param status aggregate status
 */
public record ValidationSummary(boolean enabled, ValidationStatus status) {}
