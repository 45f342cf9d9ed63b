package com.flamingo.ai.extractionqa.exception;

/** Exception thrown when table input is structurally unusable (not for merge ambiguity). */
public class TableAssemblyException extends RuntimeException {

  private final String userMessage;

  public TableAssemblyException(String message) {
    super(message);
    this.userMessage = "Failed to assemble tables";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
