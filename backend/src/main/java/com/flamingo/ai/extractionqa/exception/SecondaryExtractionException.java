package com.flamingo.ai.extractionqa.exception;

/** Exception thrown when the secondary extractor cannot produce text for a page. */
public class SecondaryExtractionException extends RuntimeException {

  private final int pageNumber;
  private final String userMessage;

  public SecondaryExtractionException(int pageNumber, String message) {
    super(message);
    this.pageNumber = pageNumber;
    this.userMessage = "Secondary extraction failed for page " + pageNumber;
  }

  public SecondaryExtractionException(int pageNumber, String message, Throwable cause) {
    super(message, cause);
    this.pageNumber = pageNumber;
    this.userMessage = "Secondary extraction failed for page " + pageNumber;
  }

  public int getPageNumber() {
    return pageNumber;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
