package com.flamingo.ai.newsrag.exception;

/** Exception thrown when the vector index cannot be reached or rejects a request. */
public class VectorIndexException extends RuntimeException {

  private final String userMessage;

  public VectorIndexException(String message) {
    super(message);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public VectorIndexException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
