package com.flamingo.ai.newsrag.exception;

/** Exception thrown when caller input is rejected at intake. Never retried. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
