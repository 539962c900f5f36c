package com.flamingo.ai.newsrag.exception;

/** Exception thrown when session metadata or history cannot be read or written. */
public class ConversationStoreException extends RuntimeException {

  public ConversationStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
