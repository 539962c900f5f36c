package com.flamingo.ai.newsrag.exception;

/**
 * Exception thrown by the embedding client. The {@link Kind} decides whether a call is retried.
 */
public class EmbeddingException extends RuntimeException {

  /** Failure categories reported by the embedding provider. */
  public enum Kind {
    /** 401/403: credentials rejected. Never retried. */
    AUTHENTICATION,

    /** 422 or locally rejected input. Retried; the final attempt carries diagnostics. */
    VALIDATION,

    /** 429: retried with backoff. */
    RATE_LIMIT,

    /** Anything else: 5xx, timeouts, connectivity, malformed responses. */
    PROVIDER
  }

  private final Kind kind;
  private final Integer statusCode;
  private final String responseBody;

  public EmbeddingException(Kind kind, String message) {
    this(kind, message, null, null, null);
  }

  public EmbeddingException(Kind kind, String message, Throwable cause) {
    this(kind, message, null, null, cause);
  }

  public EmbeddingException(
      Kind kind, String message, Integer statusCode, String responseBody, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public Kind getKind() {
    return kind;
  }

  /** HTTP status returned by the provider, or null when no response was received. */
  public Integer getStatusCode() {
    return statusCode;
  }

  /** Raw provider response body, kept for validation diagnostics. */
  public String getResponseBody() {
    return responseBody;
  }

  public boolean isRetryable() {
    return kind != Kind.AUTHENTICATION;
  }
}
