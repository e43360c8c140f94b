package com.aina.backend.llm.exception;

/**
 * Base type for failures surfaced by the invocation engine.
 */
public class LlmInvocationException extends RuntimeException {

  public LlmInvocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
