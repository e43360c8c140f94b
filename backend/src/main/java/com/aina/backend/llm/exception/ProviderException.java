package com.aina.backend.llm.exception;

/**
 * A provider call failed: network, authentication, rate limiting, timeout or a server error.
 */
public class ProviderException extends LlmInvocationException {

  private final String providerId;
  private final ProviderFailureReason reason;
  private final Integer status;

  public ProviderException(
      String providerId, ProviderFailureReason reason, Integer status, String message) {
    this(providerId, reason, status, message, null);
  }

  public ProviderException(
      String providerId,
      ProviderFailureReason reason,
      Integer status,
      String message,
      Throwable cause) {
    super("Provider '" + providerId + "' failed (" + reason.name().toLowerCase() + "): " + message, cause);
    this.providerId = providerId;
    this.reason = reason;
    this.status = status;
  }

  public static ProviderException timeout(String providerId, long timeoutMs) {
    return new ProviderException(
        providerId, ProviderFailureReason.TIMEOUT, null, "timeout after " + timeoutMs + " ms");
  }

  public String providerId() {
    return providerId;
  }

  public ProviderFailureReason reason() {
    return reason;
  }

  public Integer status() {
    return status;
  }

  public boolean isRetryable() {
    return reason.isRetryable();
  }
}
