package com.aina.backend.llm.exception;

public enum ProviderFailureReason {
  TIMEOUT(true),
  NETWORK(true),
  RATE_LIMIT(true),
  SERVER(true),
  AUTH(false),
  BAD_REQUEST(false),
  UNKNOWN(false);

  private final boolean retryable;

  ProviderFailureReason(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public static ProviderFailureReason fromStatus(int status) {
    if (status == 401 || status == 403) {
      return AUTH;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return RATE_LIMIT;
    }
    if (status >= 500) {
      return SERVER;
    }
    if (status >= 400) {
      return BAD_REQUEST;
    }
    return UNKNOWN;
  }
}
