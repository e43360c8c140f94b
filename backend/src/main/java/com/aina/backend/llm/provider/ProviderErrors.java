package com.aina.backend.llm.provider;

import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import java.net.SocketTimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/** Maps client-library failures onto {@link ProviderException}. */
final class ProviderErrors {

  private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(?:HTTP\\s*)?(\\d{3})\\b");

  private ProviderErrors() {}

  static ProviderException translate(String providerId, RuntimeException exception) {
    if (exception instanceof ProviderException providerException) {
      return providerException;
    }
    if (exception instanceof RestClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      return new ProviderException(
          providerId,
          ProviderFailureReason.fromStatus(status),
          status,
          "HTTP " + status + " " + abbreviate(responseException.getResponseBodyAsString()),
          exception);
    }
    if (exception instanceof ResourceAccessException) {
      ProviderFailureReason reason =
          hasCause(exception, SocketTimeoutException.class)
              ? ProviderFailureReason.TIMEOUT
              : ProviderFailureReason.NETWORK;
      return new ProviderException(providerId, reason, null, exception.getMessage(), exception);
    }
    if (exception instanceof TransientAiException || exception instanceof NonTransientAiException) {
      Integer status = leadingStatus(exception.getMessage());
      ProviderFailureReason reason;
      if (status != null) {
        reason = ProviderFailureReason.fromStatus(status);
      } else if (exception instanceof TransientAiException) {
        reason = ProviderFailureReason.SERVER;
      } else {
        reason = ProviderFailureReason.BAD_REQUEST;
      }
      return new ProviderException(providerId, reason, status, exception.getMessage(), exception);
    }
    if (hasCause(exception, ResourceAccessException.class)) {
      return translate(providerId, findCause(exception, ResourceAccessException.class));
    }
    return new ProviderException(
        providerId, ProviderFailureReason.UNKNOWN, null, String.valueOf(exception.getMessage()), exception);
  }

  static Integer leadingStatus(String message) {
    if (message == null) {
      return null;
    }
    Matcher matcher = LEADING_STATUS.matcher(message);
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }

  private static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
    return findCause(throwable, type) != null;
  }

  private static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
    Throwable current = throwable;
    while (current != null) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 300 ? body.substring(0, 300) + "..." : body;
  }
}
