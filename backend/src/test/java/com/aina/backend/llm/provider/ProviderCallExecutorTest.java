package com.aina.backend.llm.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

class ProviderCallExecutorTest {

  private ProviderCallExecutor executor;

  @BeforeEach
  void setUp() {
    LlmProvidersProperties properties = new LlmProvidersProperties();
    properties.setDefaultProvider("vertex");
    properties.setCallConcurrency(2);
    LlmProvidersProperties.Provider vertex = new LlmProvidersProperties.Provider();
    vertex.setType(LlmProviderType.VERTEX_ENDPOINT);
    vertex.setTimeout(Duration.ofMillis(200));
    vertex.getRetry().setMaxAttempts(2);
    vertex.getRetry().setInitialDelay(Duration.ofMillis(10));
    vertex.getRetry().setMaxDelay(Duration.ofMillis(20));
    properties.getProviders().put("vertex", vertex);
    executor = new ProviderCallExecutor(properties);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void returnsCompletionOfSuccessfulCall() {
    ProviderCompletion completion =
        executor.execute("vertex", () -> new ProviderCompletion("ok", 3, 1, "stop"));

    assertThat(completion.text()).isEqualTo("ok");
  }

  @Test
  void slowCallTimesOut() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    "vertex",
                    () -> {
                      attempts.incrementAndGet();
                      sleep(2_000);
                      return new ProviderCompletion("late", null, null, null);
                    }))
        .isInstanceOfSatisfying(
            ProviderException.class, ex -> assertThat(ex.reason()).isEqualTo(ProviderFailureReason.TIMEOUT));
    // timeouts are transient, so the call is attempted twice
    assertThat(attempts).hasValue(2);
  }

  @Test
  void transientFailureIsRetriedOnce() {
    AtomicInteger attempts = new AtomicInteger();

    ProviderCompletion completion =
        executor.execute(
            "vertex",
            () -> {
              if (attempts.incrementAndGet() == 1) {
                throw new ProviderException("vertex", ProviderFailureReason.SERVER, 503, "unavailable");
              }
              return new ProviderCompletion("recovered", null, null, null);
            });

    assertThat(completion.text()).isEqualTo("recovered");
    assertThat(attempts).hasValue(2);
  }

  @Test
  void authenticationFailureIsNotRetried() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                executor.execute(
                    "vertex",
                    () -> {
                      attempts.incrementAndGet();
                      throw new ProviderException("vertex", ProviderFailureReason.AUTH, 401, "bad key");
                    }))
        .isInstanceOfSatisfying(
            ProviderException.class, ex -> assertThat(ex.reason()).isEqualTo(ProviderFailureReason.AUTH));
    assertThat(attempts).hasValue(1);
  }

  @Test
  void clientExceptionsAreTranslated() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    "vertex",
                    () -> {
                      throw new ResourceAccessException("Connection refused");
                    }))
        .isInstanceOfSatisfying(
            ProviderException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(ProviderFailureReason.NETWORK);
              assertThat(ex.providerId()).isEqualTo("vertex");
            });
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
