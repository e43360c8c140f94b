package com.aina.backend.llm.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import com.aina.backend.llm.model.InvocationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class VertexEndpointProviderAdapterTest {

  private static final String PREDICT_URL =
      "https://europe-west4-aiplatform.googleapis.com/v1/projects/aina/locations/europe-west4/endpoints/42:predict";

  private LlmProvidersProperties.Provider config;
  private RestClient.Builder builder;
  private MockRestServiceServer server;
  private VertexEndpointProviderAdapter adapter;

  @BeforeEach
  void setUp() {
    config = new LlmProvidersProperties.Provider();
    config.setType(LlmProviderType.VERTEX_ENDPOINT);
    config.setBaseUrl(
        "https://europe-west4-aiplatform.googleapis.com/v1/projects/aina/locations/europe-west4/endpoints/42/");
    config.setCompletionsPath(":predict");
    config.setApiKey("token-123");
    config.setContextLimitTokens(8192);

    builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    adapter = new VertexEndpointProviderAdapter("salamandra-7b-vertex", config, builder, new ObjectMapper());
  }

  @Test
  void sendsChatMlPromptAndStripsEcho() {
    InvocationRequest request = InvocationRequest.builder().prompt("Resumeix l'ajut").build();
    ProviderCallOptions options = ProviderCallOptions.resolve(256, 0.3, null, false, Duration.ofSeconds(5));
    ProviderPrompt prompt = adapter.format(request, options);

    server
        .expect(requestTo(PREDICT_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer token-123"))
        .andExpect(jsonPath("$.instances[0].prompt").value(prompt.rendered()))
        .andExpect(jsonPath("$.instances[0].max_tokens").value(256))
        .andExpect(jsonPath("$.instances[0].temperature").value(0.3))
        .andExpect(jsonPath("$.instances[0].top_p").value(0.95))
        .andRespond(
            withSuccess(
                "{\"predictions\": [\"<|im_start|>assistant\\nL'ajut cobreix el 50%.<|im_end|>\"]}",
                MediaType.APPLICATION_JSON));

    ProviderCompletion completion = adapter.complete(prompt, options);

    server.verify();
    assertThat(prompt.isRendered()).isTrue();
    assertThat(completion.text()).isEqualTo("L'ajut cobreix el 50%.");
    assertThat(completion.tokensIn()).isNull();
    assertThat(completion.tokensOut()).isNull();
  }

  @Test
  void emptyPredictionsYieldEmptyText() {
    ProviderCallOptions options = ProviderCallOptions.resolve(128, null, null, true, Duration.ofSeconds(5));
    server
        .expect(requestTo(PREDICT_URL))
        .andRespond(withSuccess("{\"predictions\": []}", MediaType.APPLICATION_JSON));

    ProviderCompletion completion = adapter.complete(ProviderPrompt.rendered("prompt"), options);

    assertThat(completion.text()).isEmpty();
  }

  @Test
  void httpErrorsAreClassified() {
    ProviderCallOptions options = ProviderCallOptions.resolve(128, null, null, false, Duration.ofSeconds(5));
    server.expect(requestTo(PREDICT_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> adapter.complete(ProviderPrompt.rendered("prompt"), options))
        .isInstanceOfSatisfying(
            ProviderException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(ProviderFailureReason.RATE_LIMIT);
              assertThat(ex.status()).isEqualTo(429);
              assertThat(ex.providerId()).isEqualTo("salamandra-7b-vertex");
            });
  }

  @Test
  void unauthorizedIsNotRetryable() {
    ProviderCallOptions options = ProviderCallOptions.resolve(128, null, null, false, Duration.ofSeconds(5));
    server.expect(requestTo(PREDICT_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> adapter.complete(ProviderPrompt.rendered("prompt"), options))
        .isInstanceOfSatisfying(
            ProviderException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(ProviderFailureReason.AUTH);
              assertThat(ex.isRetryable()).isFalse();
            });
  }

  @Test
  void googleCredentialsAuthorizeEachCall() {
    config.setApiKey(null);
    AtomicInteger loads = new AtomicInteger();
    GoogleCredentials credentials =
        GoogleCredentials.create(
            new AccessToken("adc-token", Date.from(Instant.now().plus(Duration.ofHours(1)))));
    VertexEndpointProviderAdapter adcAdapter =
        new VertexEndpointProviderAdapter(
            "alia-40b-vertex",
            config,
            builder,
            new ObjectMapper(),
            () -> {
              loads.incrementAndGet();
              return credentials;
            });
    ProviderCallOptions options = ProviderCallOptions.resolve(128, null, null, false, Duration.ofSeconds(5));
    server
        .expect(requestTo(PREDICT_URL))
        .andExpect(header("Authorization", "Bearer adc-token"))
        .andRespond(withSuccess("{\"predictions\": [\"primer\"]}", MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(PREDICT_URL))
        .andExpect(header("Authorization", "Bearer adc-token"))
        .andRespond(withSuccess("{\"predictions\": [\"segon\"]}", MediaType.APPLICATION_JSON));

    assertThat(adcAdapter.complete(ProviderPrompt.rendered("prompt"), options).text()).isEqualTo("primer");
    assertThat(adcAdapter.complete(ProviderPrompt.rendered("prompt"), options).text()).isEqualTo("segon");

    server.verify();
    assertThat(loads).hasValue(1);
  }

  @Test
  void missingCredentialsFailAsAuthError() {
    config.setApiKey(null);
    VertexEndpointProviderAdapter adcAdapter =
        new VertexEndpointProviderAdapter(
            "alia-40b-vertex",
            config,
            builder,
            new ObjectMapper(),
            () -> {
              throw new IOException("The Application Default Credentials are not available.");
            });
    ProviderCallOptions options = ProviderCallOptions.resolve(128, null, null, false, Duration.ofSeconds(5));

    assertThatThrownBy(() -> adcAdapter.complete(ProviderPrompt.rendered("prompt"), options))
        .isInstanceOfSatisfying(
            ProviderException.class,
            ex -> {
              assertThat(ex.reason()).isEqualTo(ProviderFailureReason.AUTH);
              assertThat(ex.isRetryable()).isFalse();
              assertThat(ex.getMessage()).contains("Application Default Credentials");
            });
  }
}
