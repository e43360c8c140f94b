package com.aina.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.service.LlmInvocationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class AinaBackendApplicationTests {

  @Autowired private LlmInvocationService invocationService;

  @Test
  void contextLoadsConfiguredProviders() {
    assertThat(invocationService.defaultProvider()).isEqualTo("gemini-2.5-flash");
    assertThat(invocationService.providers())
        .extracting(ModelDescriptor::providerId)
        .containsExactlyInAnyOrder(
            "gemini-2.5-flash",
            "gemini-2.5-pro",
            "salamandra-7b-vertex",
            "salamandra-7b-local",
            "alia-40b-vertex");
  }
}
