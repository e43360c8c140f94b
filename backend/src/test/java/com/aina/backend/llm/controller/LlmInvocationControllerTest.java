package com.aina.backend.llm.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.aina.backend.llm.exception.ContextWindowExceededException;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import com.aina.backend.llm.model.CostEstimate;
import com.aina.backend.llm.model.InvocationMetadata;
import com.aina.backend.llm.model.InvocationModule;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;
import com.aina.backend.llm.service.LlmInvocationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(LlmInvocationController.class)
@AutoConfigureMockMvc(addFilters = false)
class LlmInvocationControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockBean private LlmInvocationService invocationService;

  @Test
  void invokeMapsRequestAndReturnsParsedJson() throws Exception {
    when(invocationService.invoke(any()))
        .thenReturn(
            new InvocationResult(
                "req-1",
                "{\"punts\": [\"a\", \"b\"]}",
                objectMapper.readTree("{\"punts\": [\"a\", \"b\"]}"),
                "gemini-2.5-flash",
                "gemini-2.5-flash",
                120,
                30,
                850,
                new CostEstimate(
                    new BigDecimal("0.000018"), new BigDecimal("0.000018"), new BigDecimal("0.000036"), "USD"),
                InvocationMetadata.direct()
                    .withFallback("salamandra-7b-local", "context_window_exceeded: 5000 > 3072")));

    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "prompt": "Resumeix l'expedient",
                      "systemPrompt": "Ets un tècnic.",
                      "module": "elaboracio",
                      "userId": "anna",
                      "sessionId": "s1",
                      "provider": "salamandra-7b-local",
                      "options": {"maxTokens": 512, "temperature": 0.2}
                    }
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.requestId").value("req-1"))
        .andExpect(jsonPath("$.provider").value("gemini-2.5-flash"))
        .andExpect(jsonPath("$.data.punts[1]").value("b"))
        .andExpect(jsonPath("$.usage.totalTokens").value(150))
        .andExpect(jsonPath("$.cost.currency").value("USD"))
        .andExpect(jsonPath("$.metadata.fallbackUsed").value(true))
        .andExpect(jsonPath("$.metadata.originalProvider").value("salamandra-7b-local"));

    ArgumentCaptor<InvocationRequest> captor = ArgumentCaptor.forClass(InvocationRequest.class);
    verify(invocationService).invoke(captor.capture());
    InvocationRequest request = captor.getValue();
    assertThat(request.jsonResponse()).isTrue();
    assertThat(request.module()).isEqualTo(InvocationModule.ELABORACIO);
    assertThat(request.maxOutputTokens()).isEqualTo(512);
    assertThat(request.temperature()).isEqualTo(0.2);
    assertThat(request.provider()).isEqualTo("salamandra-7b-local");
    assertThat(request.skipAutoStrategies()).isFalse();
  }

  @Test
  void textAnswerIsReturnedAsData() throws Exception {
    when(invocationService.invoke(any()))
        .thenReturn(
            new InvocationResult(
                "req-2",
                "Bon dia",
                null,
                "salamandra-7b-local",
                "salamandra-7b-instruct",
                10,
                3,
                100,
                CostEstimate.zero("USD"),
                InvocationMetadata.direct()));

    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"Hola\", \"jsonResponse\": false}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data").value("Bon dia"))
        .andExpect(jsonPath("$.metadata.strategy").value("DIRECT"));
  }

  @Test
  void blankPromptIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"  \"}"))
        .andExpect(status().isBadRequest());

    verify(invocationService, never()).invoke(any());
  }

  @Test
  void unknownModuleIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"Hola\", \"module\": \"altres\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void contextWindowOverflowMapsToPayloadTooLarge() throws Exception {
    when(invocationService.invoke(any()))
        .thenThrow(new ContextWindowExceededException(5000, 3072, "salamandra-7b-local"));

    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"Hola\"}"))
        .andExpect(status().isPayloadTooLarge())
        .andExpect(jsonPath("$.promptTokens").value(5000))
        .andExpect(jsonPath("$.maxTokens").value(3072))
        .andExpect(jsonPath("$.provider").value("salamandra-7b-local"));
  }

  @Test
  void providerFailuresMapToGatewayStatuses() throws Exception {
    when(invocationService.invoke(any()))
        .thenThrow(new ProviderException("gemini-2.5-flash", ProviderFailureReason.TIMEOUT, null, "slow"))
        .thenThrow(new ProviderException("gemini-2.5-flash", ProviderFailureReason.AUTH, 401, "denied"));

    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"Hola\"}"))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.reason").value("timeout"));

    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"Hola\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.upstreamStatus").value(401));
  }

  @Test
  void unknownProviderIsABadRequest() throws Exception {
    when(invocationService.invoke(any())).thenThrow(new IllegalArgumentException("Unknown provider: gpt"));

    mockMvc
        .perform(
            post("/api/llm/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"Hola\", \"provider\": \"gpt\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Unknown provider: gpt"));
  }
}
