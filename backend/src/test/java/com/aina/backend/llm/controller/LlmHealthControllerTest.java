package com.aina.backend.llm.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.health.LlmHealthReport;
import com.aina.backend.llm.health.LlmHealthService;
import com.aina.backend.llm.health.ProviderHealth;
import com.aina.backend.llm.health.ProviderHealthStatus;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(LlmHealthController.class)
@AutoConfigureMockMvc(addFilters = false)
class LlmHealthControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private LlmHealthService healthService;

  @Test
  void healthReportsEveryProviderWithLowercaseStatuses() throws Exception {
    Map<String, ProviderHealth> providers = new LinkedHashMap<>();
    providers.put(
        "gemini-2.5-flash",
        new ProviderHealth(
            "gemini-2.5-flash",
            LlmProviderType.OPENAI_COMPATIBLE,
            "gemini-2.5-flash",
            ProviderHealthStatus.HEALTHY,
            "gemini-2.5-flash responded",
            320));
    providers.put(
        "salamandra-7b",
        new ProviderHealth(
            "salamandra-7b",
            LlmProviderType.VERTEX_ENDPOINT,
            "salamandra-7b-instruct",
            ProviderHealthStatus.ERROR,
            "Provider 'salamandra-7b' failed (auth): 401",
            45));
    when(healthService.check())
        .thenReturn(
            new LlmHealthReport(
                Instant.parse("2025-03-01T10:00:00Z"), ProviderHealthStatus.ERROR, providers, 330));

    mockMvc
        .perform(get("/api/llm/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("error"))
        .andExpect(jsonPath("$.responseTimeMs").value(330))
        .andExpect(jsonPath("$.providers['gemini-2.5-flash'].status").value("healthy"))
        .andExpect(jsonPath("$.providers['gemini-2.5-flash'].latencyMs").value(320))
        .andExpect(jsonPath("$.providers['salamandra-7b'].status").value("error"))
        .andExpect(jsonPath("$.providers['salamandra-7b'].type").value("VERTEX_ENDPOINT"));
  }
}
