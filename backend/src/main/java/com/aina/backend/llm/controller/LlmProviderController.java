package com.aina.backend.llm.controller;

import com.aina.backend.llm.api.ProvidersResponse;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.service.LlmInvocationService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/llm/providers")
public class LlmProviderController {

  private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);

  private final LlmInvocationService invocationService;

  public LlmProviderController(LlmInvocationService invocationService) {
    this.invocationService = invocationService;
  }

  @GetMapping
  public ProvidersResponse listProviders() {
    List<ProvidersResponse.Provider> providers =
        invocationService.providers().stream().map(this::toProviderResponse).toList();
    return new ProvidersResponse(invocationService.defaultProvider(), providers);
  }

  private ProvidersResponse.Provider toProviderResponse(ModelDescriptor descriptor) {
    return new ProvidersResponse.Provider(
        descriptor.providerId(),
        descriptor.displayName(),
        descriptor.type().name().toLowerCase(),
        descriptor.modelVersion(),
        descriptor.contextLimitTokens(),
        descriptor.defaultMaxOutputTokens(),
        perMillion(descriptor.costPerInputToken()),
        perMillion(descriptor.costPerOutputToken()),
        descriptor.currency(),
        descriptor.fallbackChain(),
        descriptor.mapReduceCapable());
  }

  private static BigDecimal perMillion(BigDecimal perToken) {
    return perToken.multiply(ONE_MILLION).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros();
  }
}
