package com.aina.backend.llm.controller;

import com.aina.backend.llm.api.InvokeOptions;
import com.aina.backend.llm.api.InvokeRequest;
import com.aina.backend.llm.api.InvokeResponse;
import com.aina.backend.llm.api.UsageResponse;
import com.aina.backend.llm.model.InvocationModule;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;
import com.aina.backend.llm.service.LlmInvocationService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/llm")
@Validated
@Tag(name = "LLM", description = "Provider-agnostic model invocation.")
public class LlmInvocationController {

  private final LlmInvocationService invocationService;

  public LlmInvocationController(LlmInvocationService invocationService) {
    this.invocationService = invocationService;
  }

  @PostMapping(
      value = "/invoke",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Invoke a model.",
      description =
          "Validates the prompt against the provider's context window; oversized prompts are sent to a larger fallback provider or map-reduced when enabled.")
  @ApiResponse(responseCode = "200", description = "Model answer with usage and cost.")
  @ApiResponse(
      responseCode = "413",
      description = "Prompt does not fit any reachable context window.",
      content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE))
  @ApiResponse(
      responseCode = "502",
      description = "Upstream provider returned an error.",
      content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE))
  public InvokeResponse invoke(@Valid @RequestBody InvokeRequest request) {
    InvocationResult result = invocationService.invoke(toInvocationRequest(request));
    JsonNode data = result.json() != null ? result.json() : TextNode.valueOf(result.text());
    return new InvokeResponse(
        result.requestId(),
        result.provider(),
        result.modelVersion(),
        result.text(),
        data,
        new UsageResponse(result.tokensIn(), result.tokensOut(), result.totalTokens()),
        result.latencyMs(),
        result.costEstimate(),
        result.metadata());
  }

  private InvocationRequest toInvocationRequest(InvokeRequest request) {
    InvokeOptions options = request.options();
    return InvocationRequest.builder()
        .prompt(request.prompt())
        .systemPrompt(request.systemPrompt())
        .jsonResponse(request.jsonResponseOrDefault())
        .module(InvocationModule.fromCode(request.module()))
        .userId(request.userId())
        .sessionId(request.sessionId())
        .provider(request.provider())
        .maxOutputTokens(options != null ? options.maxTokens() : null)
        .temperature(options != null ? options.temperature() : null)
        .topP(options != null ? options.topP() : null)
        .build();
  }
}
