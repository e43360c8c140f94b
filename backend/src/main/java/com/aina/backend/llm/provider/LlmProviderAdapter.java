package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.model.InvocationRequest;

/** Uniform contract over the supported model backends. */
public interface LlmProviderAdapter {

  String providerId();

  LlmProviderType type();

  ProviderPrompt format(InvocationRequest request, ProviderCallOptions options);

  /**
   * Performs one blocking call.
   *
   * @throws com.aina.backend.llm.exception.ProviderException when the backend fails
   */
  ProviderCompletion complete(ProviderPrompt prompt, ProviderCallOptions options);
}
