package com.aina.backend.llm.provider;

/**
 * Prompt in the shape a backend expects: separate system and user messages for chat APIs, or a
 * single pre-rendered string for text-completion endpoints.
 */
public record ProviderPrompt(String systemPrompt, String userPrompt, String rendered) {

  public static ProviderPrompt messages(String systemPrompt, String userPrompt) {
    return new ProviderPrompt(systemPrompt, userPrompt, null);
  }

  public static ProviderPrompt rendered(String rendered) {
    return new ProviderPrompt(null, null, rendered);
  }

  public boolean isRendered() {
    return rendered != null;
  }
}
