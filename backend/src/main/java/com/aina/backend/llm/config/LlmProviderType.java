package com.aina.backend.llm.config;

public enum LlmProviderType {
  /** Chat-completions API speaking the OpenAI wire format (Gemini's compatibility endpoint). */
  OPENAI_COMPATIBLE,
  /** Custom Vertex AI endpoint serving a ChatML model (Salamandra, ALIA). */
  VERTEX_ENDPOINT,
  /** Local Ollama daemon. */
  OLLAMA
}
