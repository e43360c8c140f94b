package com.aina.backend.llm.json;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param text the JSON document as text; the input itself when it already parsed
 * @param json parsed JSON value, never {@code null}; repaired and wrapped output is an object or array
 */
public record NormalizedOutput(String text, JsonNode json, RepairStage stage) {

  public boolean repaired() {
    return stage.repaired();
  }
}
