package com.aina.backend.llm.json;

/** Step of the normalizer that produced a parseable document. */
public enum RepairStage {
  DIRECT,
  BALANCED,
  TRAILING_COMMAS,
  TRUNCATED,
  WRAPPED;

  public boolean repaired() {
    return this != DIRECT;
  }
}
