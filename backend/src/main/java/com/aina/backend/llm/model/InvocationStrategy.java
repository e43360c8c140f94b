package com.aina.backend.llm.model;

public enum InvocationStrategy {
  DIRECT,
  FALLBACK,
  MAP_REDUCE,
  ITERATIVE_REFINEMENT
}
