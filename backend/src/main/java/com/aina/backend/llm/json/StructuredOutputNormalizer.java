package com.aina.backend.llm.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns model output requested as JSON into a parsed document. Small models tend to echo the
 * prompt, wrap the answer in markdown fences, stop mid-object or leave trailing commas; each
 * defect has a repair step, and text that cannot be repaired is wrapped as
 * {@code {"response": text}}. Never throws on malformed input.
 */
@Slf4j
public class StructuredOutputNormalizer {

  static final String RESPONSE_FIELD = "response";

  private static final String ASSISTANT_MARKER = "<|im_start|>assistant";
  private static final Pattern CHATML_TOKEN = Pattern.compile("<\\|im_(start|end)\\|>(system|user|assistant)?");
  private static final Pattern CODE_FENCE =
      Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)\\n?```", Pattern.DOTALL);
  private static final int MAX_TRUNCATION_ATTEMPTS = 256;

  private final ObjectMapper objectMapper;

  public StructuredOutputNormalizer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public NormalizedOutput normalize(String raw) {
    String source = raw != null ? raw : "";
    JsonNode direct = parseAny(source.trim());
    if (direct != null) {
      return new NormalizedOutput(source, direct, RepairStage.DIRECT);
    }

    String cleaned = preClean(source);
    JsonNode parsed = tryParse(cleaned);
    if (parsed != null) {
      return new NormalizedOutput(cleaned, parsed, RepairStage.DIRECT);
    }

    int start = firstOpening(cleaned);
    if (start >= 0) {
      int end = lastClosing(cleaned);
      String candidate = end > start ? cleaned.substring(start, end + 1) : cleaned.substring(start);
      parsed = tryParse(candidate);
      if (parsed != null) {
        return new NormalizedOutput(candidate, parsed, RepairStage.DIRECT);
      }
      // a span cut at the last closer may have dropped content of a truncated answer
      String tail = cleaned.substring(start);

      String balanced = balance(tail);
      parsed = tryParse(balanced);
      if (parsed != null) {
        return repaired(balanced, parsed, RepairStage.BALANCED);
      }

      String withoutCommas = removeTrailingCommas(balanced);
      parsed = tryParse(withoutCommas);
      if (parsed != null) {
        return repaired(withoutCommas, parsed, RepairStage.TRAILING_COMMAS);
      }

      NormalizedOutput truncated = truncateProgressively(tail);
      if (truncated != null) {
        return truncated;
      }
    }

    ObjectNode wrapper = objectMapper.createObjectNode();
    wrapper.put(RESPONSE_FIELD, cleaned);
    return repaired(wrapper.toString(), wrapper, RepairStage.WRAPPED);
  }

  private NormalizedOutput repaired(String text, JsonNode json, RepairStage stage) {
    log.debug("Structured output repaired at stage {}", stage);
    return new NormalizedOutput(text, json, stage);
  }

  String preClean(String raw) {
    String text = raw;
    int assistant = text.lastIndexOf(ASSISTANT_MARKER);
    if (assistant >= 0) {
      text = text.substring(assistant + ASSISTANT_MARKER.length());
    }
    text = CHATML_TOKEN.matcher(text).replaceAll("");
    int output = text.lastIndexOf("Output:");
    if (output >= 0) {
      String rest = text.substring(output + "Output:".length());
      if (firstOpening(rest) >= 0) {
        text = rest;
      }
    }
    Matcher fence = CODE_FENCE.matcher(text);
    if (fence.find()) {
      text = fence.group(1);
    }
    return text.trim();
  }

  /**
   * Drops everything after the first closer that does not match an open bracket, closes an
   * unterminated string and appends the missing closers.
   */
  String balance(String text) {
    Deque<Character> open = new ArrayDeque<>();
    boolean inString = false;
    boolean escaped = false;
    int cut = text.length();
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{' || c == '[') {
        open.push(c);
      } else if (c == '}' || c == ']') {
        char expected = c == '}' ? '{' : '[';
        if (open.isEmpty() || open.peek() != expected) {
          cut = i;
          break;
        }
        open.pop();
        if (open.isEmpty()) {
          cut = i + 1;
          break;
        }
      }
    }
    StringBuilder builder = new StringBuilder(text.substring(0, cut));
    if (inString && cut == text.length()) {
      if (escaped) {
        builder.setLength(builder.length() - 1);
      }
      builder.append('"');
    }
    trimDangling(builder);
    while (!open.isEmpty()) {
      builder.append(open.pop() == '{' ? '}' : ']');
    }
    return builder.toString();
  }

  private void trimDangling(StringBuilder builder) {
    int length = builder.length();
    while (length > 0) {
      char c = builder.charAt(length - 1);
      if (Character.isWhitespace(c) || c == ',' || c == ':') {
        length--;
      } else {
        break;
      }
    }
    builder.setLength(length);
  }

  String removeTrailingCommas(String text) {
    StringBuilder builder = new StringBuilder(text.length());
    boolean inString = false;
    boolean escaped = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        builder.append(c);
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == ',') {
        int next = i + 1;
        while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
          next++;
        }
        if (next < text.length() && (text.charAt(next) == '}' || text.charAt(next) == ']')) {
          continue;
        }
      }
      builder.append(c);
    }
    return builder.toString();
  }

  private NormalizedOutput truncateProgressively(String text) {
    int attempts = 0;
    for (int i = text.length() - 1; i > 0 && attempts < MAX_TRUNCATION_ATTEMPTS; i--) {
      char c = text.charAt(i);
      if (c != '}' && c != ']' && c != ',') {
        continue;
      }
      attempts++;
      String prefix = c == ',' ? text.substring(0, i) : text.substring(0, i + 1);
      String candidate = removeTrailingCommas(balance(prefix));
      JsonNode parsed = tryParse(candidate);
      if (parsed != null) {
        return repaired(candidate, parsed, RepairStage.TRUNCATED);
      }
    }
    return null;
  }

  /** Any valid JSON value, scalars and {@code null} included; repaired text must be an object or array. */
  private JsonNode parseAny(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(text);
      return node != null && !node.isMissingNode() ? node : null;
    } catch (JsonProcessingException ex) {
      return null;
    }
  }

  private JsonNode tryParse(String text) {
    JsonNode node = parseAny(text);
    return node != null && node.isContainerNode() ? node : null;
  }

  private static int firstOpening(String text) {
    int brace = text.indexOf('{');
    int bracket = text.indexOf('[');
    if (brace < 0) {
      return bracket;
    }
    if (bracket < 0) {
      return brace;
    }
    return Math.min(brace, bracket);
  }

  private static int lastClosing(String text) {
    return Math.max(text.lastIndexOf('}'), text.lastIndexOf(']'));
  }
}
