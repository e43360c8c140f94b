package com.aina.backend.llm.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Helpers producing {@code [start, end)} spans that tile a region of a text. */
final class TextSpans {

  static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n\\s*");
  static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+\\s+|\\n+");

  private TextSpans() {}

  record Span(int start, int end) {
    int length() {
      return end - start;
    }
  }

  /** Splits {@code [from, to)} after every match of {@code separator}, keeping separators. */
  static List<Span> splitAfter(String text, int from, int to, Pattern separator) {
    List<Span> spans = new ArrayList<>();
    Matcher matcher = separator.matcher(text);
    matcher.region(from, to);
    int cursor = from;
    while (matcher.find()) {
      if (matcher.end() > cursor) {
        spans.add(new Span(cursor, matcher.end()));
        cursor = matcher.end();
      }
    }
    if (cursor < to) {
      spans.add(new Span(cursor, to));
    }
    return spans;
  }

  static List<Span> windows(int from, int to, int windowChars) {
    int size = Math.max(1, windowChars);
    List<Span> spans = new ArrayList<>();
    for (int start = from; start < to; start += size) {
      spans.add(new Span(start, Math.min(to, start + size)));
    }
    return spans;
  }
}
