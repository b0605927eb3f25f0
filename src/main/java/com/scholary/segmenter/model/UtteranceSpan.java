package com.scholary.segmenter.model;

import com.scholary.segmenter.timing.TimeRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One speaker's continuous spoken span (a "supervision").
 *
 * <p>{@code text} holds whitespace-separated raw tokens. {@code alignment} holds the word timings
 * sorted by start time; an empty list means the utterance has no alignment data. {@code
 * properties} carries manifest fields this service does not interpret (channel, language, ...).
 * A missing speaker is recorded as {@link #UNKNOWN_SPEAKER}.
 */
public record UtteranceSpan(
    String id,
    String speakerId,
    double start,
    double duration,
    String text,
    List<Word> alignment,
    Map<String, Object> properties) {

  public static final String UNKNOWN_SPEAKER = "unknown";

  public UtteranceSpan {
    speakerId = speakerId == null || speakerId.isBlank() ? UNKNOWN_SPEAKER : speakerId;
    text = text == null ? "" : text;
    alignment = alignment == null ? List.of() : List.copyOf(alignment);
    properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public UtteranceSpan(
      String id,
      String speakerId,
      double start,
      double duration,
      String text,
      List<Word> alignment) {
    this(id, speakerId, start, duration, text, alignment, Map.of());
  }

  public double end() {
    return start + duration;
  }

  public boolean hasAlignment() {
    return !alignment.isEmpty();
  }

  public TimeRange range() {
    return new TimeRange(start, end());
  }

  /** Raw text tokens, split on whitespace. */
  public List<String> tokens() {
    List<String> tokens = new ArrayList<>();
    for (String token : text.trim().split("\\s+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  public UtteranceSpan withId(String newId) {
    return new UtteranceSpan(newId, speakerId, start, duration, text, alignment, properties);
  }

  /** Replace timing, text and alignment, keeping identity and pass-through properties. */
  public UtteranceSpan withContent(
      double newStart, double newDuration, String newText, List<Word> newAlignment) {
    return new UtteranceSpan(
        id, speakerId, newStart, newDuration, newText, newAlignment, properties);
  }

  public UtteranceSpan withAlignment(List<Word> newAlignment) {
    return new UtteranceSpan(id, speakerId, start, duration, text, newAlignment, properties);
  }

  /** Shift the utterance and its word timings by the given number of seconds. */
  public UtteranceSpan withOffset(double offset) {
    List<Word> shifted = alignment.stream().map(w -> w.withOffset(offset)).toList();
    return new UtteranceSpan(id, speakerId, start + offset, duration, text, shifted, properties);
  }
}
