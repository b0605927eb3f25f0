package com.scholary.segmenter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A bounded time window of one recording plus the utterances active within it (a "cut").
 *
 * <p>Utterance times are relative to the segment start. {@code metadata} is the free-form custom
 * map of the manifest; split outputs carry their continuation flags under {@link
 * #CONTINUATION_KEY}. {@code properties} holds manifest fields carried through unchanged, such as
 * the recording reference.
 */
public record RecordingSegment(
    String id,
    String recordingId,
    double startInRecording,
    double duration,
    List<UtteranceSpan> utterances,
    Map<String, Object> metadata,
    Map<String, Object> properties) {

  public static final String CONTINUATION_KEY = "per_speaker_continuation";

  public RecordingSegment {
    utterances = utterances == null ? List.of() : List.copyOf(utterances);
    metadata = copyOf(metadata);
    properties = copyOf(properties);
  }

  public RecordingSegment(
      String id,
      double startInRecording,
      double duration,
      List<UtteranceSpan> utterances,
      Map<String, Object> metadata) {
    this(id, id, startInRecording, duration, utterances, metadata, Map.of());
  }

  /**
   * Per-speaker continuation flags, or an empty map when this segment was not produced by the
   * splitter.
   */
  public Map<String, Boolean> continuationFlags() {
    Object flags = metadata.get(CONTINUATION_KEY);
    if (!(flags instanceof Map<?, ?>)) {
      return Map.of();
    }
    Map<String, Boolean> typed = new LinkedHashMap<>();
    ((Map<?, ?>) flags)
        .forEach(
            (speaker, flag) -> typed.put(String.valueOf(speaker), Boolean.TRUE.equals(flag)));
    return Collections.unmodifiableMap(typed);
  }

  public RecordingSegment withUtterances(List<UtteranceSpan> newUtterances) {
    return new RecordingSegment(
        id, recordingId, startInRecording, duration, newUtterances, metadata, properties);
  }

  /** Derive a segment covering a different window of the same recording. */
  public RecordingSegment derive(
      String newId,
      double newStartInRecording,
      double newDuration,
      List<UtteranceSpan> newUtterances,
      Map<String, Object> newMetadata) {
    return new RecordingSegment(
        newId,
        recordingId,
        newStartInRecording,
        newDuration,
        newUtterances,
        newMetadata,
        properties);
  }

  private static Map<String, Object> copyOf(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
