package com.scholary.segmenter.export;

import com.scholary.segmenter.model.Word;
import java.util.List;
import java.util.Map;

/**
 * An utterance taken out of its segment, with times relative to the recording.
 *
 * @param channels recording channels the utterance was captured on; empty when unknown
 */
public record RecordingSupervision(
    String id,
    String recordingId,
    List<Integer> channels,
    String speakerId,
    double start,
    double duration,
    String text,
    List<Word> alignment,
    Map<String, Object> properties) {

  public RecordingSupervision {
    channels = channels == null ? List.of() : List.copyOf(channels);
    alignment = alignment == null ? List.of() : List.copyOf(alignment);
    properties = properties == null ? Map.of() : properties;
  }

  public double end() {
    return start + duration;
  }
}
