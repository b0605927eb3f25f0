package com.scholary.segmenter.corpus;

import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Prefixes segment, recording and utterance ids with a dataset name, so that manifests from
 * several datasets can be merged without id clashes.
 *
 * <p>The recording reference carried in the segment properties is renamed as well, as is the
 * {@code recording_id} of each utterance.
 */
@Component
public class IdPrefixer {

  static final String RECORDING_FIELD = "recording";
  static final String RECORDING_ID_FIELD = "recording_id";

  public List<RecordingSegment> prefix(List<RecordingSegment> segments, String prefix) {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("Prefix must not be blank");
    }
    return segments.stream().map(segment -> prefix(segment, prefix + "_")).toList();
  }

  private RecordingSegment prefix(RecordingSegment segment, String head) {
    List<UtteranceSpan> utterances =
        segment.utterances().stream()
            .map(
                u ->
                    new UtteranceSpan(
                        head + u.id(),
                        u.speakerId(),
                        u.start(),
                        u.duration(),
                        u.text(),
                        u.alignment(),
                        prefixRecordingId(u.properties(), head)))
            .toList();
    return new RecordingSegment(
        head + segment.id(),
        head + segment.recordingId(),
        segment.startInRecording(),
        segment.duration(),
        utterances,
        segment.metadata(),
        prefixRecording(segment.properties(), head));
  }

  private static Map<String, Object> prefixRecording(Map<String, Object> properties, String head) {
    if (!(properties.get(RECORDING_FIELD) instanceof Map<?, ?> recording)) {
      return properties;
    }
    Map<String, Object> renamed = new LinkedHashMap<>();
    recording.forEach((key, value) -> renamed.put(String.valueOf(key), value));
    if (renamed.get("id") != null) {
      renamed.put("id", head + renamed.get("id"));
    }
    Map<String, Object> copy = new LinkedHashMap<>(properties);
    copy.put(RECORDING_FIELD, renamed);
    return copy;
  }

  private static Map<String, Object> prefixRecordingId(
      Map<String, Object> properties, String head) {
    Object recordingId = properties.get(RECORDING_ID_FIELD);
    if (recordingId == null) {
      return properties;
    }
    Map<String, Object> copy = new LinkedHashMap<>(properties);
    copy.put(RECORDING_ID_FIELD, head + recordingId);
    return copy;
  }
}
