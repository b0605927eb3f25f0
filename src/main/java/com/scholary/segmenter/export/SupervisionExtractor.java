package com.scholary.segmenter.export;

import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Flattens segments into their utterances, placed on the recording timeline.
 *
 * <p>The channel comes from the utterance's {@code channel} field, or from the segment's when the
 * utterance has none.
 */
@Component
public class SupervisionExtractor {

  static final String CHANNEL_FIELD = "channel";

  public List<RecordingSupervision> extract(List<RecordingSegment> segments) {
    List<RecordingSupervision> supervisions = new ArrayList<>();
    for (RecordingSegment segment : segments) {
      double offset = segment.startInRecording();
      for (UtteranceSpan utterance : segment.utterances()) {
        Object channel = utterance.properties().get(CHANNEL_FIELD);
        if (channel == null) {
          channel = segment.properties().get(CHANNEL_FIELD);
        }
        Map<String, Object> properties = new LinkedHashMap<>(utterance.properties());
        properties.remove(CHANNEL_FIELD);
        properties.remove("recording_id");
        supervisions.add(
            new RecordingSupervision(
                utterance.id(),
                segment.recordingId(),
                channels(channel),
                utterance.speakerId(),
                utterance.start() + offset,
                utterance.duration(),
                utterance.text(),
                utterance.alignment().stream().map(w -> w.withOffset(offset)).toList(),
                properties));
      }
    }
    return supervisions;
  }

  static List<Integer> channels(Object channel) {
    if (channel instanceof Number number) {
      return List.of(number.intValue());
    }
    if (channel instanceof Collection<?> values) {
      List<Integer> channels = new ArrayList<>();
      for (Object value : values) {
        if (value instanceof Number number) {
          channels.add(number.intValue());
        }
      }
      return channels;
    }
    return List.of();
  }
}
