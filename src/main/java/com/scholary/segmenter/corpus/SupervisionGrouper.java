package com.scholary.segmenter.corpus;

import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts a segment at long silences between utterances.
 *
 * <p>Utterances are walked in start order while tracking the latest end seen so far. A new group
 * starts whenever the next utterance begins more than {@code maxPause} seconds after that end.
 * Each group becomes a segment spanning from its first start to its last end, with utterance and
 * word times shifted to the group start.
 */
@Component
public class SupervisionGrouper {

  private static final Logger LOGGER = LoggerFactory.getLogger(SupervisionGrouper.class);

  public List<RecordingSegment> group(RecordingSegment segment, double maxPause) {
    if (segment.utterances().isEmpty()) {
      return List.of();
    }
    List<UtteranceSpan> sorted =
        segment.utterances().stream()
            .sorted(Comparator.comparingDouble(UtteranceSpan::start))
            .toList();

    List<List<UtteranceSpan>> groups = new ArrayList<>();
    List<UtteranceSpan> current = new ArrayList<>();
    double latestEnd = Double.NEGATIVE_INFINITY;
    for (UtteranceSpan utterance : sorted) {
      if (!current.isEmpty() && utterance.start() - latestEnd > maxPause) {
        groups.add(current);
        current = new ArrayList<>();
      }
      current.add(utterance);
      latestEnd = Math.max(latestEnd, utterance.end());
    }
    groups.add(current);

    List<RecordingSegment> result = new ArrayList<>(groups.size());
    for (List<UtteranceSpan> members : groups) {
      result.add(toSegment(segment, members, result.size()));
    }
    LOGGER.debug(
        "Segment {} holds {} supervision groups (max pause {}s)",
        segment.id(),
        result.size(),
        maxPause);
    return result;
  }

  private RecordingSegment toSegment(
      RecordingSegment segment, List<UtteranceSpan> members, int index) {
    double start = members.get(0).start();
    double end = members.stream().mapToDouble(UtteranceSpan::end).max().orElse(start);
    List<UtteranceSpan> shifted = members.stream().map(u -> u.withOffset(-start)).toList();
    return segment.derive(
        segment.id() + "-" + index,
        segment.startInRecording() + start,
        end - start,
        shifted,
        segment.metadata());
  }
}
