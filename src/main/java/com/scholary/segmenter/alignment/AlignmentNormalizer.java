package com.scholary.segmenter.alignment;

import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.model.Word;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Cleans word alignments before splitting.
 *
 * <p>Entries whose symbol is nothing but punctuation are removed (the written text is left as
 * is) and the remaining entries are ordered by start, then end.
 */
@Component
public class AlignmentNormalizer {

  private static final Comparator<Word> BY_TIME =
      Comparator.comparingDouble(Word::start).thenComparingDouble(Word::end);

  public RecordingSegment normalize(RecordingSegment segment) {
    List<UtteranceSpan> utterances = segment.utterances().stream().map(this::normalize).toList();
    return segment.withUtterances(utterances);
  }

  public UtteranceSpan normalize(UtteranceSpan utterance) {
    if (!utterance.hasAlignment()) {
      return utterance;
    }
    List<Word> cleaned =
        utterance.alignment().stream()
            .filter(w -> !WordNormalizer.normalize(w.symbol()).isBlank())
            .sorted(BY_TIME)
            .toList();
    return utterance.withAlignment(cleaned);
  }
}
