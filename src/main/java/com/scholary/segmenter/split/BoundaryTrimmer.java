package com.scholary.segmenter.split;

import com.scholary.segmenter.alignment.WordAlignmentMatcher;
import com.scholary.segmenter.alignment.WordSelection;
import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.model.Word;
import com.scholary.segmenter.timing.TimeRange;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Cuts an utterance at a word boundary so that it fits a window.
 *
 * <p>The kept prefix starts where the utterance starts and ends with the last aligned word that
 * ends inside {@code [windowStart, windowStart + maxLen - EPSILON]}. Its text holds the selected
 * tokens, its alignment the consumed entries.
 */
@Component
public class BoundaryTrimmer {

  private final WordAlignmentMatcher matcher;

  public BoundaryTrimmer(WordAlignmentMatcher matcher) {
    this.matcher = matcher;
  }

  /**
   * Trim {@code utterance} to the window opening at {@code windowStart}.
   *
   * @param utterance the overflowing utterance
   * @param windowStart start of the group the utterance belongs to
   * @param maxLen maximum sub-segment length in seconds
   * @return the prefix and whatever is left after it
   */
  public TrimResult trim(UtteranceSpan utterance, double windowStart, double maxLen) {
    WordSelection selection = matcher.select(utterance, TimeRange.window(windowStart, maxLen));

    if (!selection.hasSelection()) {
      return TrimResult.noViablePrefix(reanchored(utterance));
    }

    UtteranceSpan prefix =
        utterance.withContent(
            utterance.start(),
            selection.lastEnd() - utterance.start(),
            selection.text(),
            selection.words());
    return new TrimResult(Optional.of(prefix), remainder(utterance, selection));
  }

  /** The words after the selection, or empty when the scan ran through the whole text. */
  private Optional<UtteranceSpan> remainder(UtteranceSpan utterance, WordSelection selection) {
    List<String> tokens = utterance.tokens();
    List<Word> alignment = utterance.alignment();
    if (selection.stopTokenIndex() >= tokens.size()
        || selection.consumedEntries() >= alignment.size()) {
      return Optional.empty();
    }
    List<Word> rest = alignment.subList(selection.consumedEntries(), alignment.size());
    double start = Math.max(rest.get(0).start(), utterance.start());
    if (start >= utterance.end()) {
      return Optional.empty();
    }
    String text = String.join(" ", tokens.subList(selection.stopTokenIndex(), tokens.size()));
    return Optional.of(utterance.withContent(start, utterance.end() - start, text, rest));
  }

  /**
   * An utterance whose first aligned word starts later than the utterance itself may still fit a
   * window opened at that word. Returns it moved there, or empty if that would not change it.
   */
  private Optional<UtteranceSpan> reanchored(UtteranceSpan utterance) {
    if (!utterance.hasAlignment()) {
      return Optional.empty();
    }
    double firstWordStart = utterance.alignment().get(0).start();
    if (firstWordStart <= utterance.start() + TimeRange.EPSILON
        || firstWordStart >= utterance.end()) {
      return Optional.empty();
    }
    return Optional.of(
        utterance.withContent(
            firstWordStart,
            utterance.end() - firstWordStart,
            utterance.text(),
            utterance.alignment()));
  }
}
