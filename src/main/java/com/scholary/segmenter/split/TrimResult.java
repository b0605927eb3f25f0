package com.scholary.segmenter.split;

import com.scholary.segmenter.model.UtteranceSpan;
import java.util.Optional;

/**
 * Outcome of cutting an utterance at a word boundary.
 *
 * @param prefix the part that fits the window; empty when no aligned word fits ("no viable
 *     prefix")
 * @param remainder the words after the cut, starting at the first word left out; empty when
 *     nothing is left over
 */
public record TrimResult(Optional<UtteranceSpan> prefix, Optional<UtteranceSpan> remainder) {

  public static TrimResult noViablePrefix(Optional<UtteranceSpan> remainder) {
    return new TrimResult(Optional.empty(), remainder);
  }

  public boolean isViable() {
    return prefix.isPresent();
  }

  /** A kept prefix always marks its speaker as continuing in a later sub-segment. */
  public boolean truncated() {
    return prefix.isPresent();
  }
}
