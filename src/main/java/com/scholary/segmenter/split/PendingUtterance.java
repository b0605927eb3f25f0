package com.scholary.segmenter.split;

import com.scholary.segmenter.model.UtteranceSpan;

/** An utterance waiting in the scan list, paired with the input utterance it came from. */
record PendingUtterance(UtteranceSpan span, UtteranceSpan source) {

  static PendingUtterance of(UtteranceSpan utterance) {
    return new PendingUtterance(utterance, utterance);
  }
}
