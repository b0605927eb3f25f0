package com.scholary.segmenter.split;

import com.scholary.segmenter.model.UtteranceSpan;

/**
 * One utterance held in the splitter's working group.
 *
 * @param span the utterance as it will be emitted (derived id, possibly trimmed)
 * @param source the input utterance this entry was derived from, used for overlap extraction and
 *     identity checks
 * @param position scan position the entry was taken from
 * @param fragment true for an overlap fragment injected by {@link OverlapCarrier}
 * @param truncated true once the entry has been cut at the group boundary
 */
record GroupEntry(
    UtteranceSpan span, UtteranceSpan source, int position, boolean fragment, boolean truncated) {

  static GroupEntry scanned(UtteranceSpan span, UtteranceSpan source, int position) {
    return new GroupEntry(span, source, position, false, false);
  }

  static GroupEntry fragment(UtteranceSpan span, UtteranceSpan source, int position) {
    return new GroupEntry(span, source, position, true, false);
  }

  String speakerId() {
    return span.speakerId();
  }

  GroupEntry truncatedTo(UtteranceSpan prefix) {
    return new GroupEntry(prefix, source, position, fragment, true);
  }
}
