package com.scholary.segmenter.corpus;

import java.util.List;

/**
 * Summary of one corpus run.
 *
 * @param runId identifier of the run, also present in the log context
 * @param inputSegments segments read from the input
 * @param outputSegments sub-segments produced
 * @param lostUtterances utterances that fit no sub-segment
 * @param failures segments that failed, in input order
 */
public record CorpusReport(
    String runId,
    int inputSegments,
    int outputSegments,
    int lostUtterances,
    List<SegmentFailure> failures) {

  public CorpusReport {
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  public List<String> failedSegmentIds() {
    return failures.stream().map(SegmentFailure::segmentId).toList();
  }
}
