package com.scholary.segmenter.split;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A group after close-out.
 *
 * @param entries surviving entries, trimmed where they overflowed
 * @param continuation per-speaker continuation flags of the surviving speakers
 * @param rollbackTarget earliest scan position of an overflowing non-seed entry, -1 if none
 * @param seedRemainder what is left of the seed after it was cut, to be scanned again
 */
record ClosedGroup(
    List<GroupEntry> entries,
    Map<String, Boolean> continuation,
    int rollbackTarget,
    Optional<PendingUtterance> seedRemainder) {

  boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Earliest start among the surviving entries. Only valid for a non-empty group. */
  double start() {
    return entries.stream().mapToDouble(e -> e.span().start()).min().orElseThrow();
  }
}
