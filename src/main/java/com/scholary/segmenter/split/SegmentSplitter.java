package com.scholary.segmenter.split;

import com.scholary.segmenter.config.SegmentationProperties;
import com.scholary.segmenter.logging.StructuredLogger;
import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.model.Word;
import com.scholary.segmenter.timing.TimeRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits one recording segment into sub-segments no longer than a maximum length.
 *
 * <p>The scan walks the utterances in start order and accumulates them into a group while they
 * start within {@code maxLen} of the group's first utterance (the seed). When the next utterance
 * would break that window, the group is closed out:
 *
 * <ul>
 *   <li>every utterance ending past {@code seedStart + maxLen} is cut at a word boundary by the
 *       {@link BoundaryTrimmer}, or removed when not a single word fits;
 *   <li>the surviving utterances form one sub-segment, and a speaker whose utterance was cut is
 *       flagged as continuing.
 * </ul>
 *
 * <p>If a non-seed utterance overflowed, the scan rolls back to the earliest one and reprocesses
 * it as the seed of the next group. If the seed itself was cut, what is left of it is queued at
 * its chronological position and scanned again. A group opened by a rollback first receives the
 * words other speakers were saying at that moment, via the {@link OverlapCarrier}.
 *
 * <p>Input segments are never modified; every derived utterance is a new value. The component is
 * stateless and safe to call from several worker threads.
 */
@Component
public class SegmentSplitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentSplitter.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Comparator<UtteranceSpan> BY_START =
      Comparator.comparingDouble(UtteranceSpan::start);

  private final BoundaryTrimmer trimmer;
  private final OverlapCarrier carrier;
  private final boolean carryOverlaps;

  @Autowired
  public SegmentSplitter(
      BoundaryTrimmer trimmer, OverlapCarrier carrier, SegmentationProperties properties) {
    this(trimmer, carrier, properties.carryOverlaps());
  }

  public SegmentSplitter(BoundaryTrimmer trimmer, OverlapCarrier carrier, boolean carryOverlaps) {
    this.trimmer = trimmer;
    this.carrier = carrier;
    this.carryOverlaps = carryOverlaps;
  }

  /**
   * Split a segment into chronologically ordered sub-segments.
   *
   * @param segment the segment to split; its utterances must not be separated by long silences
   * @param maxLen maximum sub-segment duration in seconds
   * @return the sub-segments; empty for a segment without utterances, the segment itself when it
   *     already fits
   * @throws SegmentationException if the segment holds invalid timings
   */
  public List<RecordingSegment> split(RecordingSegment segment, double maxLen) {
    return splitWithOutcome(segment, maxLen).segments();
  }

  /**
   * Split a segment and report how many utterances could not be placed in any sub-segment.
   *
   * @see #split(RecordingSegment, double)
   */
  public SplitOutcome splitWithOutcome(RecordingSegment segment, double maxLen) {
    validate(segment, maxLen);

    if (segment.utterances().isEmpty()) {
      LOGGER.debug("Segment {} has no utterances, nothing to split", segment.id());
      return new SplitOutcome(List.of(), 0);
    }
    if (segment.duration() <= maxLen) {
      return new SplitOutcome(List.of(segment), 0);
    }

    SplitRun run = new SplitRun(segment, maxLen);
    List<ClosedGroup> groups = new ArrayList<>(run.scan());
    // a dropped seed can leave a group starting after the one that follows it
    groups.sort(Comparator.comparingDouble(ClosedGroup::start));

    List<RecordingSegment> result = new ArrayList<>(groups.size());
    for (ClosedGroup group : groups) {
      result.add(toSubSegment(segment, group, result.size(), maxLen));
    }
    LOGGER.debug(
        "Split segment {} ({}s, {} utterances) into {} sub-segments, {} utterances lost",
        segment.id(),
        segment.duration(),
        segment.utterances().size(),
        result.size(),
        run.lost);
    return new SplitOutcome(List.copyOf(result), run.lost);
  }

  /** Mutable state of one split call. */
  private final class SplitRun {

    private final RecordingSegment segment;
    private final double maxLen;
    private final List<PendingUtterance> pending;
    private final List<ClosedGroup> closed = new ArrayList<>();
    private int lost;

    SplitRun(RecordingSegment segment, double maxLen) {
      this.segment = segment;
      this.maxLen = maxLen;
      this.pending =
          new ArrayList<>(
              segment.utterances().stream().sorted(BY_START).map(PendingUtterance::of).toList());
    }

    List<ClosedGroup> scan() {
      List<GroupEntry> group = new ArrayList<>();
      group.add(scanned(0, 0));
      int index = 1;
      ScanState state = ScanState.SCANNING;

      while (true) {
        PendingUtterance next = index < pending.size() ? pending.get(index) : null;

        if (next != null && (group.isEmpty() || fitsWindow(group, next))) {
          GroupEntry entry = scanned(index, group.size());
          group.add(entry);
          if (state instanceof ScanState.FallingBack fallingBack) {
            group.addAll(carryInto(entry, group.size(), fallingBack.resumeFrom()));
          }
          state = ScanState.SCANNING;
          index++;
          continue;
        }

        if (group.isEmpty()) {
          break;
        }

        int groupStartPosition = group.get(0).position();
        ClosedGroup closedGroup = closeOut(group);
        if (!closedGroup.isEmpty()) {
          closed.add(closedGroup);
        }

        int resumeFrom = closedGroup.rollbackTarget();
        if (closedGroup.seedRemainder().isPresent()) {
          int insertedAt = enqueue(closedGroup.seedRemainder().get(), groupStartPosition + 1);
          if (resumeFrom < 0 || resumeFrom >= insertedAt) {
            resumeFrom = insertedAt;
          }
        }

        group = new ArrayList<>();
        if (resumeFrom > groupStartPosition) {
          structuredLogger.logRollback(segment.id(), index, resumeFrom);
          index = resumeFrom;
          state = new ScanState.FallingBack(resumeFrom);
        } else {
          if (next != null) {
            group.add(scanned(index, 0));
          }
          index++;
          state = ScanState.SCANNING;
        }
      }
      return closed;
    }

    private boolean fitsWindow(List<GroupEntry> group, PendingUtterance next) {
      return next.span().start() - group.get(0).span().start() < maxLen;
    }

    /** Take the pending utterance at {@code position} into a group with a derived id. */
    private GroupEntry scanned(int position, int positionInGroup) {
      PendingUtterance item = pending.get(position);
      String id = item.source().id() + "-" + position + "-" + positionInGroup;
      return GroupEntry.scanned(item.span().withId(id), item.source(), position);
    }

    private List<GroupEntry> carryInto(GroupEntry seed, int groupSize, int resumeFrom) {
      if (!carryOverlaps || closed.isEmpty()) {
        return List.of();
      }
      Set<String> pendingSourceIds = new HashSet<>();
      for (PendingUtterance item : pending.subList(resumeFrom + 1, pending.size())) {
        pendingSourceIds.add(item.source().id());
      }
      List<GroupEntry> fragments =
          carrier.carry(
              closed.get(closed.size() - 1).entries(), seed, maxLen, pendingSourceIds, groupSize);
      for (GroupEntry fragment : fragments) {
        structuredLogger.logOverlapCarried(
            segment.id(),
            seed.span().id(),
            fragment.span().id(),
            fragment.span().start(),
            fragment.span().end());
      }
      return fragments;
    }

    private ClosedGroup closeOut(List<GroupEntry> group) {
      GroupEntry seed = group.get(0);
      double groupStart = seed.span().start();
      Map<String, Boolean> continuation = new LinkedHashMap<>();
      List<GroupEntry> kept = new ArrayList<>();
      int rollbackTarget = -1;
      Optional<PendingUtterance> seedRemainder = Optional.empty();

      for (GroupEntry entry : group) {
        UtteranceSpan span = entry.span();
        continuation.putIfAbsent(span.speakerId(), false);
        if (span.end() - groupStart <= maxLen) {
          kept.add(entry);
          continue;
        }

        boolean isSeed = entry == seed;
        if (!isSeed
            && !entry.fragment()
            && (rollbackTarget < 0 || entry.position() < rollbackTarget)) {
          rollbackTarget = entry.position();
        }

        TrimResult trim = trimmer.trim(span, groupStart, maxLen);
        if (isSeed) {
          seedRemainder =
              trim.remainder().map(rest -> new PendingUtterance(rest, entry.source()));
        }
        if (!trim.isViable()) {
          boolean deferred = !isSeed || seedRemainder.isPresent();
          if (!deferred) {
            lost++;
          }
          structuredLogger.logUtteranceDropped(
              segment.id(), span.id(), span.start(), span.end(), deferred);
          continue;
        }
        kept.add(entry.truncatedTo(trim.prefix().get()));
        continuation.put(span.speakerId(), trim.truncated());
      }

      return new ClosedGroup(
          Collections.unmodifiableList(kept),
          Collections.unmodifiableMap(continuation),
          rollbackTarget,
          seedRemainder);
    }

    /**
     * Insert an utterance into the scan list after every pending utterance that starts no later
     * than it, searching from {@code fromPosition}. Returns the position it landed on.
     */
    private int enqueue(PendingUtterance item, int fromPosition) {
      int position = fromPosition;
      while (position < pending.size()
          && pending.get(position).span().start() <= item.span().start()) {
        position++;
      }
      pending.add(position, item);
      return position;
    }
  }

  private RecordingSegment toSubSegment(
      RecordingSegment segment, ClosedGroup group, int groupIndex, double maxLen) {
    double minStart = Double.MAX_VALUE;
    double maxEnd = -Double.MAX_VALUE;
    int truncatedCount = 0;
    for (GroupEntry entry : group.entries()) {
      minStart = Math.min(minStart, entry.span().start());
      maxEnd = Math.max(maxEnd, entry.span().end());
      if (entry.truncated()) {
        truncatedCount++;
      }
    }
    double duration = maxEnd - minStart;
    double offset = -minStart;

    List<UtteranceSpan> utterances =
        group.entries().stream().map(e -> e.span().withOffset(offset)).toList();

    if (duration > maxLen + TimeRange.EPSILON) {
      throw new SegmentationException(
          segment.id(),
          String.format(
              "sub-segment %d lasts %.5fs, above the %.5fs limit", groupIndex, duration, maxLen));
    }
    for (UtteranceSpan utterance : utterances) {
      if (utterance.start() < 0 || utterance.end() > duration + TimeRange.EPSILON) {
        throw new SegmentationException(
            segment.id(),
            String.format(
                "utterance %s [%.5f-%.5f] falls outside sub-segment %d of %.5fs",
                utterance.id(), utterance.start(), utterance.end(), groupIndex, duration));
      }
    }

    Map<String, Object> metadata = new LinkedHashMap<>(segment.metadata());
    metadata.put(RecordingSegment.CONTINUATION_KEY, group.continuation());

    structuredLogger.logGroupClosed(
        segment.id(), groupIndex, minStart, maxEnd, utterances.size(), truncatedCount);

    return segment.derive(
        segment.id() + "-" + groupIndex,
        segment.startInRecording() + minStart,
        duration,
        utterances,
        metadata);
  }

  private void validate(RecordingSegment segment, double maxLen) {
    if (!(maxLen > 0)) {
      throw new SegmentationException(segment.id(), "max length must be positive, got " + maxLen);
    }
    if (segment.duration() < 0 || segment.startInRecording() < 0) {
      throw new SegmentationException(
          segment.id(),
          "negative timing: start="
              + segment.startInRecording()
              + ", duration="
              + segment.duration());
    }
    for (UtteranceSpan utterance : segment.utterances()) {
      if (utterance.start() < 0 || utterance.duration() < 0) {
        throw new SegmentationException(
            segment.id(),
            "utterance " + utterance.id() + " has negative timing: start=" + utterance.start()
                + ", duration=" + utterance.duration());
      }
      for (Word word : utterance.alignment()) {
        if (word.duration() < 0) {
          throw new SegmentationException(
              segment.id(),
              "utterance " + utterance.id() + " has word '" + word.symbol()
                  + "' with negative duration " + word.duration());
        }
      }
    }
  }
}
