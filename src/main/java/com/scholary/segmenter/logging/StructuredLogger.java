package com.scholary.segmenter.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log segmentation events with structured fields that can be queried in a
 * log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a closed group that became a sub-segment. */
  public void logGroupClosed(
      String segmentId,
      int groupIndex,
      double start,
      double end,
      int utteranceCount,
      int truncatedCount) {
    try {
      MDC.put("event_type", "group_closed");
      MDC.put("segment_id", segmentId);
      MDC.put("group_index", String.valueOf(groupIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("utterances", String.valueOf(utteranceCount));
      MDC.put("truncated", String.valueOf(truncatedCount));

      logger.debug(
          "Group closed: segment={}, index={}, range=[{}-{}], utterances={}, truncated={}",
          segmentId,
          groupIndex,
          start,
          end,
          utteranceCount,
          truncatedCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log a scan rollback to an earlier position. */
  public void logRollback(String segmentId, int fromPosition, int toPosition) {
    try {
      MDC.put("event_type", "rollback");
      MDC.put("segment_id", segmentId);
      MDC.put("from_position", String.valueOf(fromPosition));
      MDC.put("to_position", String.valueOf(toPosition));

      logger.debug(
          "Rollback: segment={}, from={}, to={}", segmentId, fromPosition, toPosition);
    } finally {
      clearEventFields();
    }
  }

  /** Log an overlap fragment carried into a new group. */
  public void logOverlapCarried(
      String segmentId, String seedId, String fragmentId, double start, double end) {
    try {
      MDC.put("event_type", "overlap_carried");
      MDC.put("segment_id", segmentId);
      MDC.put("seed_id", seedId);
      MDC.put("fragment_id", fragmentId);
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug(
          "Overlap carried: segment={}, seed={}, fragment={}, range=[{}-{}]",
          segmentId,
          seedId,
          fragmentId,
          start,
          end);
    } finally {
      clearEventFields();
    }
  }

  /**
   * Log an utterance removed from a group.
   *
   * @param deferred true when the utterance will be scanned again, false when it is lost
   */
  public void logUtteranceDropped(
      String segmentId, String utteranceId, double start, double end, boolean deferred) {
    try {
      MDC.put("event_type", "utterance_dropped");
      MDC.put("segment_id", segmentId);
      MDC.put("utterance_id", utteranceId);
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("deferred", String.valueOf(deferred));

      if (deferred) {
        logger.debug(
            "Utterance deferred: segment={}, utterance={}, range=[{}-{}]",
            segmentId,
            utteranceId,
            start,
            end);
      } else {
        logger.warn(
            "Utterance dropped, no window fits it: segment={}, utterance={}, range=[{}-{}]",
            segmentId,
            utteranceId,
            start,
            end);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a segment that failed to split. */
  public void logSegmentFailed(String segmentId, String errorType, String message) {
    try {
      MDC.put("event_type", "segment_failed");
      MDC.put("segment_id", segmentId);
      MDC.put("errorType", errorType);

      logger.error(
          "Segment failed: segment={}, error={}, message={}", segmentId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log corpus progress. */
  public void logCorpusProgress(
      String runId, int segmentsProcessed, int totalSegments, int failed, int percentComplete) {
    try {
      MDC.put("event_type", "corpus_progress");
      MDC.put("segmentsProcessed", String.valueOf(segmentsProcessed));
      MDC.put("totalSegments", String.valueOf(totalSegments));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Corpus progress: runId={}, segments={}/{}, failed={}, progress={}%",
          runId,
          segmentsProcessed,
          totalSegments,
          failed,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId, String input) {
    MDC.put("runId", runId);
    MDC.put("input", input);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove("runId");
    MDC.remove("input");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_id");
    MDC.remove("group_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("utterances");
    MDC.remove("truncated");
    MDC.remove("from_position");
    MDC.remove("to_position");
    MDC.remove("seed_id");
    MDC.remove("fragment_id");
    MDC.remove("utterance_id");
    MDC.remove("deferred");
    MDC.remove("errorType");
    MDC.remove("segmentsProcessed");
    MDC.remove("totalSegments");
    MDC.remove("failed");
    MDC.remove("percentComplete");
  }
}
