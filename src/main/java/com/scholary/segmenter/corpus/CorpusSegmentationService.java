package com.scholary.segmenter.corpus;

import com.scholary.segmenter.alignment.AlignmentNormalizer;
import com.scholary.segmenter.config.SegmentationProperties;
import com.scholary.segmenter.logging.StructuredLogger;
import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.split.SegmentSplitter;
import com.scholary.segmenter.split.SplitOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the splitter over a whole corpus.
 *
 * <p>Each input segment is prepared (punctuation-only alignment entries removed, cut at long
 * silences) and every resulting piece is split to the length limit. Segments are processed on the
 * worker pool when more than one job is configured; the output keeps the input order regardless of
 * which worker finishes first.
 *
 * <p>A segment that fails is recorded in the report and left out of the output. The other segments
 * are not affected.
 */
@Service
public class CorpusSegmentationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CorpusSegmentationService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final int PROGRESS_STEP_PERCENT = 10;

  private final AlignmentNormalizer normalizer;
  private final SupervisionGrouper grouper;
  private final SegmentSplitter splitter;
  private final SegmentationProperties properties;
  private final Executor executor;

  public CorpusSegmentationService(
      AlignmentNormalizer normalizer,
      SupervisionGrouper grouper,
      SegmentSplitter splitter,
      SegmentationProperties properties,
      @Qualifier("segmentationExecutor") Executor executor) {
    this.normalizer = normalizer;
    this.grouper = grouper;
    this.splitter = splitter;
    this.properties = properties;
    this.executor = executor;
  }

  /** Segment a corpus with the configured settings. */
  public CorpusResult segment(List<RecordingSegment> segments, String source) {
    return segment(segments, properties, source);
  }

  /**
   * Segment a corpus.
   *
   * @param segments input segments, in the order the output should follow
   * @param settings length limit, worker count and preprocessing switches for this run
   * @param source description of where the segments came from, for the log context
   */
  public CorpusResult segment(
      List<RecordingSegment> segments, SegmentationProperties settings, String source) {
    String runId = UUID.randomUUID().toString();
    try {
      StructuredLogger.setRunContext(runId, source);
      LOGGER.info(
          "Segmenting {} segments from {}: maxLen={}s, numJobs={}",
          segments.size(),
          source,
          settings.maxLen(),
          settings.numJobs());

      List<SegmentOutcome> outcomes = process(segments, settings, runId);

      List<RecordingSegment> output = new ArrayList<>();
      List<SegmentFailure> failures = new ArrayList<>();
      int lost = 0;
      for (SegmentOutcome outcome : outcomes) {
        output.addAll(outcome.segments());
        lost += outcome.lostUtterances();
        if (outcome.failure() != null) {
          failures.add(outcome.failure());
        }
      }

      CorpusReport report =
          new CorpusReport(runId, segments.size(), output.size(), lost, failures);
      if (report.hasFailures()) {
        LOGGER.warn(
            "Segmentation finished with {} failed segments: {}",
            failures.size(),
            report.failedSegmentIds());
      } else {
        LOGGER.info(
            "Segmentation finished: {} segments in, {} sub-segments out",
            segments.size(),
            output.size());
      }
      return new CorpusResult(List.copyOf(output), report);
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private List<SegmentOutcome> process(
      List<RecordingSegment> segments, SegmentationProperties settings, String runId) {
    List<SegmentOutcome> outcomes = new ArrayList<>(segments.size());
    ProgressTracker progress = new ProgressTracker(runId, segments.size());

    if (settings.numJobs() <= 1) {
      for (RecordingSegment segment : segments) {
        outcomes.add(progress.record(processOne(segment, settings)));
      }
      return outcomes;
    }

    List<CompletableFuture<SegmentOutcome>> futures = new ArrayList<>(segments.size());
    for (RecordingSegment segment : segments) {
      futures.add(CompletableFuture.supplyAsync(() -> processOne(segment, settings), executor));
    }
    // Joined in submission order so the output follows the input.
    for (CompletableFuture<SegmentOutcome> future : futures) {
      outcomes.add(progress.record(future.join()));
    }
    return outcomes;
  }

  private SegmentOutcome processOne(RecordingSegment segment, SegmentationProperties settings) {
    try {
      RecordingSegment prepared =
          settings.filterPunctuationAlignments() ? normalizer.normalize(segment) : segment;
      List<RecordingSegment> pieces =
          settings.trimToGroups()
              ? grouper.group(prepared, settings.maxPause())
              : List.of(prepared);

      List<RecordingSegment> result = new ArrayList<>();
      int lost = 0;
      for (RecordingSegment piece : pieces) {
        SplitOutcome outcome = splitter.splitWithOutcome(piece, settings.maxLen());
        result.addAll(outcome.segments());
        lost += outcome.lostUtterances();
      }
      return new SegmentOutcome(result, lost, null);
    } catch (RuntimeException e) {
      structuredLogger.logSegmentFailed(
          segment.id(), e.getClass().getSimpleName(), e.getMessage());
      LOGGER.debug("Failure details for segment {}", segment.id(), e);
      return new SegmentOutcome(
          List.of(),
          0,
          new SegmentFailure(segment.id(), e.getClass().getSimpleName(), e.getMessage()));
    }
  }

  private record SegmentOutcome(
      List<RecordingSegment> segments, int lostUtterances, SegmentFailure failure) {}

  /** Logs progress each time another tenth of the corpus is done. */
  private final class ProgressTracker {

    private final String runId;
    private final int total;
    private int processed;
    private int failed;
    private int lastReportedStep;

    ProgressTracker(String runId, int total) {
      this.runId = runId;
      this.total = total;
    }

    SegmentOutcome record(SegmentOutcome outcome) {
      processed++;
      if (outcome.failure() != null) {
        failed++;
      }
      int percent = total == 0 ? 100 : processed * 100 / total;
      int step = percent / PROGRESS_STEP_PERCENT;
      if (step > lastReportedStep || processed == total) {
        lastReportedStep = step;
        structuredLogger.logCorpusProgress(runId, processed, total, failed, percent);
      }
      return outcome;
    }
  }
}
