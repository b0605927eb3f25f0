package com.scholary.segmenter.job;

import com.scholary.segmenter.api.JobStatusResponse.Status;
import com.scholary.segmenter.corpus.CorpusResult;
import com.scholary.segmenter.corpus.CorpusSegmentationService;
import com.scholary.segmenter.manifest.ManifestReader;
import com.scholary.segmenter.manifest.ManifestWriter;
import com.scholary.segmenter.model.RecordingSegment;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Runs segmentation jobs on the async task executor and records their outcome. */
@Service
public class SegmentationJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentationJobRunner.class);

  private final ManifestReader reader;
  private final ManifestWriter writer;
  private final CorpusSegmentationService segmentationService;
  private final JobRepository jobRepository;

  public SegmentationJobRunner(
      ManifestReader reader,
      ManifestWriter writer,
      CorpusSegmentationService segmentationService,
      JobRepository jobRepository) {
    this.reader = reader;
    this.writer = writer;
    this.segmentationService = segmentationService;
    this.jobRepository = jobRepository;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>The job status is updated as processing progresses. A run in which some segments failed
   * still completes; the failures are listed in its report.
   */
  @Async("taskExecutor")
  public void run(SegmentationJob job) {
    LOGGER.info("Starting segmentation job: {}", job.getJobId());
    try {
      job.setStatus(Status.PROCESSING);
      job.setProgress(10);
      jobRepository.save(job);

      List<RecordingSegment> segments = reader.read(Path.of(job.getInput()));
      job.setProgress(30);

      CorpusResult result =
          segmentationService.segment(segments, job.getSettings(), job.getInput());
      job.setProgress(90);

      writer.write(result.segments(), Path.of(job.getOutput()));

      job.setReport(result.report());
      job.setStatus(Status.COMPLETED);
      job.setProgress(100);
      jobRepository.save(job);
      LOGGER.info("Completed segmentation job: {}", job.getJobId());

    } catch (RuntimeException e) {
      LOGGER.error("Segmentation job failed: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    }
  }
}
