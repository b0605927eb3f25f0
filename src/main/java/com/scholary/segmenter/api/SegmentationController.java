package com.scholary.segmenter.api;

import com.scholary.segmenter.config.SegmentationProperties;
import com.scholary.segmenter.corpus.CorpusResult;
import com.scholary.segmenter.corpus.CorpusSegmentationService;
import com.scholary.segmenter.job.JobPathResolver;
import com.scholary.segmenter.job.JobRepository;
import com.scholary.segmenter.job.SegmentationJob;
import com.scholary.segmenter.job.SegmentationJobRunner;
import com.scholary.segmenter.manifest.CutManifest;
import com.scholary.segmenter.manifest.ManifestMapper;
import com.scholary.segmenter.model.RecordingSegment;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for segment splitting.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Splitting segments sent in the request body
 *   <li>Asynchronous manifest-to-manifest jobs (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Segmentation", description = "Split overlapping-speaker segments to a length limit")
public class SegmentationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentationController.class);

  private final CorpusSegmentationService segmentationService;
  private final ManifestMapper manifestMapper;
  private final JobRepository jobRepository;
  private final SegmentationJobRunner jobRunner;
  private final JobPathResolver pathResolver;
  private final SegmentationProperties properties;

  public SegmentationController(
      CorpusSegmentationService segmentationService,
      ManifestMapper manifestMapper,
      JobRepository jobRepository,
      SegmentationJobRunner jobRunner,
      JobPathResolver pathResolver,
      SegmentationProperties properties) {
    this.segmentationService = segmentationService;
    this.manifestMapper = manifestMapper;
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
    this.pathResolver = pathResolver;
    this.properties = properties;
  }

  @PostMapping("/segment")
  @Operation(
      summary = "Split segments",
      description =
          "Split the given cuts into sub-segments no longer than maxLen. "
              + "Segments that fail are listed in the report and left out of the result.")
  public ResponseEntity<SegmentResponse> segment(@Valid @RequestBody SegmentRequest request) {
    List<RecordingSegment> segments =
        request.segments().stream().map(manifestMapper::toSegment).toList();
    LOGGER.info("Segment request: {} segments, maxLen={}", segments.size(), request.maxLen());

    CorpusResult result =
        segmentationService.segment(segments, settingsFor(request.maxLen()), "request");
    List<CutManifest> cuts = result.segments().stream().map(manifestMapper::toManifest).toList();
    return ResponseEntity.ok(new SegmentResponse(cuts, result.report()));
  }

  /**
   * Start an asynchronous job reading and writing manifests on the server. Both paths are
   * resolved against the job base directory.
   */
  @PostMapping("/jobs")
  @Operation(
      summary = "Start segmentation job",
      description = "Start an asynchronous manifest segmentation job and return its ID for polling")
  public ResponseEntity<AsyncJobResponse> startJob(
      @Valid @RequestBody SegmentationJobRequest request) {
    Path input = pathResolver.resolve(request.input());
    Path output = pathResolver.resolve(request.output());
    SegmentationJob job =
        jobRepository.create(
            input.toString(), output.toString(), settingsFor(request.maxLen()));
    String jobId = job.getJobId();
    LOGGER.info("Created segmentation job {}: {} -> {}", jobId, input, output);

    jobRunner.run(job);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a segmentation job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getCreatedAt(),
                        job.getReport(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  private SegmentationProperties settingsFor(Double maxLen) {
    return maxLen == null ? properties : properties.withMaxLen(maxLen);
  }
}
