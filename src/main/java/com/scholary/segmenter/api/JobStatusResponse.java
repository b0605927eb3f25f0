package com.scholary.segmenter.api;

import com.scholary.segmenter.corpus.CorpusReport;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the run report once it has finished.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    Instant createdAt,
    CorpusReport report,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
