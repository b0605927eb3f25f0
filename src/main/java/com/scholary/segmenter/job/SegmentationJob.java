package com.scholary.segmenter.job;

import com.scholary.segmenter.api.JobStatusResponse.Status;
import com.scholary.segmenter.config.SegmentationProperties;
import com.scholary.segmenter.corpus.CorpusReport;
import java.time.Instant;

/**
 * Represents an async segmentation job.
 *
 * <p>Tracks the job's state, progress, and report. Stored in memory using Caffeine cache; the
 * status fields are updated from a worker thread and read by API requests.
 */
public class SegmentationJob {

  private final String jobId;
  private final String input;
  private final String output;
  private final SegmentationProperties settings;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile CorpusReport report;
  private volatile String error;

  public SegmentationJob(
      String jobId, String input, String output, SegmentationProperties settings) {
    this.jobId = jobId;
    this.input = input;
    this.output = output;
    this.settings = settings;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public String getInput() {
    return input;
  }

  public String getOutput() {
    return output;
  }

  public SegmentationProperties getSettings() {
    return settings;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public CorpusReport getReport() {
    return report;
  }

  public void setReport(CorpusReport report) {
    this.report = report;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
