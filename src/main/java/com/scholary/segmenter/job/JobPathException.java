package com.scholary.segmenter.job;

/** Exception thrown when a job names a manifest path outside the job base directory. */
public class JobPathException extends RuntimeException {

  public JobPathException(String message) {
    super(message);
  }

  public JobPathException(String message, Throwable cause) {
    super(message, cause);
  }
}
