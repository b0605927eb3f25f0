package com.scholary.segmenter.manifest;

/**
 * Exception thrown when a manifest cannot be read or written.
 *
 * <p>This is a runtime exception because a missing or corrupt manifest stops the whole run; there
 * is nothing useful the caller can do per segment.
 */
public class ManifestException extends RuntimeException {

  public ManifestException(String message) {
    super(message);
  }

  public ManifestException(String message, Throwable cause) {
    super(message, cause);
  }
}
