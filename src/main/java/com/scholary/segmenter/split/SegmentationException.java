package com.scholary.segmenter.split;

/**
 * Exception thrown when a single recording segment cannot be split.
 *
 * <p>Raised for genuinely invalid input (negative times, non-positive maximum length) or when a
 * produced sub-segment breaks its timing contract. It fails only the segment it names; the corpus
 * driver records it and carries on with the rest of the batch.
 */
public class SegmentationException extends RuntimeException {

  private final String segmentId;

  public SegmentationException(String segmentId, String message) {
    super("Segment " + segmentId + ": " + message);
    this.segmentId = segmentId;
  }

  public SegmentationException(String segmentId, String message, Throwable cause) {
    super("Segment " + segmentId + ": " + message, cause);
    this.segmentId = segmentId;
  }

  public String getSegmentId() {
    return segmentId;
  }
}
