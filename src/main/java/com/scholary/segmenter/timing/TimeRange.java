package com.scholary.segmenter.timing;

/**
 * Represents a time range in seconds with start and end points.
 *
 * <p>Used for utterance intervals and for the inclusive windows that sub-segments must fit in. All
 * times are in seconds with fractional precision.
 */
public record TimeRange(double start, double end) {

  /** Slack subtracted from window ends so that boundary words are not misclassified. */
  public static final double EPSILON = 1e-5;

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  /**
   * Window of at most {@code maxLen} seconds opening at {@code start}.
   *
   * <p>The end is pulled in by {@link #EPSILON}, so a word ending exactly on the nominal boundary
   * does not fit.
   */
  public static TimeRange window(double start, double maxLen) {
    return new TimeRange(start, start + maxLen - EPSILON);
  }

  /**
   * Check if this range contains a given time point.
   *
   * @param time the time to check
   * @return true if time is within [start, end]
   */
  public boolean contains(double time) {
    return time >= start && time <= end;
  }

  /**
   * Check if a time point falls in [start, end).
   *
   * <p>An utterance "is active at" a time point under this test; one that ends exactly when
   * another starts is not.
   */
  public boolean isActiveAt(double time) {
    return time >= start && time < end;
  }
}
