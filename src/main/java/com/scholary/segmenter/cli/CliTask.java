package com.scholary.segmenter.cli;

import java.util.Locale;

/** Operations the command line can run on a manifest. */
public enum CliTask {
  /** Split segments to the length limit. */
  SEGMENT,
  /** Keep only segments shorter than the length limit. */
  FILTER,
  /** Prefix all ids with a dataset name. */
  PREFIX,
  /** Write the utterances as a supervision manifest. */
  SUPERVISIONS,
  /** Write the utterances as an STM transcript. */
  STM;

  public static CliTask parse(String value) {
    if (value == null || value.isBlank()) {
      return SEGMENT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown task '"
              + value
              + "', expected one of segment, filter, prefix, supervisions, stm",
          e);
    }
  }
}
