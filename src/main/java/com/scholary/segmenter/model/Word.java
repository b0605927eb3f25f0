package com.scholary.segmenter.model;

/**
 * A single word-level alignment entry.
 *
 * <p>The symbol may hold several space-separated words when the aligner grouped them under one
 * timing. Times are in seconds, relative to the segment that owns the utterance.
 */
public record Word(String symbol, double start, double duration) {

  public Word {
    if (symbol == null) {
      symbol = "";
    }
  }

  public double end() {
    return start + duration;
  }

  /** Shift this word by the given number of seconds. */
  public Word withOffset(double offset) {
    return new Word(symbol, start + offset, duration);
  }
}
