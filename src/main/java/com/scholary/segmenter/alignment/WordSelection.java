package com.scholary.segmenter.alignment;

import com.scholary.segmenter.model.Word;
import java.util.List;

/**
 * Result of matching an utterance's tokens against its alignment within a time window.
 *
 * @param tokens raw tokens selected, unaligned filler after the first aligned token included
 * @param words alignment entries behind the selected tokens, each entry once
 * @param firstStart start of the first selected aligned token, {@link #NONE_SELECTED} if none
 * @param lastEnd end of the last selected aligned token, the utterance start if none
 * @param consumedEntries alignment entries consumed, including those before the window
 * @param stopTokenIndex index of the first token that was not examined, the token count if the
 *     scan ran to the end of the text
 */
public record WordSelection(
    List<String> tokens,
    List<Word> words,
    double firstStart,
    double lastEnd,
    int consumedEntries,
    int stopTokenIndex) {

  public static final double NONE_SELECTED = -1;

  public WordSelection {
    tokens = List.copyOf(tokens);
    words = List.copyOf(words);
  }

  /** True when at least one aligned token landed inside the window. */
  public boolean hasSelection() {
    return firstStart != NONE_SELECTED;
  }

  public String text() {
    return String.join(" ", tokens);
  }
}
