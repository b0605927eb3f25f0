package com.scholary.segmenter.alignment;

import com.scholary.segmenter.model.Word;
import java.util.List;

/**
 * Position in an utterance's alignment stream: the current entry and the next unconsumed
 * sub-word within it.
 *
 * <p>Entries whose symbol has no comparable sub-words are stepped over, they can never match a
 * written token.
 */
final class AlignmentCursor {

  private final List<Word> entries;
  private int entryIndex;
  private List<String> subWords;
  private int subWordOffset;

  AlignmentCursor(List<Word> entries) {
    this.entries = entries;
    this.entryIndex = -1;
    advanceEntry();
  }

  boolean isExhausted() {
    return entryIndex >= entries.size();
  }

  /** The entry holding the next unconsumed sub-word. Only valid while not exhausted. */
  Word current() {
    return entries.get(entryIndex);
  }

  String nextSubWord() {
    return subWords.get(subWordOffset);
  }

  /** Index of the current entry, which equals the number of fully consumed entries. */
  int entryIndex() {
    return entryIndex;
  }

  /** True when no sub-word of the current entry has been consumed yet. */
  boolean atEntryStart() {
    return subWordOffset == 0;
  }

  /** Consume one sub-word, moving to the next entry once the current one is used up. */
  void consumeSubWord() {
    subWordOffset++;
    if (subWordOffset >= subWords.size()) {
      advanceEntry();
    }
  }

  private void advanceEntry() {
    entryIndex++;
    subWordOffset = 0;
    subWords = List.of();
    while (entryIndex < entries.size()) {
      subWords = WordNormalizer.subWords(entries.get(entryIndex).symbol());
      if (!subWords.isEmpty()) {
        return;
      }
      entryIndex++;
    }
  }
}
