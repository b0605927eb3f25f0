package com.scholary.segmenter.alignment;

import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.model.Word;
import com.scholary.segmenter.timing.TimeRange;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Walks an utterance's written tokens and its word alignment in lock-step to find which tokens
 * fall inside a time window.
 *
 * <p>Matching rules:
 *
 * <ul>
 *   <li>Tokens and aligned sub-words are compared after {@link WordNormalizer#normalize}.
 *   <li>A token matching the next aligned sub-word consumes it. Tokens aligned before the window
 *       start are consumed but not selected.
 *   <li>The scan stops at the first aligned token whose end lies past the window end.
 *   <li>A token with no aligned counterpart is filler. Filler is skipped until the first aligned
 *       token has been selected and attached to the selection afterwards.
 * </ul>
 *
 * <p>Unmatchable tokens never fail the scan, they simply degrade to filler.
 */
@Component
public class WordAlignmentMatcher {

  /**
   * Select the tokens of {@code utterance} that lie inside {@code window}.
   *
   * @param utterance the utterance to scan
   * @param window inclusive window, usually built with {@link TimeRange#window}
   * @return the selection; empty when the utterance has no alignment
   */
  public WordSelection select(UtteranceSpan utterance, TimeRange window) {
    List<String> tokens = utterance.tokens();
    List<String> selectedTokens = new ArrayList<>();
    List<Word> selectedWords = new ArrayList<>();
    double firstStart = WordSelection.NONE_SELECTED;
    double lastEnd = utterance.start();

    if (!utterance.hasAlignment()) {
      return new WordSelection(selectedTokens, selectedWords, firstStart, lastEnd, 0, 0);
    }

    AlignmentCursor cursor = new AlignmentCursor(utterance.alignment());
    int tokenIndex = 0;
    for (; tokenIndex < tokens.size(); tokenIndex++) {
      String token = tokens.get(tokenIndex);
      String normalized = WordNormalizer.normalize(token);

      if (!cursor.isExhausted() && WordNormalizer.matches(normalized, cursor.nextSubWord())) {
        Word entry = cursor.current();
        if (entry.end() > window.end()) {
          break;
        }
        if (window.contains(entry.start())) {
          if (firstStart == WordSelection.NONE_SELECTED) {
            firstStart = entry.start();
          }
          selectedTokens.add(token);
          if (cursor.atEntryStart()) {
            selectedWords.add(entry);
          }
          lastEnd = entry.end();
        }
        cursor.consumeSubWord();
      } else if (firstStart != WordSelection.NONE_SELECTED) {
        selectedTokens.add(token);
      }
    }

    return new WordSelection(
        selectedTokens, selectedWords, firstStart, lastEnd, cursor.entryIndex(), tokenIndex);
  }
}
