package com.scholary.segmenter.alignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Normalizes written tokens and aligned symbols so they can be compared.
 *
 * <p>Normalization lowercases and strips punctuation. Hyphens and digits are kept, so "mm-hmm"
 * and "20" survive unchanged.
 */
public final class WordNormalizer {

  private static final String PUNCTUATION = "!\"#$%&()*+,./:;<=>?@[\\]^_`'{|}~";

  /**
   * Written forms whose aligned (spoken) form differs. Holds for AMI and NOTSOFAR style
   * transcripts.
   */
  private static final Map<String, String> SPOKEN_FORMS = Map.of("mm-hmm", "mmm");

  private WordNormalizer() {}

  /**
   * Normalize a word for comparison.
   *
   * <p>Removes punctuation and converts to lowercase.
   */
  public static String normalize(String word) {
    StringBuilder normalized = new StringBuilder(word.length());
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      if (PUNCTUATION.indexOf(c) < 0) {
        normalized.append(c);
      }
    }
    return normalized.toString().toLowerCase();
  }

  /**
   * Split an alignment symbol into its normalized sub-words.
   *
   * <p>Sub-words that normalize to nothing are dropped, so "yeah ," yields just "yeah".
   */
  public static List<String> subWords(String symbol) {
    List<String> result = new ArrayList<>();
    for (String part : symbol.trim().split("\\s+")) {
      String normalized = normalize(part);
      if (!normalized.isEmpty()) {
        result.add(normalized);
      }
    }
    return result;
  }

  /**
   * Check whether a normalized written token matches a normalized aligned sub-word, either
   * directly or through its known spoken form.
   */
  public static boolean matches(String normalizedToken, String subWord) {
    if (normalizedToken.equals(subWord)) {
      return true;
    }
    String spoken = SPOKEN_FORMS.get(normalizedToken);
    return spoken != null && spoken.equals(subWord);
  }
}
