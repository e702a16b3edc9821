package com.scholary.lyricsync.align;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Produces comparable tokens from lyric and recognizer text.
 *
 * <p>Both sources disagree on case and punctuation ("Hello," vs "hello"), so matching is done on a
 * lowercase, letters-and-digits-only form. An empty token is a valid result; callers decide
 * whether to keep it.
 */
public final class TokenNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

  private TokenNormalizer() {}

  public static String normalize(String word) {
    if (word == null || word.isEmpty()) {
      return "";
    }
    StringBuilder clean = new StringBuilder(word.length());
    word.codePoints()
        .filter(Character::isLetterOrDigit)
        .map(Character::toLowerCase)
        .forEach(clean::appendCodePoint);
    return clean.toString();
  }

  /**
   * Split text on Unicode whitespace, including no-break and ideographic spaces.
   *
   * @param text the text to split
   * @return the non-empty words, in order
   */
  public static List<String> splitWords(String text) {
    List<String> words = new ArrayList<>();
    if (text == null) {
      return words;
    }
    for (String word : WHITESPACE.split(text)) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }
}
