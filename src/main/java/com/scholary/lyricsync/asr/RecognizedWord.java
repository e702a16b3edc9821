package com.scholary.lyricsync.asr;

/**
 * A single word emitted by the speech recognizer.
 *
 * <p>The timing is trusted, the text is not.
 */
public record RecognizedWord(String text, double start, double end) {

  public RecognizedWord {
    if (text == null) {
      text = "";
    }
  }
}
