package com.scholary.lyricsync.asr;

import java.util.List;

/**
 * Represents a single segment of recognized audio.
 *
 * <p>This matches the structure returned by Whisper-style recognizers when word timestamps are
 * requested. {@code words} may be empty when the recognizer only produced segment timing.
 */
public record AsrSegment(double start, double end, String text, List<AsrWord> words) {

  public AsrSegment {
    if (text == null) {
      text = "";
    }
    words = words == null ? List.of() : List.copyOf(words);
  }
}
