package com.scholary.lyricsync.lyrics;

/**
 * A lyric line whose text is authoritative but whose start time may have drifted.
 *
 * <p>Comes from a line-timed lyric source and is never mutated; drift correction produces a
 * shifted copy instead.
 */
public record ReferenceLine(String text, double start) {

  public ReferenceLine {
    if (text == null) {
      text = "";
    }
  }

  public ReferenceLine shift(double offset) {
    return new ReferenceLine(text, start + offset);
  }
}
