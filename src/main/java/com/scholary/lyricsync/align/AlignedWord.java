package com.scholary.lyricsync.align;

import java.util.Locale;

/**
 * A reference word being timed.
 *
 * <p>Owned by exactly one {@link AlignedLine}. Starts unmatched at zero time and is filled in by
 * alignment, interpolation and overlap resolution in turn.
 */
public class AlignedWord {

  private final String text;
  private final String token;
  private double start;
  private double end;
  private boolean matched;
  private boolean interpolated;

  AlignedWord(String text) {
    this.text = text;
    this.token = TokenNormalizer.normalize(text);
  }

  public String getText() {
    return text;
  }

  String getToken() {
    return token;
  }

  public double getStart() {
    return start;
  }

  public double getEnd() {
    return end;
  }

  public boolean isMatched() {
    return matched;
  }

  /** True when the timing was synthesized rather than copied from a recognized word. */
  public boolean isInterpolated() {
    return interpolated;
  }

  void setTiming(double start, double end) {
    this.start = start;
    this.end = end;
  }

  void setStart(double start) {
    this.start = start;
  }

  void setEnd(double end) {
    this.end = end;
  }

  void markMatched() {
    this.matched = true;
  }

  void markInterpolated() {
    this.matched = true;
    this.interpolated = true;
  }

  @Override
  public String toString() {
    String flag = interpolated ? ", interpolated" : matched ? "" : ", unmatched";
    return String.format(Locale.ROOT, "%s[%.2f-%.2f%s]", text, start, end, flag);
  }
}
