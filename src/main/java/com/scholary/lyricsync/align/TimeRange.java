package com.scholary.lyricsync.align;

/**
 * Represents a time range in seconds with start and end points.
 *
 * <p>Used for line search windows. All times are in seconds with fractional precision.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Check if an interval overlaps this range.
   *
   * <p>Touching endpoints do not count as overlap.
   *
   * @param otherStart start of the other interval
   * @param otherEnd end of the other interval
   * @return true if the intervals overlap
   */
  public boolean overlaps(double otherStart, double otherEnd) {
    return otherStart < end && otherEnd > start;
  }
}
