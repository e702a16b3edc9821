package com.scholary.lyricsync.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning constants for lyric/recognizer timing synchronization.
 *
 * <p>All values are in seconds except {@code minTokenLength} (characters). Missing properties fall
 * back to the documented defaults, so a partially configured {@code application.yml} still yields
 * a complete set.
 *
 * @param minLineDuration minimum visible duration of every output line
 * @param globalOffsetThreshold detected drift must exceed this magnitude to be applied
 * @param windowMargin slack added on both sides of a line's search window
 * @param minTokenLength shortest token used for global offset anchoring
 * @param defaultLineGap nominal length of the last line's window, and the clamp for degenerate
 *     windows
 * @param fallbackLineDuration nominal length of the last line when interpolating, and the span
 *     used when a line's nominal span is not positive
 * @param minGapDuration smallest gap distributed across unmatched words
 * @param minPushedLineDuration smallest duration a line keeps after being pushed forward
 * @param autoJunk whether the diff matcher ignores very frequent tokens when seeding matches
 */
@ConfigurationProperties(prefix = "lyricsync.alignment")
@Validated
public record AlignmentProperties(
    @Positive Double minLineDuration,
    @PositiveOrZero Double globalOffsetThreshold,
    @PositiveOrZero Double windowMargin,
    @Positive Integer minTokenLength,
    @Positive Double defaultLineGap,
    @Positive Double fallbackLineDuration,
    @PositiveOrZero Double minGapDuration,
    @PositiveOrZero Double minPushedLineDuration,
    Boolean autoJunk) {

  // Provide defaults
  public AlignmentProperties {
    if (minLineDuration == null) {
      minLineDuration = 1.2;
    }
    if (globalOffsetThreshold == null) {
      globalOffsetThreshold = 2.0;
    }
    if (windowMargin == null) {
      windowMargin = 1.0;
    }
    if (minTokenLength == null) {
      minTokenLength = 3;
    }
    if (defaultLineGap == null) {
      defaultLineGap = 5.0;
    }
    if (fallbackLineDuration == null) {
      fallbackLineDuration = 3.0;
    }
    if (minGapDuration == null) {
      minGapDuration = 0.5;
    }
    if (minPushedLineDuration == null) {
      minPushedLineDuration = 0.5;
    }
    if (autoJunk == null) {
      autoJunk = true;
    }
  }

  public static AlignmentProperties defaults() {
    return new AlignmentProperties(null, null, null, null, null, null, null, null, null);
  }
}
