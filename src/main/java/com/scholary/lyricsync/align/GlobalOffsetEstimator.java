package com.scholary.lyricsync.align;

import com.scholary.lyricsync.align.SequenceMatcher.Match;
import com.scholary.lyricsync.asr.RecognizedWord;
import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.logging.StructuredLogger;
import com.scholary.lyricsync.lyrics.ReferenceLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Estimates a single time shift between the lyric timeline and the recognizer timeline.
 *
 * <p>Recognizers trim leading silence and lyric providers time against different releases, so the
 * whole lyric timeline is often off by a constant amount. We find the longest run of words both
 * sources agree on and compare where each places its first word. Short words ("a", "to", "oh")
 * are dropped first since they match almost anywhere.
 *
 * <p>Each reference word is timed with its line's start, so the estimate is only as precise as
 * the lyric line timing. That is enough to pull every line into its search window.
 */
@Component
public class GlobalOffsetEstimator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalOffsetEstimator.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final AlignmentProperties properties;

  public GlobalOffsetEstimator(AlignmentProperties properties) {
    this.properties = properties;
  }

  /**
   * Result of comparing the two timelines.
   *
   * @param offset recognizer time minus reference time at the anchor, 0 if nothing matched
   * @param matchLength number of tokens in the anchoring block
   * @param referenceTime reference time at the start of the block
   * @param recognizedTime recognizer time at the start of the block
   */
  public record OffsetEstimate(
      double offset, int matchLength, double referenceTime, double recognizedTime) {

    public static OffsetEstimate none() {
      return new OffsetEstimate(0.0, 0, 0.0, 0.0);
    }

    public boolean hasMatch() {
      return matchLength > 0;
    }
  }

  private record TimedToken(String token, double time) {}

  /**
   * Find the global offset between reference lines and recognized words.
   *
   * @return the estimate; {@link OffsetEstimate#none()} when either side has no usable tokens or
   *     they share none
   */
  public OffsetEstimate estimate(List<ReferenceLine> lines, List<RecognizedWord> words) {
    List<TimedToken> referenceTokens = new ArrayList<>();
    for (ReferenceLine line : lines) {
      for (String word : TokenNormalizer.splitWords(line.text())) {
        addIfLongEnough(referenceTokens, word, line.start());
      }
    }

    List<TimedToken> recognizedTokens = new ArrayList<>();
    for (RecognizedWord word : words) {
      addIfLongEnough(recognizedTokens, word.text(), word.start());
    }

    if (referenceTokens.isEmpty() || recognizedTokens.isEmpty()) {
      LOGGER.info(
          "Skipping offset estimation: {} reference tokens, {} recognized tokens",
          referenceTokens.size(),
          recognizedTokens.size());
      return OffsetEstimate.none();
    }

    SequenceMatcher<String> matcher =
        new SequenceMatcher<>(
            referenceTokens.stream().map(TimedToken::token).toList(),
            recognizedTokens.stream().map(TimedToken::token).toList(),
            properties.autoJunk());
    Match match = matcher.findLongestMatch();

    if (!match.hasMatch()) {
      LOGGER.info("No common words between lyrics and transcription, offset is 0");
      return OffsetEstimate.none();
    }

    double referenceTime = referenceTokens.get(match.a()).time();
    double recognizedTime = recognizedTokens.get(match.b()).time();
    OffsetEstimate estimate =
        new OffsetEstimate(
            recognizedTime - referenceTime, match.size(), referenceTime, recognizedTime);

    STRUCTURED.logOffsetDetected(
        estimate.offset(), match.size(), referenceTime, recognizedTime, shouldApply(estimate));
    return estimate;
  }

  /** Whether the estimate is large enough to be worth correcting. */
  public boolean shouldApply(OffsetEstimate estimate) {
    return Math.abs(estimate.offset()) > properties.globalOffsetThreshold();
  }

  /**
   * Shift every reference line by the estimated offset if it exceeds the threshold.
   *
   * @return shifted copies, or {@code lines} itself when no correction applies
   */
  public List<ReferenceLine> apply(List<ReferenceLine> lines, OffsetEstimate estimate) {
    if (!shouldApply(estimate)) {
      return lines;
    }
    LOGGER.info(
        "Applying global offset of {}s to {} lyric lines",
        String.format(Locale.ROOT, "%.2f", estimate.offset()),
        lines.size());
    return lines.stream().map(line -> line.shift(estimate.offset())).toList();
  }

  private void addIfLongEnough(List<TimedToken> tokens, String word, double time) {
    String token = TokenNormalizer.normalize(word);
    if (token.length() >= properties.minTokenLength()) {
      tokens.add(new TimedToken(token, time));
    }
  }
}
