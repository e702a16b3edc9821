package com.scholary.lyricsync.align;

import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.logging.StructuredLogger;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Times the reference words that window alignment could not match.
 *
 * <p>Recognizers drop words on quiet or layered vocals. Words between two matched anchors are
 * spread evenly over the gap between them; words before the first anchor start from the line's
 * nominal start, words after the last anchor run up to its nominal end. A line with no anchor at
 * all is spread evenly over its nominal span.
 */
@Component
public class GapInterpolator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GapInterpolator.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final AlignmentProperties properties;

  public GapInterpolator(AlignmentProperties properties) {
    this.properties = properties;
  }

  /**
   * Fill in timing for unmatched words and set each line's span from its words.
   *
   * @param lines lines in state {@link LineState#PARTIALLY_ALIGNED}
   * @return number of lines that had no anchor and were distributed evenly
   */
  public int interpolate(List<AlignedLine> lines) {
    int fallbackLines = 0;

    for (int i = 0; i < lines.size(); i++) {
      AlignedLine line = lines.get(i);
      List<AlignedWord> words = line.getWords();

      if (!words.isEmpty()) {
        if (line.matchedWordCount() == 0) {
          STRUCTURED.logLineFallback(
              i,
              "no_match",
              String.format(
                  Locale.ROOT,
                  "distributing %d words over nominal span [%.2f-%.2f]",
                  words.size(), line.getNominalStart(), line.getNominalEnd()));
          distributeEvenly(line);
          fallbackLines++;
        } else {
          fillGaps(line);
        }
      }

      line.spanWords();
      line.advanceTo(LineState.FULLY_TIMED);
    }

    LOGGER.debug(
        "Interpolated {} lines, {} fell back to even distribution", lines.size(), fallbackLines);
    return fallbackLines;
  }

  private void distributeEvenly(AlignedLine line) {
    List<AlignedWord> words = line.getWords();
    double span = line.getNominalEnd() - line.getNominalStart();
    if (span <= 0) {
      span = properties.fallbackLineDuration();
    }
    double wordDuration = span / words.size();
    for (int k = 0; k < words.size(); k++) {
      words
          .get(k)
          .setTiming(
              line.getNominalStart() + k * wordDuration,
              line.getNominalStart() + (k + 1) * wordDuration);
      words.get(k).markInterpolated();
    }
  }

  private void fillGaps(AlignedLine line) {
    List<AlignedWord> words = line.getWords();
    double lastEnd = line.getNominalStart();

    int k = 0;
    while (k < words.size()) {
      if (words.get(k).isMatched()) {
        lastEnd = words.get(k).getEnd();
        k++;
        continue;
      }

      int next = k;
      while (next < words.size() && !words.get(next).isMatched()) {
        next++;
      }

      double gapStart = lastEnd;
      double gapEnd = next < words.size() ? words.get(next).getStart() : line.getNominalEnd();
      gapEnd = Math.max(gapEnd, gapStart + properties.minGapDuration());
      double wordDuration = (gapEnd - gapStart) / (next - k);

      for (int m = k; m < next; m++) {
        words
            .get(m)
            .setTiming(gapStart + (m - k) * wordDuration, gapStart + (m - k + 1) * wordDuration);
        words.get(m).markInterpolated();
      }
      lastEnd = words.get(next - 1).getEnd();
      k = next;
    }
  }
}
