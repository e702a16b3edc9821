package com.scholary.lyricsync.align;

import com.scholary.lyricsync.align.SequenceMatcher.Opcode;
import com.scholary.lyricsync.align.SequenceMatcher.Tag;
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
 * Assigns recognizer timestamps to reference words, one line at a time.
 *
 * <p>Each line may only match recognizer words that fall inside a window around its own reference
 * timing: from shortly before its start to shortly after the next line's start. Matching across
 * the whole song would let a chorus line grab the same words from a later repetition. Inside the
 * window the line's tokens are diffed against the candidates' tokens and every EQUAL run copies
 * timing onto the reference words. Words left unmatched keep zero timing for {@link
 * GapInterpolator}.
 */
@Component
public class LineWindowAligner {

  private static final Logger LOGGER = LoggerFactory.getLogger(LineWindowAligner.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final AlignmentProperties properties;

  public LineWindowAligner(AlignmentProperties properties) {
    this.properties = properties;
  }

  /**
   * Lines produced by window alignment.
   *
   * @param lines one aligned line per reference line, in the same order
   * @param degenerateWindows number of windows that had to be widened
   */
  public record WindowAlignment(List<AlignedLine> lines, int degenerateWindows) {}

  /**
   * Align every reference line against the recognized words in its window.
   *
   * @param lines drift-corrected reference lines, ordered by start
   * @param words recognized words, ordered by start
   * @return lines in state {@link LineState#PARTIALLY_ALIGNED}
   */
  public WindowAlignment align(List<ReferenceLine> lines, List<RecognizedWord> words) {
    List<AlignedLine> aligned = new ArrayList<>(lines.size());
    int degenerateWindows = 0;

    for (int i = 0; i < lines.size(); i++) {
      AlignedLine line =
          AlignedLine.fromReference(lines, i, properties.fallbackLineDuration());

      double windowStart = Math.max(0.0, lines.get(i).start() - properties.windowMargin());
      double windowEnd = nextLineStart(lines, i) + properties.windowMargin();
      if (!(windowEnd > windowStart)) {
        STRUCTURED.logLineFallback(
            i,
            "degenerate_window",
            String.format(
                Locale.ROOT,
                "window end %.2fs is not after start %.2fs, widening by %.2fs",
                windowEnd, windowStart, properties.defaultLineGap()));
        windowEnd = windowStart + properties.defaultLineGap();
        degenerateWindows++;
      }
      TimeRange window = new TimeRange(windowStart, windowEnd);

      List<RecognizedWord> candidates = candidatesIn(window, words);
      int matched = matchWords(line, candidates);
      line.advanceTo(LineState.PARTIALLY_ALIGNED);

      STRUCTURED.logLineAligned(
          i, window.start(), window.end(), candidates.size(), matched, line.getWords().size());
      aligned.add(line);
    }

    return new WindowAlignment(aligned, degenerateWindows);
  }

  private double nextLineStart(List<ReferenceLine> lines, int index) {
    return index + 1 < lines.size()
        ? lines.get(index + 1).start()
        : lines.get(index).start() + properties.defaultLineGap();
  }

  /** Recognized words overlapping the window, in recognizer order. */
  static List<RecognizedWord> candidatesIn(TimeRange window, List<RecognizedWord> words) {
    List<RecognizedWord> candidates = new ArrayList<>();
    for (RecognizedWord word : words) {
      if (window.overlaps(word.start(), word.end())) {
        candidates.add(word);
      }
    }
    return candidates;
  }

  /**
   * Copy timing from candidates onto the line's words for every EQUAL run.
   *
   * @return number of words matched
   */
  int matchWords(AlignedLine line, List<RecognizedWord> candidates) {
    List<AlignedWord> lineWords = line.getWords();
    if (candidates.isEmpty() || lineWords.isEmpty()) {
      return 0;
    }

    List<String> lineTokens = lineWords.stream().map(AlignedWord::getToken).toList();
    List<String> candidateTokens =
        candidates.stream().map(word -> TokenNormalizer.normalize(word.text())).toList();

    SequenceMatcher<String> matcher =
        new SequenceMatcher<>(lineTokens, candidateTokens, properties.autoJunk());
    int matched = 0;
    for (Opcode opcode : matcher.getOpcodes()) {
      if (opcode.tag() != Tag.EQUAL) {
        continue;
      }
      int count = Math.min(opcode.a2() - opcode.a1(), opcode.b2() - opcode.b1());
      for (int k = 0; k < count; k++) {
        AlignedWord word = lineWords.get(opcode.a1() + k);
        RecognizedWord source = candidates.get(opcode.b1() + k);
        word.setTiming(source.start(), source.end());
        word.markMatched();
        matched++;
      }
    }
    return matched;
  }
}
