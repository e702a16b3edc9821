package com.scholary.lyricsync.align;

import com.scholary.lyricsync.lyrics.ReferenceLine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A reference line being timed against the recognizer output.
 *
 * <p>Keeps the reference text untouched and owns its words. The nominal span is the
 * (drift-corrected) reference timing used as a fallback when recognizer matches are missing; the
 * start/end pair is the final timing handed to the renderer.
 */
public class AlignedLine {

  private final String text;
  private final double nominalStart;
  private final double nominalEnd;
  private final List<AlignedWord> words;
  private double start;
  private double end;
  private LineState state = LineState.UNALIGNED;

  AlignedLine(String text, double nominalStart, double nominalEnd) {
    this.text = text;
    this.nominalStart = nominalStart;
    this.nominalEnd = nominalEnd;
    List<AlignedWord> created = new ArrayList<>();
    for (String word : TokenNormalizer.splitWords(text)) {
      created.add(new AlignedWord(word));
    }
    this.words = Collections.unmodifiableList(created);
    this.start = nominalStart;
    this.end = nominalEnd;
  }

  /**
   * Create an unaligned line for {@code lines.get(index)}.
   *
   * <p>The nominal end is the next line's start, or {@code start + lastLineDuration} for the last
   * line.
   */
  static AlignedLine fromReference(List<ReferenceLine> lines, int index, double lastLineDuration) {
    ReferenceLine line = lines.get(index);
    double nominalEnd =
        index + 1 < lines.size() ? lines.get(index + 1).start() : line.start() + lastLineDuration;
    return new AlignedLine(line.text(), line.start(), nominalEnd);
  }

  public String getText() {
    return text;
  }

  public double getStart() {
    return start;
  }

  public double getEnd() {
    return end;
  }

  public List<AlignedWord> getWords() {
    return words;
  }

  public LineState getState() {
    return state;
  }

  public double duration() {
    return end - start;
  }

  public long matchedWordCount() {
    return words.stream().filter(AlignedWord::isMatched).count();
  }

  double getNominalStart() {
    return nominalStart;
  }

  double getNominalEnd() {
    return nominalEnd;
  }

  void setStart(double start) {
    this.start = start;
  }

  void setEnd(double end) {
    this.end = end;
  }

  /**
   * Move the end later until the line lasts at least {@code minDuration}.
   *
   * <p>{@code start + minDuration} can round below the target, so the end is stepped up one ulp at
   * a time until {@code end - start >= minDuration} holds exactly.
   */
  void extendToAtLeast(double minDuration) {
    if (end - start >= minDuration) {
      return;
    }
    end = start + minDuration;
    while (end - start < minDuration) {
      end = Math.nextUp(end);
    }
  }

  /** Take the line span from the first and last word, or the nominal span if there are none. */
  void spanWords() {
    if (words.isEmpty()) {
      start = nominalStart;
      end = nominalEnd;
      return;
    }
    start = words.get(0).getStart();
    end = words.get(words.size() - 1).getEnd();
  }

  /** Pull every word inside {@code [start, end]}. */
  void clampWords() {
    for (AlignedWord word : words) {
      word.setStart(Math.min(Math.max(word.getStart(), start), end));
      word.setEnd(Math.min(Math.max(word.getEnd(), start), end));
    }
  }

  void advanceTo(LineState next) {
    if (next.compareTo(state) < 0) {
      throw new IllegalStateException(
          "Line '" + text + "' cannot move from " + state + " back to " + next);
    }
    state = next;
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "AlignedLine[%.2f-%.2f, %s, '%s']", start, end, state, text);
  }
}
