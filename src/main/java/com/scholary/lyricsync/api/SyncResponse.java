package com.scholary.lyricsync.api;

import com.scholary.lyricsync.align.AlignedLine;
import com.scholary.lyricsync.align.AlignedWord;
import com.scholary.lyricsync.service.SyncDiagnostics;
import com.scholary.lyricsync.service.SyncResult;
import java.util.List;

/**
 * Response for a completed synchronization.
 *
 * <p>Contains the render-ready timeline and what had to be approximated to build it.
 */
public record SyncResponse(List<Line> lines, SyncDiagnostics diagnostics) {

  public record Line(String text, double start, double end, List<Word> words) {}

  public record Word(String text, double start, double end, boolean interpolated) {}

  public static SyncResponse from(SyncResult result) {
    return new SyncResponse(
        result.lines().stream().map(SyncResponse::toLine).toList(), result.diagnostics());
  }

  private static Line toLine(AlignedLine line) {
    return new Line(
        line.getText(),
        line.getStart(),
        line.getEnd(),
        line.getWords().stream().map(SyncResponse::toWord).toList());
  }

  private static Word toWord(AlignedWord word) {
    return new Word(word.getText(), word.getStart(), word.getEnd(), word.isInterpolated());
  }
}
