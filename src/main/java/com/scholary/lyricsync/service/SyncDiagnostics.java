package com.scholary.lyricsync.service;

/**
 * What a synchronization run had to correct or approximate.
 *
 * @param globalOffset detected shift between lyric and recognizer timelines, in seconds
 * @param offsetApplied whether the shift exceeded the threshold and was applied
 * @param matchedWords reference words matched directly to a recognized word
 * @param totalWords reference words overall
 * @param fallbackLines lines with no match, timed by even distribution
 * @param degenerateWindows search windows that had to be widened
 * @param pushedLines lines moved later to remove an overlap
 */
public record SyncDiagnostics(
    double globalOffset,
    boolean offsetApplied,
    int matchedWords,
    int totalWords,
    int fallbackLines,
    int degenerateWindows,
    int pushedLines) {

  public double matchRatio() {
    return totalWords == 0 ? 0.0 : (double) matchedWords / totalWords;
  }
}
