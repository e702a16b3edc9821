package com.scholary.lyricsync.logging;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log synchronization events with structured fields that can be queried in
 * a log index.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log global offset detection. */
  public void logOffsetDetected(
      double offset,
      int matchLength,
      double referenceTime,
      double recognizedTime,
      boolean applied) {
    try {
      MDC.put("event_type", "offset_detected");
      MDC.put("offset", String.valueOf(offset));
      MDC.put("matchLength", String.valueOf(matchLength));
      MDC.put("applied", String.valueOf(applied));

      logger.info(
          "Global offset detected: offset={}s, anchor=[reference={}s, audio={}s], block={} words,"
              + " applied={}",
          String.format(Locale.ROOT, "%.2f", offset),
          String.format(Locale.ROOT, "%.2f", referenceTime),
          String.format(Locale.ROOT, "%.2f", recognizedTime),
          matchLength,
          applied);
    } finally {
      clearEventFields();
    }
  }

  /** Log the result of aligning one line inside its window. */
  public void logLineAligned(
      int lineIndex,
      double windowStart,
      double windowEnd,
      int candidates,
      int matchedWords,
      int totalWords) {
    try {
      MDC.put("event_type", "line_aligned");
      MDC.put("line_index", String.valueOf(lineIndex));
      MDC.put("windowStart", String.valueOf(windowStart));
      MDC.put("windowEnd", String.valueOf(windowEnd));
      MDC.put("candidates", String.valueOf(candidates));
      MDC.put("matchedWords", String.valueOf(matchedWords));

      logger.debug(
          "Line aligned: index={}, window=[{}-{}], candidates={}, matched={}/{}",
          lineIndex,
          windowStart,
          windowEnd,
          candidates,
          matchedWords,
          totalWords);
    } finally {
      clearEventFields();
    }
  }

  /** Log a recovered degradation for one line (degenerate window, even distribution). */
  public void logLineFallback(int lineIndex, String reason, String message) {
    try {
      MDC.put("event_type", "line_fallback");
      MDC.put("line_index", String.valueOf(lineIndex));
      MDC.put("reason", reason);

      logger.warn("Line fallback: index={}, reason={}, {}", lineIndex, reason, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a line being pushed later to clear an overlap. */
  public void logLinePushed(int lineIndex, double fromStart, double toStart) {
    try {
      MDC.put("event_type", "line_pushed");
      MDC.put("line_index", String.valueOf(lineIndex));
      MDC.put("fromStart", String.valueOf(fromStart));
      MDC.put("toStart", String.valueOf(toStart));

      logger.debug(
          "Line pushed: index={}, start {}s -> {}s (+{}s)",
          lineIndex,
          String.format(Locale.ROOT, "%.3f", fromStart),
          String.format(Locale.ROOT, "%.3f", toStart),
          String.format(Locale.ROOT, "%.3f", toStart - fromStart));
    } finally {
      clearEventFields();
    }
  }

  /** Log the end of a synchronization run. */
  public void logSyncCompleted(
      int lines,
      int matchedWords,
      int totalWords,
      int fallbackLines,
      int pushedLines,
      long elapsedMs) {
    try {
      MDC.put("event_type", "sync_completed");
      MDC.put("lines", String.valueOf(lines));
      MDC.put("matchedWords", String.valueOf(matchedWords));
      MDC.put("totalWords", String.valueOf(totalWords));
      MDC.put("fallbackLines", String.valueOf(fallbackLines));
      MDC.put("pushedLines", String.valueOf(pushedLines));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Sync completed: lines={}, matched={}/{} words, fallbackLines={}, pushedLines={},"
              + " elapsed={}ms",
          lines,
          matchedWords,
          totalWords,
          fallbackLines,
          pushedLines,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId) {
    MDC.put("runId", runId);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove("runId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("offset");
    MDC.remove("matchLength");
    MDC.remove("applied");
    MDC.remove("line_index");
    MDC.remove("windowStart");
    MDC.remove("windowEnd");
    MDC.remove("candidates");
    MDC.remove("matchedWords");
    MDC.remove("reason");
    MDC.remove("fromStart");
    MDC.remove("toStart");
    MDC.remove("lines");
    MDC.remove("totalWords");
    MDC.remove("fallbackLines");
    MDC.remove("pushedLines");
    MDC.remove("elapsedMs");
  }
}
