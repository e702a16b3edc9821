package com.scholary.lyricsync.service;

import com.scholary.lyricsync.align.AlignedLine;
import com.scholary.lyricsync.align.GapInterpolator;
import com.scholary.lyricsync.align.GlobalOffsetEstimator;
import com.scholary.lyricsync.align.GlobalOffsetEstimator.OffsetEstimate;
import com.scholary.lyricsync.align.LineWindowAligner;
import com.scholary.lyricsync.align.LineWindowAligner.WindowAlignment;
import com.scholary.lyricsync.align.OverlapResolver;
import com.scholary.lyricsync.asr.AsrSegment;
import com.scholary.lyricsync.asr.RecognizedWord;
import com.scholary.lyricsync.asr.TranscriptFlattener;
import com.scholary.lyricsync.logging.StructuredLogger;
import com.scholary.lyricsync.lyrics.LrcParser;
import com.scholary.lyricsync.lyrics.ReferenceLine;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconciles reference lyrics with recognizer timing into a render-ready timeline.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>Estimate and correct global drift of the lyric timeline
 *   <li>Match each line's words against recognized words in its time window
 *   <li>Interpolate timing for words without a match
 *   <li>Enforce minimum line duration and remove overlaps
 * </ol>
 *
 * <p>Every run works on its own lines and words and never fails on bad data: approximate captions
 * beat no captions. Runs are independent, so separate songs can be synchronized concurrently.
 */
@Service
public class LyricSyncService {

  private static final Logger LOGGER = LoggerFactory.getLogger(LyricSyncService.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final GlobalOffsetEstimator offsetEstimator;
  private final LineWindowAligner windowAligner;
  private final GapInterpolator gapInterpolator;
  private final OverlapResolver overlapResolver;
  private final LrcParser lrcParser;
  private final TranscriptFlattener transcriptFlattener;

  public LyricSyncService(
      GlobalOffsetEstimator offsetEstimator,
      LineWindowAligner windowAligner,
      GapInterpolator gapInterpolator,
      OverlapResolver overlapResolver,
      LrcParser lrcParser,
      TranscriptFlattener transcriptFlattener) {
    this.offsetEstimator = offsetEstimator;
    this.windowAligner = windowAligner;
    this.gapInterpolator = gapInterpolator;
    this.overlapResolver = overlapResolver;
    this.lrcParser = lrcParser;
    this.transcriptFlattener = transcriptFlattener;
  }

  /**
   * Synchronize LRC lyrics with recognizer segments.
   *
   * @param lrc line-timed lyrics
   * @param segments recognizer output, with or without word timestamps
   */
  public SyncResult synchronize(String lrc, List<AsrSegment> segments) {
    return synchronize(lrcParser.parse(lrc), transcriptFlattener.flatten(segments));
  }

  /**
   * Synchronize parsed reference lines with recognizer segments.
   *
   * @param referenceLines lyric lines ordered by start
   * @param segments recognizer output, with or without word timestamps
   */
  public SyncResult synchronizeSegments(
      List<ReferenceLine> referenceLines, List<AsrSegment> segments) {
    return synchronize(referenceLines, transcriptFlattener.flatten(segments));
  }

  /**
   * Synchronize reference lines with recognized words.
   *
   * @param referenceLines lyric lines ordered by start; not modified
   * @param recognizedWords recognizer words ordered by start
   * @return one finalized line per reference line, in the same order
   */
  public SyncResult synchronize(
      List<ReferenceLine> referenceLines, List<RecognizedWord> recognizedWords) {
    List<ReferenceLine> lines = referenceLines == null ? List.of() : referenceLines;
    List<RecognizedWord> words = recognizedWords == null ? List.of() : recognizedWords;

    StructuredLogger.setRunContext(UUID.randomUUID().toString());
    long startedAt = System.nanoTime();
    try {
      LOGGER.info(
          "Starting lyric sync: {} reference lines, {} recognized words",
          lines.size(),
          words.size());
      if (words.isEmpty()) {
        LOGGER.warn("No recognized words, every line will be timed from the lyrics alone");
      }

      OffsetEstimate offset = offsetEstimator.estimate(lines, words);
      List<ReferenceLine> corrected = offsetEstimator.apply(lines, offset);

      WindowAlignment alignment = windowAligner.align(corrected, words);
      List<AlignedLine> aligned = alignment.lines();
      int matchedWords = 0;
      int totalWords = 0;
      for (AlignedLine line : aligned) {
        matchedWords += (int) line.matchedWordCount();
        totalWords += line.getWords().size();
      }

      int fallbackLines = gapInterpolator.interpolate(aligned);
      int pushedLines = overlapResolver.resolve(aligned);

      SyncDiagnostics diagnostics =
          new SyncDiagnostics(
              offset.offset(),
              offsetEstimator.shouldApply(offset),
              matchedWords,
              totalWords,
              fallbackLines,
              alignment.degenerateWindows(),
              pushedLines);

      long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
      STRUCTURED.logSyncCompleted(
          aligned.size(), matchedWords, totalWords, fallbackLines, pushedLines, elapsedMs);
      return new SyncResult(List.copyOf(aligned), diagnostics);
    } finally {
      StructuredLogger.clearRunContext();
    }
  }
}
