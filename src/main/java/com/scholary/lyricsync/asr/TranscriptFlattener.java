package com.scholary.lyricsync.asr;

import com.scholary.lyricsync.align.TokenNormalizer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flattens recognizer segments into an ordered list of timed words.
 *
 * <p>Segments that carry word-level timestamps contribute those words directly. Segments without
 * them are split on whitespace and their span is divided evenly across the words, so the
 * synchronizer can always assume word-level timing.
 */
@Component
public class TranscriptFlattener {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptFlattener.class);

  public List<RecognizedWord> flatten(List<AsrSegment> segments) {
    if (segments == null || segments.isEmpty()) {
      return List.of();
    }

    List<RecognizedWord> words = new ArrayList<>();
    int synthesizedSegments = 0;

    for (AsrSegment segment : segments) {
      if (!segment.words().isEmpty()) {
        for (AsrWord word : segment.words()) {
          words.add(new RecognizedWord(word.word(), word.start(), word.end()));
        }
        continue;
      }

      List<String> parts = TokenNormalizer.splitWords(segment.text());
      if (parts.isEmpty()) {
        continue;
      }

      double wordDuration = (segment.end() - segment.start()) / parts.size();
      for (int i = 0; i < parts.size(); i++) {
        words.add(
            new RecognizedWord(
                parts.get(i),
                segment.start() + i * wordDuration,
                segment.start() + (i + 1) * wordDuration));
      }
      synthesizedSegments++;
    }

    LOGGER.debug(
        "Flattened {} segments into {} words ({} segments split evenly)",
        segments.size(),
        words.size(),
        synthesizedSegments);
    return words;
  }
}
