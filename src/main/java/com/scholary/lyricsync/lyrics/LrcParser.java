package com.scholary.lyricsync.lyrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses line-timed LRC lyrics into reference lines.
 *
 * <p>Only {@code [mm:ss.xx]text} lines are kept. Metadata tags ({@code [ar:...]}, {@code
 * [ti:...]}), untimed lines and lines with blank text are skipped. The result is ordered by start
 * time; lines sharing a timestamp keep their order of appearance.
 */
@Component
public class LrcParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(LrcParser.class);
  private static final Pattern LINE_PATTERN = Pattern.compile("\\[(\\d+):(\\d+\\.?\\d*)\\](.*)");

  public List<ReferenceLine> parse(String lrc) {
    List<ReferenceLine> lines = new ArrayList<>();
    if (lrc == null || lrc.isBlank()) {
      return lines;
    }

    int skipped = 0;
    for (String raw : lrc.split("\\r?\\n")) {
      Matcher matcher = LINE_PATTERN.matcher(raw.trim());
      if (!matcher.matches()) {
        skipped++;
        continue;
      }

      String text = matcher.group(3).trim();
      if (text.isEmpty()) {
        skipped++;
        continue;
      }

      try {
        double start =
            Integer.parseInt(matcher.group(1)) * 60 + Double.parseDouble(matcher.group(2));
        lines.add(new ReferenceLine(text, start));
      } catch (NumberFormatException e) {
        LOGGER.debug("Skipping line with unreadable timestamp: '{}'", raw);
        skipped++;
      }
    }

    lines.sort(Comparator.comparingDouble(ReferenceLine::start));
    LOGGER.debug("Parsed {} timed lyric lines ({} lines skipped)", lines.size(), skipped);
    return lines;
  }
}
