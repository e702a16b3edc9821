package com.scholary.lyricsync.service;

import com.scholary.lyricsync.align.AlignedLine;
import com.scholary.lyricsync.align.AlignedWord;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Writes synchronized timelines in caption formats.
 *
 * <p>Supports SRT (one cue per line) and enhanced LRC (line timestamps plus per-word start tags,
 * the format karaoke players read for word-by-word highlighting).
 */
@Component
public class TimelineWriter {

  /**
   * Write timeline as SRT (SubRip subtitle format).
   *
   * <p>Format:
   *
   * <pre>
   * 1
   * 00:00:00,100 --> 00:00:01,300
   * Hello world
   *
   * 2
   * 00:00:05,200 --> 00:00:06,400
   * Goodbye now
   * </pre>
   */
  public byte[] writeSrt(List<AlignedLine> lines) {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < lines.size(); i++) {
      AlignedLine line = lines.get(i);

      // Sequence number
      srt.append(i + 1).append("\n");

      // Timecodes
      srt.append(formatSrtTime(line.getStart()))
          .append(" --> ")
          .append(formatSrtTime(line.getEnd()))
          .append("\n");

      // Text
      srt.append(line.getText()).append("\n");

      // Blank line between entries
      srt.append("\n");
    }

    return srt.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Write timeline as enhanced LRC.
   *
   * <p>Format:
   *
   * <pre>
   * [00:00.10]&lt;00:00.10&gt;Hello &lt;00:00.40&gt;world
   * [00:05.20]&lt;00:05.20&gt;Goodbye &lt;00:05.60&gt;now
   * </pre>
   *
   * <p>Lines without words carry only the line timestamp and text.
   */
  public byte[] writeEnhancedLrc(List<AlignedLine> lines) {
    StringBuilder lrc = new StringBuilder();

    for (AlignedLine line : lines) {
      lrc.append('[').append(formatLrcTime(line.getStart())).append(']');

      if (line.getWords().isEmpty()) {
        lrc.append(line.getText());
      } else {
        List<AlignedWord> words = line.getWords();
        for (int k = 0; k < words.size(); k++) {
          if (k > 0) {
            lrc.append(' ');
          }
          lrc.append('<')
              .append(formatLrcTime(words.get(k).getStart()))
              .append('>')
              .append(words.get(k).getText());
        }
      }
      lrc.append("\n");
    }

    return lrc.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Format a time in seconds as SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds)
   */
  private String formatSrtTime(double seconds) {
    long totalMillis = Math.round(Math.max(0.0, seconds) * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis / 60_000) % 60;
    long secs = (totalMillis / 1000) % 60;
    long millis = totalMillis % 1000;

    return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }

  /**
   * Format a time in seconds as LRC timestamp.
   *
   * <p>Format: MM:SS.xx (minutes:seconds.hundredths), minutes not wrapped at the hour
   */
  private String formatLrcTime(double seconds) {
    long totalCentis = Math.round(Math.max(0.0, seconds) * 100);
    long minutes = totalCentis / 6000;
    long secs = (totalCentis / 100) % 60;
    long centis = totalCentis % 100;

    return String.format(Locale.ROOT, "%02d:%02d.%02d", minutes, secs, centis);
  }
}
