package com.scholary.lyricsync.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.lyricsync.align.AlignedLine;
import com.scholary.lyricsync.align.GapInterpolator;
import com.scholary.lyricsync.align.GlobalOffsetEstimator;
import com.scholary.lyricsync.align.LineWindowAligner;
import com.scholary.lyricsync.align.OverlapResolver;
import com.scholary.lyricsync.asr.RecognizedWord;
import com.scholary.lyricsync.asr.TranscriptFlattener;
import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.lyrics.LrcParser;
import com.scholary.lyricsync.lyrics.ReferenceLine;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimelineWriterTest {

  private TimelineWriter writer;
  private LyricSyncService syncService;

  @BeforeEach
  void setUp() {
    writer = new TimelineWriter();
    AlignmentProperties properties = AlignmentProperties.defaults();
    syncService =
        new LyricSyncService(
            new GlobalOffsetEstimator(properties),
            new LineWindowAligner(properties),
            new GapInterpolator(properties),
            new OverlapResolver(properties),
            new LrcParser(),
            new TranscriptFlattener());
  }

  @Test
  void writeSrt_shouldProduceValidSrtFormat() {
    String srt = new String(writer.writeSrt(helloGoodbye()), StandardCharsets.UTF_8);

    assertThat(srt)
        .isEqualTo(
            "1\n"
                + "00:00:00,100 --> 00:00:01,300\n"
                + "hello world\n"
                + "\n"
                + "2\n"
                + "00:00:05,200 --> 00:00:06,400\n"
                + "goodbye now\n"
                + "\n");
  }

  @Test
  void writeSrt_shouldFormatHoursCorrectly() {
    List<AlignedLine> lines =
        syncService.synchronize(List.of(new ReferenceLine("Test", 3661.5)), List.of()).lines();

    String srt = new String(writer.writeSrt(lines), StandardCharsets.UTF_8);

    // 3661.5 seconds = 1 hour, 1 minute, 1.5 seconds; last line spans 3 seconds
    assertThat(srt).contains("01:01:01,500 --> 01:01:04,500");
  }

  @Test
  void writeSrt_shouldHandleEmptyTimeline() {
    assertThat(writer.writeSrt(List.of())).isEmpty();
  }

  @Test
  void writeEnhancedLrc_tagsEveryWordStart() {
    String lrc = new String(writer.writeEnhancedLrc(helloGoodbye()), StandardCharsets.UTF_8);

    assertThat(lrc)
        .isEqualTo(
            "[00:00.10]<00:00.10>hello <00:00.40>world\n"
                + "[00:05.20]<00:05.20>goodbye <00:05.60>now\n");
  }

  @Test
  void timecodesUseAsciiDigitsWhateverTheDefaultLocale() {
    Locale original = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
    try {
      String srt = new String(writer.writeSrt(helloGoodbye()), StandardCharsets.UTF_8);
      String lrc = new String(writer.writeEnhancedLrc(helloGoodbye()), StandardCharsets.UTF_8);

      assertThat(srt).contains("00:00:00,100 --> 00:00:01,300\n");
      assertThat(lrc).startsWith("[00:00.10]<00:00.10>hello <00:00.40>world\n");
    } finally {
      Locale.setDefault(original);
    }
  }

  @Test
  void writeEnhancedLrc_minutesDoNotWrapAtTheHour() {
    List<AlignedLine> lines =
        syncService.synchronize(List.of(new ReferenceLine("Late", 3661.5)), List.of()).lines();

    String lrc = new String(writer.writeEnhancedLrc(lines), StandardCharsets.UTF_8);

    assertThat(lrc).isEqualTo("[61:01.50]<61:01.50>Late\n");
  }

  @Test
  void writeEnhancedLrc_lineWithoutWordsKeepsText() {
    List<AlignedLine> lines =
        syncService.synchronize(List.of(new ReferenceLine("   ", 2.0)), List.of()).lines();

    String lrc = new String(writer.writeEnhancedLrc(lines), StandardCharsets.UTF_8);

    assertThat(lrc).isEqualTo("[00:02.00]   \n");
  }

  private List<AlignedLine> helloGoodbye() {
    return syncService
        .synchronize(
            List.of(new ReferenceLine("hello world", 0.0), new ReferenceLine("goodbye now", 5.0)),
            List.of(
                new RecognizedWord("hello", 0.1, 0.4),
                new RecognizedWord("world", 0.4, 0.9),
                new RecognizedWord("goodbye", 5.2, 5.6),
                new RecognizedWord("now", 5.6, 6.0)))
        .lines();
  }
}
