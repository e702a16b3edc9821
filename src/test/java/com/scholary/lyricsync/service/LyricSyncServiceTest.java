package com.scholary.lyricsync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.lyricsync.align.AlignedLine;
import com.scholary.lyricsync.align.AlignedWord;
import com.scholary.lyricsync.align.GapInterpolator;
import com.scholary.lyricsync.align.GlobalOffsetEstimator;
import com.scholary.lyricsync.align.LineState;
import com.scholary.lyricsync.align.LineWindowAligner;
import com.scholary.lyricsync.align.OverlapResolver;
import com.scholary.lyricsync.asr.AsrSegment;
import com.scholary.lyricsync.asr.AsrWord;
import com.scholary.lyricsync.asr.RecognizedWord;
import com.scholary.lyricsync.asr.TranscriptFlattener;
import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.lyrics.LrcParser;
import com.scholary.lyricsync.lyrics.ReferenceLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** End-to-end tests of the synchronization pipeline with real stages. */
class LyricSyncServiceTest {

  private static final double MIN_LINE_DURATION = 1.2;
  private static final double EPSILON = 1e-9;

  private LyricSyncService service;

  @BeforeEach
  void setUp() {
    AlignmentProperties properties = AlignmentProperties.defaults();
    service =
        new LyricSyncService(
            new GlobalOffsetEstimator(properties),
            new LineWindowAligner(properties),
            new GapInterpolator(properties),
            new OverlapResolver(properties),
            new LrcParser(),
            new TranscriptFlattener());
  }

  @Test
  void synchronize_fullyMatchedLines() {
    List<ReferenceLine> lines =
        List.of(new ReferenceLine("hello world", 0.0), new ReferenceLine("goodbye now", 5.0));
    List<RecognizedWord> words =
        List.of(
            new RecognizedWord("hello", 0.1, 0.4),
            new RecognizedWord("world", 0.4, 0.9),
            new RecognizedWord("goodbye", 5.2, 5.6),
            new RecognizedWord("now", 5.6, 6.0));

    SyncResult result = service.synchronize(lines, words);

    AlignedLine first = result.lines().get(0);
    AlignedLine second = result.lines().get(1);
    assertThat(first.getWords()).noneMatch(AlignedWord::isInterpolated);
    assertThat(second.getWords()).noneMatch(AlignedWord::isInterpolated);
    assertThat(first.getStart()).isEqualTo(0.1);
    assertThat(first.getEnd()).isCloseTo(1.3, within(EPSILON));
    assertThat(second.getStart()).isEqualTo(5.2);
    assertThat(second.getEnd()).isCloseTo(6.4, within(EPSILON));
    assertThat(first.getEnd()).isLessThanOrEqualTo(second.getStart());
    assertThat(result.diagnostics().matchedWords()).isEqualTo(4);
    assertThat(result.diagnostics().totalWords()).isEqualTo(4);
    assertThat(result.diagnostics().offsetApplied()).isFalse();
    assertRenderable(lines, result.lines());
  }

  @Test
  void synchronize_correctsGlobalDrift() {
    List<ReferenceLine> lines =
        List.of(
            new ReferenceLine("Hello darkness my old friend", 0.0),
            new ReferenceLine("Come talk again", 4.0));
    List<RecognizedWord> words =
        List.of(
            new RecognizedWord("hello", 10.1, 10.5),
            new RecognizedWord("darkness", 10.5, 11.2),
            new RecognizedWord("my", 11.2, 11.4),
            new RecognizedWord("old", 11.4, 11.8),
            new RecognizedWord("friend", 11.8, 12.6),
            new RecognizedWord("come", 14.2, 14.6),
            new RecognizedWord("talk", 14.6, 15.0),
            new RecognizedWord("again", 15.0, 15.8));

    SyncResult result = service.synchronize(lines, words);

    assertThat(result.diagnostics().globalOffset()).isCloseTo(10.0, within(0.2));
    assertThat(result.diagnostics().offsetApplied()).isTrue();
    assertThat(result.diagnostics().matchedWords()).isEqualTo(8);
    assertThat(result.lines().get(0).getStart()).isEqualTo(10.1);
    assertThat(result.lines().get(1).getStart()).isEqualTo(14.2);
    assertThat(result.lines().get(1).getEnd()).isEqualTo(15.8);
    // caller's lines are untouched
    assertThat(lines.get(1).start()).isEqualTo(4.0);
    assertRenderable(lines, result.lines());
  }

  @Test
  void synchronize_interpolatesMissingWord() {
    List<ReferenceLine> lines = List.of(new ReferenceLine("one two three", 0.0));
    List<RecognizedWord> words =
        List.of(new RecognizedWord("one", 0.0, 0.3), new RecognizedWord("three", 1.0, 1.3));

    SyncResult result = service.synchronize(lines, words);

    AlignedWord two = result.lines().get(0).getWords().get(1);
    assertThat(two.isInterpolated()).isTrue();
    assertThat(two.getStart()).isCloseTo(0.3, within(EPSILON));
    assertThat(two.getEnd()).isCloseTo(1.0, within(EPSILON));
    assertThat(result.diagnostics().matchedWords()).isEqualTo(2);
    assertThat(result.diagnostics().fallbackLines()).isZero();
    assertRenderable(lines, result.lines());
  }

  @Test
  void synchronize_totalMismatch_distributesOverNominalSpan() {
    List<ReferenceLine> lines =
        List.of(new ReferenceLine("la la land", 0.0), new ReferenceLine("something", 4.0));
    List<RecognizedWord> words =
        List.of(
            new RecognizedWord("completely", 0.5, 1.0), new RecognizedWord("different", 1.0, 1.5));

    SyncResult result = service.synchronize(lines, words);

    AlignedLine first = result.lines().get(0);
    assertThat(first.getStart()).isCloseTo(0.0, within(EPSILON));
    assertThat(first.getEnd()).isCloseTo(4.0, within(EPSILON));
    List<AlignedWord> firstWords = first.getWords();
    for (int k = 0; k < firstWords.size(); k++) {
      assertThat(firstWords.get(k).getStart()).isCloseTo(k * 4.0 / 3, within(EPSILON));
      assertThat(firstWords.get(k).isInterpolated()).isTrue();
    }
    assertThat(result.diagnostics().fallbackLines()).isEqualTo(2);
    assertThat(result.diagnostics().globalOffset()).isEqualTo(0.0);
    assertRenderable(lines, result.lines());
  }

  @Test
  void synchronize_overlapCascade_pushesLaterLines() {
    List<ReferenceLine> lines =
        List.of(
            new ReferenceLine("alpha beta", 0.0),
            new ReferenceLine("gamma delta", 0.5),
            new ReferenceLine("epsilon zeta", 0.6));
    List<RecognizedWord> words =
        List.of(
            new RecognizedWord("alpha", 0.0, 1.0),
            new RecognizedWord("gamma", 0.5, 1.5),
            new RecognizedWord("epsilon", 0.6, 1.8),
            new RecognizedWord("beta", 1.0, 2.0),
            new RecognizedWord("delta", 1.5, 2.5),
            new RecognizedWord("zeta", 1.8, 3.0));

    SyncResult result = service.synchronize(lines, words);

    List<AlignedLine> aligned = result.lines();
    assertThat(aligned.get(0).getStart()).isEqualTo(0.0);
    assertThat(aligned.get(0).getEnd()).isEqualTo(2.0);
    assertThat(aligned.get(1).getStart()).isEqualTo(2.0);
    assertThat(aligned.get(2).getStart()).isCloseTo(3.2, within(EPSILON));
    assertThat(result.diagnostics().pushedLines()).isEqualTo(2);
    assertRenderable(lines, aligned);
  }

  @Test
  void synchronize_noRecognizedWords_stillProducesTimeline() {
    List<ReferenceLine> lines =
        List.of(
            new ReferenceLine("first line", 0.0),
            new ReferenceLine("second line", 2.0),
            new ReferenceLine("third line", 2.5));

    SyncResult result = service.synchronize(lines, List.of());

    assertThat(result.diagnostics().matchedWords()).isZero();
    assertThat(result.diagnostics().fallbackLines()).isEqualTo(3);
    assertRenderable(lines, result.lines());
  }

  @Test
  void synchronize_noLines_isEmpty() {
    SyncResult result = service.synchronize(List.of(), List.of(new RecognizedWord("hi", 0, 1)));

    assertThat(result.lines()).isEmpty();
    assertThat(result.diagnostics().matchRatio()).isZero();
  }

  @Test
  void synchronize_nullInputsAreTreatedAsEmpty() {
    SyncResult result = service.synchronize((List<ReferenceLine>) null, null);

    assertThat(result.lines()).isEmpty();
  }

  @Test
  void synchronize_fromLrcAndSegments() {
    String lrc = "[ti:Demo]\n[00:01.00]Hello world\n[00:04.50]Goodbye now\n";
    List<AsrSegment> segments =
        List.of(
            new AsrSegment(
                1.1,
                2.0,
                "Hello world",
                List.of(new AsrWord(" Hello", 1.1, 1.5), new AsrWord(" world", 1.5, 2.0))),
            new AsrSegment(4.6, 5.8, "Goodbye now", List.of()));

    SyncResult result = service.synchronize(lrc, segments);

    assertThat(result.lines())
        .extracting(AlignedLine::getText)
        .containsExactly("Hello world", "Goodbye now");
    assertThat(result.lines().get(0).getStart()).isEqualTo(1.1);
    assertThat(result.lines().get(1).getWords().get(1).getStart()).isCloseTo(5.2, within(EPSILON));
    assertThat(result.diagnostics().matchedWords()).isEqualTo(4);
  }

  @Test
  void synchronize_isDeterministic() {
    List<ReferenceLine> lines = randomLines(new Random(7), 30);
    List<RecognizedWord> words = recognizedFrom(new Random(11), lines);

    SyncResult first = service.synchronize(lines, words);
    SyncResult second = service.synchronize(lines, words);

    assertThat(timings(second.lines())).isEqualTo(timings(first.lines()));
    assertThat(second.diagnostics()).isEqualTo(first.diagnostics());
  }

  @Test
  void synchronize_staysRenderableForNoisyInput() {
    for (long seed = 1; seed <= 25; seed++) {
      Random random = new Random(seed);
      List<ReferenceLine> lines = randomLines(random, 1 + random.nextInt(40));
      List<RecognizedWord> words = recognizedFrom(random, lines);

      SyncResult result = service.synchronize(lines, words);

      assertThat(result.lines()).allMatch(line -> line.getState() == LineState.FINALIZED);
      assertRenderable(lines, result.lines());
    }
  }

  private static void assertRenderable(List<ReferenceLine> input, List<AlignedLine> output) {
    assertThat(output)
        .extracting(AlignedLine::getText)
        .containsExactlyElementsOf(input.stream().map(ReferenceLine::text).toList());
    for (int i = 0; i < output.size(); i++) {
      AlignedLine line = output.get(i);
      assertThat(line.getStart()).isLessThanOrEqualTo(line.getEnd());
      assertThat(line.duration()).isGreaterThanOrEqualTo(MIN_LINE_DURATION);
      for (AlignedWord word : line.getWords()) {
        assertThat(word.getStart()).isBetween(line.getStart(), line.getEnd());
        assertThat(word.getEnd()).isBetween(line.getStart(), line.getEnd());
      }
      if (i + 1 < output.size()) {
        assertThat(line.getEnd()).isLessThanOrEqualTo(output.get(i + 1).getStart());
      }
    }
  }

  private static List<Double> timings(List<AlignedLine> lines) {
    List<Double> timings = new ArrayList<>();
    for (AlignedLine line : lines) {
      timings.add(line.getStart());
      timings.add(line.getEnd());
      for (AlignedWord word : line.getWords()) {
        timings.add(word.getStart());
        timings.add(word.getEnd());
      }
    }
    return timings;
  }

  private static final String[] VOCABULARY = {
    "love", "night", "baby", "dance", "heart", "fire", "oh", "yeah", "la", "forever", "the", "you"
  };

  /** Lyric lines with jittery, occasionally out-of-order starts. */
  private static List<ReferenceLine> randomLines(Random random, int count) {
    List<ReferenceLine> lines = new ArrayList<>();
    double time = random.nextDouble() * 5;
    for (int i = 0; i < count; i++) {
      int wordCount = random.nextInt(6);
      StringBuilder text = new StringBuilder();
      for (int k = 0; k < wordCount; k++) {
        text.append(VOCABULARY[random.nextInt(VOCABULARY.length)]).append(k % 3 == 2 ? ", " : " ");
      }
      lines.add(new ReferenceLine(text.toString().trim(), time));
      time += random.nextDouble() * 4 - 0.3;
    }
    return lines;
  }

  /** Recognizer words for the lines: drifted, with dropouts and substitutions. */
  private static List<RecognizedWord> recognizedFrom(Random random, List<ReferenceLine> lines) {
    List<RecognizedWord> words = new ArrayList<>();
    double drift = random.nextDouble() * 6 - 3;
    double cursor = 0;
    for (ReferenceLine line : lines) {
      cursor = Math.max(cursor, line.start() + drift);
      for (String word : line.text().split("\\s+")) {
        if (word.isEmpty() || random.nextInt(5) == 0) {
          continue;
        }
        String text = random.nextInt(6) == 0 ? "mumble" : word;
        double duration = 0.1 + random.nextDouble() * 0.6;
        words.add(new RecognizedWord(text, Math.max(0, cursor), Math.max(0, cursor) + duration));
        cursor += duration;
      }
    }
    return words;
  }
}
