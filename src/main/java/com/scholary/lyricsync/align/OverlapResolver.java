package com.scholary.lyricsync.align;

import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.logging.StructuredLogger;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Makes the timeline renderable: every line visible long enough, no two lines on screen at once.
 *
 * <p>A single forward pass. Each line is first stretched to the minimum duration; if it then runs
 * into the next line, the next line starts later. Earlier lines always win because they are
 * already on screen. A push can cascade through several lines, which the forward order handles
 * without iterating to a fixed point.
 *
 * <p>Lines are only ever pushed later, never pulled earlier, so a long run of short lines can
 * accumulate delay.
 */
@Component
public class OverlapResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlapResolver.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final AlignmentProperties properties;

  public OverlapResolver(AlignmentProperties properties) {
    this.properties = properties;
  }

  /**
   * Enforce minimum duration and remove overlaps.
   *
   * @param lines lines in state {@link LineState#FULLY_TIMED}, in display order
   * @return number of lines pushed later
   */
  public int resolve(List<AlignedLine> lines) {
    int pushed = 0;

    for (int i = 0; i < lines.size(); i++) {
      AlignedLine current = lines.get(i);
      enforceMinimumDuration(current);

      if (i + 1 < lines.size()) {
        AlignedLine next = lines.get(i + 1);
        if (current.getEnd() > next.getStart()) {
          STRUCTURED.logLinePushed(i + 1, next.getStart(), current.getEnd());
          pushForward(next, current.getEnd());
          pushed++;
        }
      }

      current.clampWords();
      current.advanceTo(LineState.FINALIZED);
    }

    LOGGER.debug("Resolved overlaps for {} lines, {} pushed", lines.size(), pushed);
    return pushed;
  }

  private void enforceMinimumDuration(AlignedLine line) {
    line.extendToAtLeast(properties.minLineDuration());
  }

  private void pushForward(AlignedLine line, double newStart) {
    line.setStart(newStart);
    line.extendToAtLeast(properties.minPushedLineDuration());

    // Words cannot show before their line does.
    for (AlignedWord word : line.getWords()) {
      if (word.getStart() < newStart) {
        word.setStart(newStart);
      }
      if (word.getEnd() < newStart) {
        word.setEnd(newStart);
      }
    }
  }
}
