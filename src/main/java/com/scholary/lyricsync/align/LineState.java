package com.scholary.lyricsync.align;

/** Lifecycle of an {@link AlignedLine}. Lines only ever move forward through these states. */
public enum LineState {
  /** Created from the reference line; no word has timing yet. */
  UNALIGNED,
  /** Window alignment ran; zero or more words carry recognizer timing. */
  PARTIALLY_ALIGNED,
  /** Every word has timing, either matched or interpolated. */
  FULLY_TIMED,
  /** Minimum duration and overlap constraints applied. */
  FINALIZED
}
