package com.scholary.lyricsync.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.lyricsync.asr.AsrSegment;
import com.scholary.lyricsync.lyrics.ReferenceLine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request for synchronizing lyrics with a transcription.
 *
 * <p>The reference lyrics come either as raw LRC text or as already parsed lines; when both are
 * given, the parsed lines win. Segments may be empty, in which case every line is timed from the
 * lyrics alone. Null entries in either list are rejected.
 */
public record SyncRequest(
    String lrc,
    List<@NotNull @Valid ReferenceLine> lines,
    List<@NotNull @Valid AsrSegment> segments) {

  // Provide defaults
  public SyncRequest {
    if (lines == null) {
      lines = List.of();
    }
    if (segments == null) {
      segments = List.of();
    }
  }

  @JsonIgnore
  @AssertTrue(message = "either lrc or lines must be provided")
  public boolean isReferenceProvided() {
    return !lines.isEmpty() || (lrc != null && !lrc.isBlank());
  }
}
