package com.scholary.lyricsync.api;

import com.scholary.lyricsync.service.LyricSyncService;
import com.scholary.lyricsync.service.SyncResult;
import com.scholary.lyricsync.service.TimelineWriter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for lyric synchronization.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronizing lyrics and returning the timeline as JSON
 *   <li>Rendering the synchronized timeline as SRT
 *   <li>Rendering the synchronized timeline as enhanced LRC
 * </ul>
 *
 * <p>Synchronization is CPU-bound and finishes in milliseconds for a song, so all endpoints are
 * synchronous.
 */
@RestController
@Tag(name = "Lyric sync", description = "Align lyric lines with speech recognition timing")
public class SyncController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncController.class);
  private static final MediaType TEXT_UTF8 =
      new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

  private final LyricSyncService syncService;
  private final TimelineWriter timelineWriter;

  public SyncController(LyricSyncService syncService, TimelineWriter timelineWriter) {
    this.syncService = syncService;
    this.timelineWriter = timelineWriter;
  }

  /** Synchronize and return the timeline with diagnostics. */
  @PostMapping("/api/sync")
  @Operation(
      summary = "Synchronize lyrics",
      description = "Time every lyric line and word from the transcription and return JSON")
  public ResponseEntity<SyncResponse> sync(@Valid @RequestBody SyncRequest request) {
    try {
      return ResponseEntity.ok(SyncResponse.from(run(request)));
    } catch (Exception e) {
      LOGGER.error("Lyric sync failed", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /** Synchronize and return SRT captions. */
  @PostMapping("/api/sync/srt")
  @Operation(summary = "Synchronize lyrics as SRT", description = "One SRT cue per lyric line")
  public ResponseEntity<byte[]> syncSrt(@Valid @RequestBody SyncRequest request) {
    try {
      byte[] srt = timelineWriter.writeSrt(run(request).lines());
      return ResponseEntity.ok().contentType(TEXT_UTF8).body(srt);
    } catch (Exception e) {
      LOGGER.error("Lyric sync to SRT failed", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /** Synchronize and return enhanced LRC with word timestamps. */
  @PostMapping("/api/sync/lrc")
  @Operation(
      summary = "Synchronize lyrics as enhanced LRC",
      description = "Line timestamps plus per-word start tags for karaoke players")
  public ResponseEntity<byte[]> syncLrc(@Valid @RequestBody SyncRequest request) {
    try {
      byte[] lrc = timelineWriter.writeEnhancedLrc(run(request).lines());
      return ResponseEntity.ok().contentType(TEXT_UTF8).body(lrc);
    } catch (Exception e) {
      LOGGER.error("Lyric sync to LRC failed", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  private SyncResult run(SyncRequest request) {
    LOGGER.info(
        "Sync request: lines={}, lrcChars={}, segments={}",
        request.lines().size(),
        request.lrc() == null ? 0 : request.lrc().length(),
        request.segments().size());

    if (!request.lines().isEmpty()) {
      return syncService.synchronizeSegments(request.lines(), request.segments());
    }
    return syncService.synchronize(request.lrc(), request.segments());
  }
}
