package com.scholary.lyricsync.service;

import com.scholary.lyricsync.align.AlignedLine;
import java.util.List;

/** Finalized timeline plus diagnostics for one synchronization run. */
public record SyncResult(List<AlignedLine> lines, SyncDiagnostics diagnostics) {}
