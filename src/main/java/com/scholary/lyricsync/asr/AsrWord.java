package com.scholary.lyricsync.asr;

/** Word-level timing inside a recognizer segment. */
public record AsrWord(String word, double start, double end) {}
