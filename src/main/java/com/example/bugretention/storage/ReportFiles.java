package com.example.bugretention.storage;

/**
 * Object-storage references of one report. Either URL may be null.
 */
public record ReportFiles(String screenshotUrl, String replayUrl) { }
