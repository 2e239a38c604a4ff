package com.acme.editor.cli.service;

/**
 * One step of {@code history demo}.
 */
public record HistoryStep(String action, int undoDepth, int redoDepth, long headSequence) {
}
