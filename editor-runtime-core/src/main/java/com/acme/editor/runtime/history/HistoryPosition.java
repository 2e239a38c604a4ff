package com.acme.editor.runtime.history;

import java.util.List;

/** Undo and redo stacks as they stood at one log head, each listed top first. */
record HistoryPosition(
    long headSequence, List<HistoryEntry> undoEntries, List<HistoryEntry> redoEntries) {}
