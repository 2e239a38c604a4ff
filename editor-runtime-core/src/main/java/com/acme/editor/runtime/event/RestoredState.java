package com.acme.editor.runtime.event;

/**
 * Outcome of a replay.
 *
 * @param sequence the sequence the state is valid at
 * @param snapshotSequence sequence of the snapshot the replay started from, 0 for a full replay
 * @param eventsReplayed events applied on top of the snapshot
 */
public record RestoredState<S>(
    S state, long sequence, long snapshotSequence, int eventsReplayed) {

  public boolean usedSnapshot() {
    return snapshotSequence > 0;
  }
}
