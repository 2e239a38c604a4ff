package com.acme.editor.runtime.history;

/** Notified after a revert, so hosts can rebuild their view of the state at the checkpoint. */
@FunctionalInterface
public interface CheckpointListener {
  void onReverted(Checkpoint checkpoint, boolean progressDiscarded);
}
