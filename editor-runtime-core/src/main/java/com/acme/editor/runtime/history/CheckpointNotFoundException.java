package com.acme.editor.runtime.history;

public class CheckpointNotFoundException extends RuntimeException {
  private final String checkpointId;

  public CheckpointNotFoundException(String checkpointId) {
    super("Checkpoint '" + checkpointId + "' not found");
    this.checkpointId = checkpointId;
  }

  public String getCheckpointId() {
    return checkpointId;
  }
}
