package com.acme.editor.runtime.core;

/**
 * Event types written to the log by the runtime itself. Feature code owns its own types; these
 * are reserved.
 */
public final class EventTypeConstants {

  // History markers
  public static final String HISTORY_UNDO = "history.undo";
  public static final String HISTORY_REDO = "history.redo";
  public static final String HISTORY_CANCELLED = "history.cancelled";
  public static final String HISTORY_NAVIGATED = "history.navigated";

  // Checkpoint markers
  public static final String CHECKPOINT_REVERTED = "checkpoint.reverted";

  /** Prefix of the history marker types. */
  public static final String HISTORY_PREFIX = "history.";

  /** Subscribes a bus handler to every event type. */
  public static final String WILDCARD = "*";

  private EventTypeConstants() {
    // Utility class - prevent instantiation
  }
}
