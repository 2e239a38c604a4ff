package com.acme.editor.runtime.core;

/** Registry tokens of the services the runtime bootstraps. */
public final class ServiceTokens {

  // core phase
  public static final String EVENT_LOG = "eventLog";
  public static final String SNAPSHOT_STORE = "snapshotStore";
  public static final String EVENT_BUS = "eventBus";

  // infrastructure phase
  public static final String EVENT_LOG_BRIDGE = "eventLogBridge";
  public static final String INVERSE_EVENTS = "inverseEvents";
  public static final String HISTORY_MANAGER = "historyManager";
  public static final String CHECKPOINT_REGISTRY = "checkpointRegistry";

  // application phase
  public static final String CANVAS_SURFACE = "canvasSurface";

  // values
  public static final String RUNTIME_CONFIG = "runtimeConfig";

  private ServiceTokens() {
    // Utility class - prevent instantiation
  }
}
