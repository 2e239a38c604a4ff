package com.acme.editor.runtime.container;

/**
 * Ordered bootstrap stages. A service tagged with a phase can only be constructed once the
 * registry has reached that phase.
 */
public enum ServicePhase {
  /** Event log, snapshot store, event bus */
  CORE,

  /** Bridge, history, checkpoints and feature stores */
  INFRASTRUCTURE,

  /** Services that need a live canvas surface */
  APPLICATION,

  /** Bootstrap finished; every phase is satisfied */
  COMPLETE;

  /** True when a service tagged {@code required} may be constructed while in this phase. */
  public boolean permits(ServicePhase required) {
    return required.ordinal() <= ordinal();
  }

  public boolean isBefore(ServicePhase other) {
    return ordinal() < other.ordinal();
  }
}
