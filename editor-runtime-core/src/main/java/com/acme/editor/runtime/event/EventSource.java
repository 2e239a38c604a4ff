package com.acme.editor.runtime.event;

/** Who caused an event. */
public enum EventSource {
  USER,
  AI,
  SYSTEM
}
