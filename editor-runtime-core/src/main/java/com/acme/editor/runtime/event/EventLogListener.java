package com.acme.editor.runtime.event;

/** Receives every appended event once, in log order, after the write. */
@FunctionalInterface
public interface EventLogListener {
  void onAppended(Event event);
}
