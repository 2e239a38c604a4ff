package com.acme.editor.runtime.bus;

import com.acme.editor.runtime.event.Event;

/** Receives failures of bus handlers after they were logged. */
@FunctionalInterface
public interface HandlerErrorReporter {

  HandlerErrorReporter NONE = (event, error) -> {};

  void report(Event event, Exception error);
}
