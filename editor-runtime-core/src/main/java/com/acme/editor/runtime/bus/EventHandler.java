package com.acme.editor.runtime.bus;

import com.acme.editor.runtime.event.Event;

@FunctionalInterface
public interface EventHandler {
  void handle(Event event) throws Exception;
}
