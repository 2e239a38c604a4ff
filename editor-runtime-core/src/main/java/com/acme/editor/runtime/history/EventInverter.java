package com.acme.editor.runtime.history;

import com.acme.editor.runtime.event.Event;
import com.acme.editor.runtime.event.EventDraft;

/** Maps an appended forward event to the event that undoes it. */
@FunctionalInterface
public interface EventInverter {
  EventDraft invert(Event forward);
}
