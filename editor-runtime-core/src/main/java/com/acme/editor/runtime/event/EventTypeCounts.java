package com.acme.editor.runtime.event;

import java.util.Map;
import java.util.TreeMap;

/** Counts appended events per type. The default projection when a host supplies none. */
public class EventTypeCounts implements Projector<Map<String, Long>> {

  @Override
  public Map<String, Long> initial() {
    return new TreeMap<>();
  }

  @Override
  public Map<String, Long> apply(Map<String, Long> state, Event event) {
    state.merge(event.type(), 1L, Long::sum);
    return state;
  }

  @Override
  public Map<String, Long> copy(Map<String, Long> state) {
    return new TreeMap<>(state);
  }
}
