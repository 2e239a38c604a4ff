package com.acme.editor.runtime.event;

import com.acme.editor.runtime.core.Jsons;

/**
 * Folds events into a materialized state. Snapshots store {@link #copy copies} of that state, so
 * {@link #apply} may either return a new value or mutate and return the one it was given.
 */
public interface Projector<S> {

  S initial();

  S apply(S state, Event event);

  /** Detached copy of a state. Defaults to a Jackson round trip. */
  default S copy(S state) {
    return Jsons.deepCopy(state);
  }
}
