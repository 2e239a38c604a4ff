package com.acme.editor.runtime.event;

import java.util.Objects;

/** Identity of the document object an event changes, such as one layer or the selection. */
public record AggregateRef(String type, String id) {

  public AggregateRef {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
  }

  public static AggregateRef of(String type, String id) {
    return new AggregateRef(type, id);
  }

  @Override
  public String toString() {
    return type + ":" + id;
  }
}
