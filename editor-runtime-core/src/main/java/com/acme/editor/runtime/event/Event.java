package com.acme.editor.runtime.event;

import com.acme.editor.runtime.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable log entry. The payload is opaque to the runtime; it is kept as a private JSON tree
 * and every accessor hands out a copy.
 *
 * @param aggregate the object the event changes, or {@code null}
 * @param version the aggregate's version after this event, 0 without an aggregate
 */
public record Event(
    long sequence,
    String type,
    JsonNode payload,
    Instant timestamp,
    EventMetadata metadata,
    AggregateRef aggregate,
    long version) {

  public Event {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(metadata, "metadata");
    payload = Jsons.toTree(payload);
  }

  public Event(
      long sequence, String type, JsonNode payload, Instant timestamp, EventMetadata metadata) {
    this(sequence, type, payload, timestamp, metadata, null, 0);
  }

  @Override
  public JsonNode payload() {
    return payload.deepCopy();
  }

  public <T> T payloadAs(Class<T> type) {
    return Jsons.fromTree(payload, type);
  }

  /** Reads a top-level text field of the payload, or {@code null}. */
  public String payloadText(String field) {
    JsonNode value = payload.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  /** The same type, payload, metadata and aggregate, ready to be appended again. */
  public EventDraft toDraft() {
    return new EventDraft(type, payload, metadata, aggregate, null);
  }
}
