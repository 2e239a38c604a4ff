package com.acme.editor.runtime.event;

import com.acme.editor.runtime.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * An event that has not been appended yet, so it has no sequence or timestamp.
 *
 * @param aggregate the object the event changes, or {@code null}
 * @param expectedVersion the aggregate version the writer last saw; {@code null} skips the check
 */
public record EventDraft(
    String type,
    JsonNode payload,
    EventMetadata metadata,
    AggregateRef aggregate,
    Long expectedVersion) {

  public EventDraft {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(metadata, "metadata");
    payload = Jsons.toTree(payload);
    if (expectedVersion != null && aggregate == null) {
      throw new IllegalArgumentException("An expected version needs an aggregate: " + type);
    }
  }

  public EventDraft(String type, JsonNode payload, EventMetadata metadata) {
    this(type, payload, metadata, null, null);
  }

  public static EventDraft of(String type, Object payload) {
    return new EventDraft(type, Jsons.toTree(payload), EventMetadata.user());
  }

  public static EventDraft of(String type, Object payload, EventMetadata metadata) {
    return new EventDraft(type, Jsons.toTree(payload), metadata);
  }

  @Override
  public JsonNode payload() {
    return payload.deepCopy();
  }

  public EventDraft withMetadata(EventMetadata newMetadata) {
    return new EventDraft(type, payload, newMetadata, aggregate, expectedVersion);
  }

  public EventDraft forAggregate(AggregateRef newAggregate) {
    return new EventDraft(type, payload, metadata, newAggregate, expectedVersion);
  }

  /** Rejects the append unless the aggregate is still at {@code version}. */
  public EventDraft expectingVersion(long version) {
    return new EventDraft(type, payload, metadata, aggregate, version);
  }

  public EventDraft withoutVersionCheck() {
    return expectedVersion == null ? this : new EventDraft(type, payload, metadata, aggregate, null);
  }
}
