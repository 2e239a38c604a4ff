package com.acme.editor.runtime.event;

import java.util.Set;

/**
 * Filter for {@link EventLog#query}. Null fields match everything.
 *
 * @param types event types to keep, empty for all
 * @param aggregateType keeps events of aggregates of this type
 * @param aggregateId keeps events of aggregates with this id
 * @param limit maximum number of results, 0 for no limit
 */
public record EventQuery(
    Set<String> types,
    EventSource source,
    String workflowId,
    String aggregateType,
    String aggregateId,
    long fromSequence,
    long toSequence,
    int limit) {

  public EventQuery {
    types = types == null ? Set.of() : Set.copyOf(types);
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative: " + limit);
    }
  }

  public static EventQuery all() {
    return new EventQuery(Set.of(), null, null, null, null, 1, Long.MAX_VALUE, 0);
  }

  public static EventQuery ofTypes(String... types) {
    return all().withTypes(Set.of(types));
  }

  public EventQuery withTypes(Set<String> newTypes) {
    return new EventQuery(
        newTypes, source, workflowId, aggregateType, aggregateId, fromSequence, toSequence, limit);
  }

  public EventQuery withSource(EventSource newSource) {
    return new EventQuery(
        types, newSource, workflowId, aggregateType, aggregateId, fromSequence, toSequence, limit);
  }

  public EventQuery withWorkflowId(String newWorkflowId) {
    return new EventQuery(
        types, source, newWorkflowId, aggregateType, aggregateId, fromSequence, toSequence, limit);
  }

  public EventQuery withAggregateType(String newAggregateType) {
    return new EventQuery(
        types, source, workflowId, newAggregateType, aggregateId, fromSequence, toSequence, limit);
  }

  public EventQuery withAggregate(AggregateRef aggregate) {
    return new EventQuery(
        types,
        source,
        workflowId,
        aggregate.type(),
        aggregate.id(),
        fromSequence,
        toSequence,
        limit);
  }

  public EventQuery between(long from, long to) {
    return new EventQuery(
        types, source, workflowId, aggregateType, aggregateId, from, to, limit);
  }

  public EventQuery limit(int newLimit) {
    return new EventQuery(
        types, source, workflowId, aggregateType, aggregateId, fromSequence, toSequence, newLimit);
  }

  boolean matches(Event event) {
    if (event.sequence() < fromSequence || event.sequence() > toSequence) {
      return false;
    }
    if (!types.isEmpty() && !types.contains(event.type())) {
      return false;
    }
    if (source != null && event.metadata().source() != source) {
      return false;
    }
    if (workflowId != null && !workflowId.equals(event.metadata().workflowId())) {
      return false;
    }
    AggregateRef aggregate = event.aggregate();
    if (aggregateType != null && (aggregate == null || !aggregateType.equals(aggregate.type()))) {
      return false;
    }
    return aggregateId == null || (aggregate != null && aggregateId.equals(aggregate.id()));
  }
}
