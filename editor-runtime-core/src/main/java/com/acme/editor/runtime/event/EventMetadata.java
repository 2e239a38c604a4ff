package com.acme.editor.runtime.event;

import java.util.Objects;

/**
 * Audit data attached to every event.
 *
 * @param correlationId links events that belong to one user gesture or agent step, may be null
 * @param workflowId multi-step workflow the event belongs to, may be null
 */
public record EventMetadata(EventSource source, String correlationId, String workflowId) {

  private static final EventMetadata USER = new EventMetadata(EventSource.USER, null, null);
  private static final EventMetadata SYSTEM = new EventMetadata(EventSource.SYSTEM, null, null);

  public EventMetadata {
    Objects.requireNonNull(source, "source");
  }

  public static EventMetadata user() {
    return USER;
  }

  public static EventMetadata system() {
    return SYSTEM;
  }

  public static EventMetadata ai(String workflowId) {
    return new EventMetadata(EventSource.AI, null, workflowId);
  }

  public EventMetadata withCorrelationId(String newCorrelationId) {
    return new EventMetadata(source, newCorrelationId, workflowId);
  }

  public EventMetadata withWorkflowId(String newWorkflowId) {
    return new EventMetadata(source, correlationId, newWorkflowId);
  }
}
