package com.acme.editor.runtime.event;

/** A read or replay needed events that compaction has already pruned. */
public class CompactedRangeException extends RuntimeException {
  private final long requestedSequence;
  private final long firstRetainedSequence;

  public CompactedRangeException(long requestedSequence, long firstRetainedSequence) {
    super(
        "Events from sequence "
            + requestedSequence
            + " were compacted; the log starts at "
            + firstRetainedSequence);
    this.requestedSequence = requestedSequence;
    this.firstRetainedSequence = firstRetainedSequence;
  }

  public long getRequestedSequence() {
    return requestedSequence;
  }

  public long getFirstRetainedSequence() {
    return firstRetainedSequence;
  }
}
