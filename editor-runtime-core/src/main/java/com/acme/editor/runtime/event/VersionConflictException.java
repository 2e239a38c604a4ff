package com.acme.editor.runtime.event;

/** An append expected an aggregate version that is no longer current. */
public class VersionConflictException extends RuntimeException {
  private final AggregateRef aggregate;
  private final long expectedVersion;
  private final long currentVersion;

  public VersionConflictException(AggregateRef aggregate, long expectedVersion, long currentVersion) {
    super(
        "Version conflict on "
            + aggregate
            + ": expected version "
            + expectedVersion
            + ", current version is "
            + currentVersion);
    this.aggregate = aggregate;
    this.expectedVersion = expectedVersion;
    this.currentVersion = currentVersion;
  }

  public AggregateRef getAggregate() {
    return aggregate;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  public long getCurrentVersion() {
    return currentVersion;
  }
}
