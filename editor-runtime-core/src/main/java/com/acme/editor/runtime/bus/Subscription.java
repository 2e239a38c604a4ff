package com.acme.editor.runtime.bus;

/** Handle returned by {@link EventBus#subscribe}. Unsubscribing twice is harmless. */
public interface Subscription extends AutoCloseable {

  void unsubscribe();

  boolean isActive();

  @Override
  default void close() {
    unsubscribe();
  }
}
