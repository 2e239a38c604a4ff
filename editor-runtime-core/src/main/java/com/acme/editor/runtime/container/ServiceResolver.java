package com.acme.editor.runtime.container;

import java.util.concurrent.CompletableFuture;

/** Read side of the registry, handed to factories. */
public interface ServiceResolver {

  /**
   * Resolve a service, blocking while another caller is constructing it.
   *
   * @throws ServiceNotFoundException if the token is unknown
   * @throws AsyncAccessedSynchronouslyException if the service is still being built by an async
   *     factory
   */
  <T> T resolveSync(String token);

  /** Resolve a service; failures are delivered through the returned future. */
  <T> CompletableFuture<T> resolveAsync(String token);

  boolean isRegistered(String token);

  /** Typed variant of {@link #resolveSync(String)}. */
  default <T> T resolveSync(String token, Class<T> type) {
    Object service = resolveSync(token);
    if (!type.isInstance(service)) {
      throw new IllegalStateException(
          "Service '"
              + token
              + "' is a "
              + service.getClass().getName()
              + ", not a "
              + type.getName());
    }
    return type.cast(service);
  }
}
