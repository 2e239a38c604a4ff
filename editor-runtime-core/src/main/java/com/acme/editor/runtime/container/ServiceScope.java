package com.acme.editor.runtime.container;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Child resolver that owns SCOPED instances, e.g. one per agent run or per dialog. Everything that
 * is not SCOPED is resolved by the parent registry. Closing the scope closes the scoped instances
 * that are {@link AutoCloseable}.
 */
public class ServiceScope implements ServiceResolver, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ServiceScope.class);

  private final ServiceRegistry registry;
  private final Map<String, CompletableFuture<Object>> scopedInstances = new ConcurrentHashMap<>();
  private final List<String> creationOrder = new ArrayList<>();
  private volatile boolean closed;

  ServiceScope(ServiceRegistry registry) {
    this.registry = registry;
  }

  @Override
  public <T> T resolveSync(String token) {
    ServiceDescriptor descriptor = registry.requireDescriptor(token);
    if (descriptor.lifecycle() != ServiceLifecycle.SCOPED) {
      return registry.resolveSync(token);
    }
    return ServiceRegistry.cast(registry.joinConstructed(descriptor, scopedInstance(descriptor)));
  }

  @Override
  public <T> CompletableFuture<T> resolveAsync(String token) {
    try {
      ServiceDescriptor descriptor = registry.requireDescriptor(token);
      if (descriptor.lifecycle() != ServiceLifecycle.SCOPED) {
        return registry.resolveAsync(token);
      }
      return scopedInstance(descriptor).thenApply(ServiceRegistry::cast);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public boolean isRegistered(String token) {
    return registry.isRegistered(token);
  }

  /** Number of scoped instances created so far. */
  public int size() {
    return scopedInstances.size();
  }

  private synchronized CompletableFuture<Object> scopedInstance(ServiceDescriptor descriptor) {
    if (closed) {
      throw new IllegalStateException("Service scope is closed");
    }
    String token = descriptor.token();
    CompletableFuture<Object> existing = scopedInstances.get(token);
    if (existing != null && !existing.isCompletedExceptionally()) {
      return existing;
    }
    registry.requireNotConstructingOnThisThread(token);
    CompletableFuture<Object> created = registry.construct(descriptor, this);
    scopedInstances.put(token, created);
    creationOrder.add(token);
    return created;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException failure = null;
    for (int i = creationOrder.size() - 1; i >= 0; i--) {
      String token = creationOrder.get(i);
      CompletableFuture<Object> instance = scopedInstances.get(token);
      if (instance == null || !instance.isDone() || instance.isCompletedExceptionally()) {
        continue;
      }
      if (!(instance.join() instanceof AutoCloseable closeable)) {
        continue;
      }
      try {
        closeable.close();
      } catch (Exception e) {
        log.error("Failed to close scoped service: {}", token, e);
        if (failure == null) {
          failure = new IllegalStateException("Failed to close scoped service '" + token + "'", e);
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    scopedInstances.clear();
    creationOrder.clear();
    log.debug("Service scope closed");
    if (failure != null) {
      throw failure;
    }
  }
}
