package com.acme.editor.runtime.container;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phased dependency registry. Every runtime subsystem is registered here as a factory under a
 * lifecycle and a bootstrap phase, and obtained only through {@link #resolveSync} or {@link
 * #resolveAsync}.
 *
 * <p>Resolution order: values and cached singletons are returned immediately; a singleton that is
 * already being constructed is awaited (bounded by the init timeout) instead of being built twice;
 * otherwise the phase is checked, declared dependencies are walked for cycles, and the factory
 * runs. Pure POJO - no framework dependencies.
 */
public class ServiceRegistry implements ServiceResolver, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

  public static final Duration DEFAULT_INIT_TIMEOUT = Duration.ofSeconds(10);

  private final Map<String, ServiceDescriptor> descriptors = new ConcurrentHashMap<>();
  private final List<String> registrationOrder = new CopyOnWriteArrayList<>();
  private final Map<String, Object> values = new ConcurrentHashMap<>();
  private final Map<String, Object> singletons = new ConcurrentHashMap<>();
  private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
  private final Set<String> completed = ConcurrentHashMap.newKeySet();
  // sync factories that handed back a promise instead of an instance
  private final Set<String> promiseBacked = ConcurrentHashMap.newKeySet();
  private final Deque<String> constructionOrder = new ConcurrentLinkedDeque<>();
  private final ThreadLocal<Deque<String>> constructing = ThreadLocal.withInitial(ArrayDeque::new);
  private final AtomicReference<ServicePhase> currentPhase =
      new AtomicReference<>(ServicePhase.CORE);
  private final Duration initTimeout;

  public ServiceRegistry() {
    this(DEFAULT_INIT_TIMEOUT);
  }

  public ServiceRegistry(Duration initTimeout) {
    this.initTimeout = Objects.requireNonNull(initTimeout, "initTimeout");
  }

  // ---------------------------------------------------------------- registration

  /**
   * Register a factory. Nothing is constructed until the token is resolved.
   *
   * @throws IllegalStateException if the token is already registered
   */
  public <T> void register(String token, ServiceFactory<T> factory, ServiceOptions options) {
    Objects.requireNonNull(factory, "factory");
    requireFactoryLifecycle(token, options);
    store(ServiceDescriptor.sync(token, factory, options));
  }

  /** Register a factory whose product arrives through a {@link CompletionStage}. */
  public <T> void registerAsync(
      String token, AsyncServiceFactory<T> factory, ServiceOptions options) {
    Objects.requireNonNull(factory, "factory");
    requireFactoryLifecycle(token, options);
    store(ServiceDescriptor.async(token, factory, options));
  }

  public <T> void registerSingleton(
      String token, ServiceFactory<T> factory, ServicePhase phase, String... dependencies) {
    register(token, factory, ServiceOptions.singleton().inPhase(phase).dependsOn(dependencies));
  }

  public <T> void registerTransient(
      String token, ServiceFactory<T> factory, ServicePhase phase, String... dependencies) {
    register(
        token, factory, ServiceOptions.transientService().inPhase(phase).dependsOn(dependencies));
  }

  public <T> void registerScoped(
      String token, ServiceFactory<T> factory, ServicePhase phase, String... dependencies) {
    register(token, factory, ServiceOptions.scoped().inPhase(phase).dependsOn(dependencies));
  }

  /** Register a constant. Values are returned as-is and never phase checked. */
  public void registerValue(String token, Object value) {
    Objects.requireNonNull(value, "value");
    store(ServiceDescriptor.value(token, ServicePhase.CORE));
    values.put(token, value);
  }

  /**
   * Register a value slot that is filled later through {@link #update}, typically by UI code that
   * creates the object outside the registry. Resolving it before then fails with {@link
   * ServiceNotFoundException}.
   */
  public void registerDeferred(String token, ServicePhase phase) {
    store(ServiceDescriptor.value(token, phase));
  }

  /**
   * Replace the instance behind a VALUE or SINGLETON token. This is the only mutation allowed
   * after registration.
   */
  public void update(String token, Object instance) {
    Objects.requireNonNull(instance, "instance");
    ServiceDescriptor descriptor = requireDescriptor(token);
    switch (descriptor.lifecycle()) {
      case VALUE -> values.put(token, instance);
      case SINGLETON -> {
        singletons.put(token, instance);
        completed.add(token);
      }
      default -> {
        String error =
            "Cannot update " + descriptor.lifecycle() + " service '" + token + "'";
        log.error(error);
        throw new IllegalStateException(error);
      }
    }
    log.info("Updated instance for service: {}", token);
  }

  private void store(ServiceDescriptor descriptor) {
    String token = descriptor.token();
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("Service token must not be blank");
    }
    if (descriptors.putIfAbsent(token, descriptor) != null) {
      String error = "Service already registered for token: " + token;
      log.error(error);
      throw new IllegalStateException(error);
    }
    registrationOrder.add(token);
    log.info(
        "Registered service: {} lifecycle={} phase={} dependencies={}",
        token,
        descriptor.lifecycle(),
        descriptor.phase(),
        descriptor.dependencies());
  }

  private static void requireFactoryLifecycle(String token, ServiceOptions options) {
    if (options.getLifecycle() == ServiceLifecycle.VALUE) {
      throw new IllegalArgumentException(
          "Use registerValue or registerDeferred for VALUE service '" + token + "'");
    }
  }

  // ---------------------------------------------------------------- phases

  /**
   * Move the registry forward to {@code next}. Advancing to the current phase is a no-op.
   *
   * @throws IllegalStateException if {@code next} is earlier than the current phase
   */
  public void advancePhase(ServicePhase next) {
    Objects.requireNonNull(next, "next");
    ServicePhase previous =
        currentPhase.getAndUpdate(phase -> phase.isBefore(next) ? next : phase);
    if (next.isBefore(previous)) {
      String error = "Cannot move registry phase backward from " + previous + " to " + next;
      log.error(error);
      throw new IllegalStateException(error);
    }
    if (previous != next) {
      log.info("Registry phase advanced: {} -> {}", previous, next);
    }
  }

  public ServicePhase currentPhase() {
    return currentPhase.get();
  }

  // ---------------------------------------------------------------- resolution

  @Override
  public <T> T resolveSync(String token) {
    ServiceDescriptor descriptor = requireDescriptor(token);
    if (descriptor.lifecycle() == ServiceLifecycle.SCOPED) {
      throw scopeRequired(token);
    }
    return cast(resolveBlocking(descriptor, this));
  }

  @Override
  public <T> CompletableFuture<T> resolveAsync(String token) {
    try {
      ServiceDescriptor descriptor = requireDescriptor(token);
      if (descriptor.lifecycle() == ServiceLifecycle.SCOPED) {
        throw scopeRequired(token);
      }
      return resolveNonBlocking(descriptor, this).thenApply(ServiceRegistry::cast);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public boolean isRegistered(String token) {
    return descriptors.containsKey(token);
  }

  /** Open a scope whose SCOPED services live until the scope is closed. */
  public ServiceScope createScope() {
    return new ServiceScope(this);
  }

  private Object resolveBlocking(ServiceDescriptor descriptor, ServiceResolver via) {
    Object ready = readyInstance(descriptor);
    if (ready != null) {
      return ready;
    }
    String token = descriptor.token();
    requireNotConstructingOnThisThread(token);
    CompletableFuture<Object> pending = inFlight.get(token);
    if (pending != null) {
      if (isAsyncBacked(descriptor) && !pending.isDone()) {
        throw new AsyncAccessedSynchronouslyException(token);
      }
      return awaitBlocking(token, pending);
    }
    return joinConstructed(descriptor, construct(descriptor, via));
  }

  private CompletableFuture<Object> resolveNonBlocking(
      ServiceDescriptor descriptor, ServiceResolver via) {
    Object ready = readyInstance(descriptor);
    if (ready != null) {
      return CompletableFuture.completedFuture(ready);
    }
    String token = descriptor.token();
    requireNotConstructingOnThisThread(token);
    CompletableFuture<Object> pending = inFlight.get(token);
    if (pending != null) {
      log.debug("Service {} is in flight, waiting for it", token);
      return awaitAsync(token, pending);
    }
    return construct(descriptor, via);
  }

  /** Value or cached singleton, or {@code null} when construction is needed. */
  private Object readyInstance(ServiceDescriptor descriptor) {
    String token = descriptor.token();
    return switch (descriptor.lifecycle()) {
      case VALUE -> {
        Object value = values.get(token);
        if (value == null) {
          throw new ServiceNotFoundException(
              token, "Service '" + token + "' is registered but has not been provided yet");
        }
        yield value;
      }
      case SINGLETON -> singletons.get(token);
      default -> null;
    };
  }

  /**
   * Phase check, cycle check, then run the factory. For singletons the returned future is the
   * in-flight slot other callers wait on; losing the race returns the winner's slot.
   */
  CompletableFuture<Object> construct(ServiceDescriptor descriptor, ServiceResolver via) {
    String token = descriptor.token();
    checkPhase(descriptor);
    checkCycles(token);

    CompletableFuture<Object> slot = new CompletableFuture<>();
    if (descriptor.lifecycle() == ServiceLifecycle.SINGLETON) {
      CompletableFuture<Object> existing = inFlight.putIfAbsent(token, slot);
      if (existing != null) {
        return awaitAsync(token, existing);
      }
      Object cached = singletons.get(token);
      if (cached != null) {
        inFlight.remove(token, slot);
        slot.complete(cached);
        return slot;
      }
    }

    Object produced;
    Deque<String> stack = constructing.get();
    stack.push(token);
    try {
      log.debug("Constructing service: {}", token);
      produced =
          descriptor.isAsync()
              ? descriptor.asyncFactory().create(via)
              : descriptor.factory().create(via);
    } catch (Exception e) {
      RuntimeException failure = initializationFailure(token, e);
      fail(descriptor, slot, failure);
      throw failure;
    } finally {
      stack.pop();
    }

    if (!descriptor.isAsync()) {
      if (!(produced instanceof CompletionStage<?>)) {
        finish(descriptor, slot, produced);
        return slot;
      }
      log.warn("Factory for {} returned a promise, completing it as an async service", token);
      promiseBacked.add(token);
    }
    if (produced == null) {
      fail(
          descriptor,
          slot,
          new ServiceInitializationException(token, "async factory returned no future"));
      return slot;
    }
    ((CompletionStage<?>) produced)
        .whenComplete(
            (value, error) -> {
              if (error != null) {
                fail(descriptor, slot, initializationFailure(token, unwrap(error)));
              } else {
                finish(descriptor, slot, value);
              }
            });
    return slot;
  }

  /** Turn a freshly constructed slot into a value for a synchronous caller. */
  Object joinConstructed(ServiceDescriptor descriptor, CompletableFuture<Object> slot) {
    if (!slot.isDone()) {
      if (isAsyncBacked(descriptor)) {
        throw new AsyncAccessedSynchronouslyException(descriptor.token());
      }
      return awaitBlocking(descriptor.token(), slot);
    }
    try {
      return slot.join();
    } catch (CompletionException | CancellationException e) {
      throw propagate(descriptor.token(), unwrap(e));
    }
  }

  private boolean isAsyncBacked(ServiceDescriptor descriptor) {
    return descriptor.isAsync() || promiseBacked.contains(descriptor.token());
  }

  private void finish(ServiceDescriptor descriptor, CompletableFuture<Object> slot, Object value) {
    String token = descriptor.token();
    if (value == null) {
      fail(descriptor, slot, new ServiceInitializationException(token, "factory returned null"));
      return;
    }
    if (descriptor.lifecycle() == ServiceLifecycle.SINGLETON) {
      // cache before clearing the in-flight slot so callers always find one or the other
      singletons.put(token, value);
      constructionOrder.push(token);
      completed.add(token);
      inFlight.remove(token, slot);
    }
    log.debug("Constructed service: {} ({})", token, descriptor.lifecycle());
    slot.complete(value);
  }

  private void fail(
      ServiceDescriptor descriptor, CompletableFuture<Object> slot, RuntimeException failure) {
    if (descriptor.lifecycle() == ServiceLifecycle.SINGLETON) {
      inFlight.remove(descriptor.token(), slot);
    }
    log.error("Failed to construct service: {}", descriptor.token(), failure);
    slot.completeExceptionally(failure);
  }

  private Object awaitBlocking(String token, CompletableFuture<Object> pending) {
    try {
      return pending.get(initTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new ServiceInitTimeoutException(token, initTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ServiceInitializationException(token, e);
    } catch (ExecutionException | CancellationException e) {
      throw propagate(token, unwrap(e));
    }
  }

  private CompletableFuture<Object> awaitAsync(String token, CompletableFuture<Object> pending) {
    return pending
        .thenApply(Function.identity())
        .orTimeout(initTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (value, error) -> {
              if (error == null) {
                return value;
              }
              Throwable cause = unwrap(error);
              if (cause instanceof TimeoutException) {
                throw new ServiceInitTimeoutException(token, initTimeout);
              }
              throw propagate(token, cause);
            });
  }

  // ---------------------------------------------------------------- checks

  private void checkPhase(ServiceDescriptor descriptor) {
    ServicePhase phase = currentPhase.get();
    if (!phase.permits(descriptor.phase())) {
      throw new PhaseViolationException(descriptor.token(), descriptor.phase(), phase);
    }
  }

  /** Depth-first walk of declared dependencies. */
  private void checkCycles(String token) {
    visit(token, new ArrayList<>(), new HashSet<>());
  }

  private void visit(String token, List<String> chain, Set<String> verified) {
    if (chain.contains(token)) {
      List<String> cycle = new ArrayList<>(chain);
      cycle.add(token);
      throw new CircularDependencyException(cycle);
    }
    if (verified.contains(token)) {
      return;
    }
    ServiceDescriptor descriptor = descriptors.get(token);
    if (descriptor == null) {
      return;
    }
    chain.add(token);
    for (String dependency : descriptor.dependencies()) {
      visit(dependency, chain, verified);
    }
    chain.remove(chain.size() - 1);
    verified.add(token);
  }

  /** Catches factories that resolve themselves without declaring it. */
  void requireNotConstructingOnThisThread(String token) {
    Deque<String> stack = constructing.get();
    if (!stack.contains(token)) {
      return;
    }
    List<String> path = new ArrayList<>(stack);
    Collections.reverse(path);
    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(token), path.size()));
    cycle.add(token);
    throw new CircularDependencyException(cycle);
  }

  // ---------------------------------------------------------------- introspection

  public List<ServiceInfo> listDescriptors() {
    List<ServiceInfo> infos = new ArrayList<>();
    for (String token : registrationOrder) {
      ServiceDescriptor d = descriptors.get(token);
      infos.add(
          new ServiceInfo(
              token, d.lifecycle(), d.phase(), d.dependencies(), d.isAsync(), isResolved(d)));
    }
    return infos;
  }

  public Optional<ServiceDescriptor> getDescriptor(String token) {
    return Optional.ofNullable(descriptors.get(token));
  }

  /** True once a singleton has finished construction or a value has been provided. */
  public boolean isResolved(String token) {
    ServiceDescriptor descriptor = descriptors.get(token);
    return descriptor != null && isResolved(descriptor);
  }

  private boolean isResolved(ServiceDescriptor descriptor) {
    return switch (descriptor.lifecycle()) {
      case VALUE -> values.containsKey(descriptor.token());
      case SINGLETON -> completed.contains(descriptor.token());
      default -> false;
    };
  }

  public boolean isInFlight(String token) {
    return inFlight.containsKey(token);
  }

  ServiceDescriptor requireDescriptor(String token) {
    ServiceDescriptor descriptor = descriptors.get(token);
    if (descriptor == null) {
      throw new ServiceNotFoundException(token);
    }
    return descriptor;
  }

  // ---------------------------------------------------------------- shutdown

  /**
   * Close every constructed singleton that is {@link AutoCloseable}, newest first. Values are
   * owned by whoever supplied them and are left alone.
   */
  @Override
  public void close() {
    RuntimeException failure = null;
    String token;
    while ((token = constructionOrder.poll()) != null) {
      Object instance = singletons.get(token);
      if (!(instance instanceof AutoCloseable closeable)) {
        continue;
      }
      try {
        closeable.close();
        log.debug("Closed service: {}", token);
      } catch (Exception e) {
        log.error("Failed to close service: {}", token, e);
        if (failure == null) {
          failure = new IllegalStateException("Failed to close service '" + token + "'", e);
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    singletons.clear();
    completed.clear();
    if (failure != null) {
      throw failure;
    }
  }

  // ---------------------------------------------------------------- helpers

  private static IllegalStateException scopeRequired(String token) {
    return new IllegalStateException(
        "Scoped service '" + token + "' must be resolved from a ServiceScope");
  }

  private static RuntimeException initializationFailure(String token, Throwable error) {
    if (error instanceof ServiceRegistryException registryError) {
      return registryError;
    }
    return new ServiceInitializationException(token, error);
  }

  static RuntimeException propagate(String token, Throwable cause) {
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    return new ServiceInitializationException(token, cause);
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  @SuppressWarnings("unchecked")
  static <T> T cast(Object instance) {
    return (T) instance;
  }
}
