package com.acme.editor.runtime.container;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Registration metadata: lifecycle, declared dependencies and bootstrap phase. Immutable; each
 * modifier returns a copy.
 *
 * <pre>
 * registry.register("historyManager", r -&gt; new HistoryManager(...),
 *     ServiceOptions.singleton()
 *         .inPhase(ServicePhase.INFRASTRUCTURE)
 *         .dependsOn("eventLog", "inverseEvents"));
 * </pre>
 */
public final class ServiceOptions {
  private final ServiceLifecycle lifecycle;
  private final ServicePhase phase;
  private final List<String> dependencies;

  private ServiceOptions(
      ServiceLifecycle lifecycle, ServicePhase phase, List<String> dependencies) {
    this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
    this.phase = Objects.requireNonNull(phase, "phase");
    this.dependencies = List.copyOf(dependencies);
  }

  public static ServiceOptions of(ServiceLifecycle lifecycle) {
    return new ServiceOptions(lifecycle, ServicePhase.CORE, List.of());
  }

  public static ServiceOptions singleton() {
    return of(ServiceLifecycle.SINGLETON);
  }

  public static ServiceOptions transientService() {
    return of(ServiceLifecycle.TRANSIENT);
  }

  public static ServiceOptions scoped() {
    return of(ServiceLifecycle.SCOPED);
  }

  public ServiceOptions inPhase(ServicePhase newPhase) {
    return new ServiceOptions(lifecycle, newPhase, dependencies);
  }

  public ServiceOptions dependsOn(String... tokens) {
    List<String> merged = new ArrayList<>(dependencies);
    merged.addAll(Arrays.asList(tokens));
    return new ServiceOptions(lifecycle, phase, merged);
  }

  public ServiceLifecycle getLifecycle() {
    return lifecycle;
  }

  public ServicePhase getPhase() {
    return phase;
  }

  public List<String> getDependencies() {
    return dependencies;
  }
}
