package com.acme.editor.runtime.bootstrap;

import com.acme.editor.runtime.bus.EventBus;
import com.acme.editor.runtime.bus.EventLogBridge;
import com.acme.editor.runtime.config.RuntimeConfig;
import com.acme.editor.runtime.container.ServicePhase;
import com.acme.editor.runtime.container.ServiceRegistry;
import com.acme.editor.runtime.core.ServiceTokens;
import com.acme.editor.runtime.event.EventLog;
import com.acme.editor.runtime.event.EventTypeCounts;
import com.acme.editor.runtime.event.Projector;
import com.acme.editor.runtime.event.SnapshotStore;
import com.acme.editor.runtime.history.CheckpointRegistry;
import com.acme.editor.runtime.history.HistoryManager;
import com.acme.editor.runtime.history.InverseEventRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the runtime: registers every subsystem in declared phase order, then walks the registry
 * through CORE, INFRASTRUCTURE and APPLICATION, constructing each phase's eager services, and
 * leaves it at COMPLETE.
 */
public class RuntimeBootstrap {
  private static final Logger log = LoggerFactory.getLogger(RuntimeBootstrap.class);

  private final RuntimeConfig config;
  private final List<ServiceModule> modules = new ArrayList<>();
  private Projector<?> projector = new EventTypeCounts();
  private Clock clock = Clock.systemUTC();

  public RuntimeBootstrap(RuntimeConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public RuntimeBootstrap withModule(ServiceModule module) {
    ServicePhase phase = Objects.requireNonNull(module, "module").phase();
    if (phase == ServicePhase.CORE || phase == ServicePhase.COMPLETE) {
      throw new IllegalArgumentException(
          "Modules contribute to INFRASTRUCTURE or APPLICATION, not " + phase);
    }
    modules.add(module);
    return this;
  }

  /** Projection materialized by snapshots; defaults to per-type event counts. */
  public RuntimeBootstrap withProjector(Projector<?> projector) {
    this.projector = Objects.requireNonNull(projector, "projector");
    return this;
  }

  public RuntimeBootstrap withClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    return this;
  }

  /**
   * Registers and starts everything. On failure the partially built registry is closed and the
   * error rethrown.
   */
  public ServiceRegistry boot() {
    ServiceRegistry registry = new ServiceRegistry(config.getRegistry().getInitTimeout());
    try {
      Map<ServicePhase, List<String>> eager = register(registry);
      for (ServicePhase phase :
          List.of(ServicePhase.CORE, ServicePhase.INFRASTRUCTURE, ServicePhase.APPLICATION)) {
        registry.advancePhase(phase);
        for (String token : eager.getOrDefault(phase, List.of())) {
          registry.resolveSync(token);
        }
      }
      registry.advancePhase(ServicePhase.COMPLETE);
      log.info("Runtime booted with {} services", registry.listDescriptors().size());
      return registry;
    } catch (RuntimeException e) {
      log.error("Runtime bootstrap failed in phase {}", registry.currentPhase(), e);
      closeQuietly(registry, e);
      throw e;
    }
  }

  private Map<ServicePhase, List<String>> register(ServiceRegistry registry) {
    Map<ServicePhase, List<String>> eager = new EnumMap<>(ServicePhase.class);
    registerCore(registry, eager);
    registerInfrastructure(registry, eager);
    registry.registerDeferred(ServiceTokens.CANVAS_SURFACE, ServicePhase.APPLICATION);

    List<ServiceModule> ordered = new ArrayList<>(modules);
    ordered.sort(Comparator.comparing(ServiceModule::phase));
    for (ServiceModule module : ordered) {
      log.debug("Registering module {} ({})", module.getClass().getSimpleName(), module.phase());
      module.register(registry);
      eager.computeIfAbsent(module.phase(), p -> new ArrayList<>()).addAll(module.eagerTokens());
    }
    return eager;
  }

  private void registerCore(ServiceRegistry registry, Map<ServicePhase, List<String>> eager) {
    RuntimeConfig.EventLogSettings logSettings = config.getEventLog();
    registry.registerValue(ServiceTokens.RUNTIME_CONFIG, config);
    registry.registerSingleton(
        ServiceTokens.SNAPSHOT_STORE,
        r -> new SnapshotStore<>(projector, logSettings.getMaxSnapshots(), clock),
        ServicePhase.CORE);
    registry.registerSingleton(
        ServiceTokens.EVENT_LOG,
        r -> new EventLog(logSettings, r.resolveSync(ServiceTokens.SNAPSHOT_STORE), clock),
        ServicePhase.CORE,
        ServiceTokens.SNAPSHOT_STORE);
    registry.registerSingleton(
        ServiceTokens.EVENT_BUS,
        r -> new EventBus(config.getEventBus().getMaxListeners()),
        ServicePhase.CORE);
    eager.put(
        ServicePhase.CORE,
        new ArrayList<>(
            List.of(ServiceTokens.SNAPSHOT_STORE, ServiceTokens.EVENT_LOG, ServiceTokens.EVENT_BUS)));
  }

  private void registerInfrastructure(
      ServiceRegistry registry, Map<ServicePhase, List<String>> eager) {
    registry.registerSingleton(
        ServiceTokens.EVENT_LOG_BRIDGE,
        r -> {
          EventLogBridge bridge =
              new EventLogBridge(
                  r.resolveSync(ServiceTokens.EVENT_LOG), r.resolveSync(ServiceTokens.EVENT_BUS));
          bridge.start();
          return bridge;
        },
        ServicePhase.INFRASTRUCTURE,
        ServiceTokens.EVENT_LOG,
        ServiceTokens.EVENT_BUS);
    registry.registerSingleton(
        ServiceTokens.INVERSE_EVENTS, r -> new InverseEventRegistry(), ServicePhase.INFRASTRUCTURE);
    registry.registerSingleton(
        ServiceTokens.HISTORY_MANAGER,
        r ->
            new HistoryManager(
                r.resolveSync(ServiceTokens.EVENT_LOG),
                r.resolveSync(ServiceTokens.INVERSE_EVENTS),
                config.getHistory().getMaxEntries(),
                clock),
        ServicePhase.INFRASTRUCTURE,
        ServiceTokens.EVENT_LOG,
        ServiceTokens.INVERSE_EVENTS);
    registry.registerSingleton(
        ServiceTokens.CHECKPOINT_REGISTRY,
        r ->
            new CheckpointRegistry(
                r.resolveSync(ServiceTokens.EVENT_LOG),
                r.resolveSync(ServiceTokens.HISTORY_MANAGER),
                clock),
        ServicePhase.INFRASTRUCTURE,
        ServiceTokens.EVENT_LOG,
        ServiceTokens.HISTORY_MANAGER);
    eager.put(
        ServicePhase.INFRASTRUCTURE,
        new ArrayList<>(
            List.of(
                ServiceTokens.EVENT_LOG_BRIDGE,
                ServiceTokens.HISTORY_MANAGER,
                ServiceTokens.CHECKPOINT_REGISTRY)));
  }

  private static void closeQuietly(ServiceRegistry registry, RuntimeException failure) {
    try {
      registry.close();
    } catch (RuntimeException closeFailure) {
      failure.addSuppressed(closeFailure);
    }
  }
}
