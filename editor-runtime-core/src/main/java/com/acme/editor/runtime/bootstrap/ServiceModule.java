package com.acme.editor.runtime.bootstrap;

import com.acme.editor.runtime.container.ServicePhase;
import com.acme.editor.runtime.container.ServiceRegistry;
import java.util.List;

/**
 * A feature's contribution to the runtime: explicit registrations run once during bootstrap, in
 * phase order.
 */
public interface ServiceModule {

  /** Phase the module's services belong to; modules are registered in phase order. */
  ServicePhase phase();

  void register(ServiceRegistry registry);

  /** Tokens constructed as soon as the registry enters {@link #phase()}. */
  default List<String> eagerTokens() {
    return List.of();
  }
}
