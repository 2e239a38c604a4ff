package com.acme.editor.runtime.container;

import java.util.List;

/**
 * Immutable registration record. Exactly one of {@code factory} and {@code asyncFactory} is set,
 * except for {@link ServiceLifecycle#VALUE} descriptors, which have neither.
 */
public record ServiceDescriptor(
    String token,
    ServiceLifecycle lifecycle,
    ServicePhase phase,
    List<String> dependencies,
    ServiceFactory<?> factory,
    AsyncServiceFactory<?> asyncFactory) {

  public ServiceDescriptor {
    dependencies = List.copyOf(dependencies);
  }

  static ServiceDescriptor sync(String token, ServiceFactory<?> factory, ServiceOptions options) {
    return new ServiceDescriptor(
        token,
        options.getLifecycle(),
        options.getPhase(),
        options.getDependencies(),
        factory,
        null);
  }

  static ServiceDescriptor async(
      String token, AsyncServiceFactory<?> factory, ServiceOptions options) {
    return new ServiceDescriptor(
        token,
        options.getLifecycle(),
        options.getPhase(),
        options.getDependencies(),
        null,
        factory);
  }

  static ServiceDescriptor value(String token, ServicePhase phase) {
    return new ServiceDescriptor(token, ServiceLifecycle.VALUE, phase, List.of(), null, null);
  }

  public boolean isAsync() {
    return asyncFactory != null;
  }
}
