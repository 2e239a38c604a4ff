package com.acme.editor.runtime.container;

import java.util.List;

public class CircularDependencyException extends ServiceRegistryException {
  private final List<String> chain;

  /**
   * @param chain resolution path ending with the token that reappeared, e.g. {@code [A, B, A]}
   */
  public CircularDependencyException(List<String> chain) {
    super(
        chain.get(chain.size() - 1),
        "Circular dependency detected: " + String.join(" -> ", chain));
    this.chain = List.copyOf(chain);
  }

  public List<String> getChain() {
    return chain;
  }
}
