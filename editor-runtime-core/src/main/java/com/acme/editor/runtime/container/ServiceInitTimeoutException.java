package com.acme.editor.runtime.container;

import java.time.Duration;

public class ServiceInitTimeoutException extends ServiceRegistryException {
  private final Duration timeout;

  public ServiceInitTimeoutException(String token, Duration timeout) {
    super(
        token,
        "Timed out after " + timeout.toMillis() + "ms waiting for service '" + token + "'");
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
