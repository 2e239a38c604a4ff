package com.acme.editor.runtime.container;

/** A factory threw, returned null, or its future failed. */
public class ServiceInitializationException extends ServiceRegistryException {
  public ServiceInitializationException(String token, String message) {
    super(token, "Failed to initialize service '" + token + "': " + message);
  }

  public ServiceInitializationException(String token, Throwable cause) {
    super(token, "Failed to initialize service '" + token + "': " + cause.getMessage(), cause);
  }
}
