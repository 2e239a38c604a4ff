package com.acme.editor.runtime.container;

/** Base type of every resolution failure raised by the registry. */
public class ServiceRegistryException extends RuntimeException {
  private final String token;

  public ServiceRegistryException(String token, String message) {
    super(message);
    this.token = token;
  }

  public ServiceRegistryException(String token, String message, Throwable cause) {
    super(message, cause);
    this.token = token;
  }

  /** Token whose resolution failed. */
  public String getToken() {
    return token;
  }
}
