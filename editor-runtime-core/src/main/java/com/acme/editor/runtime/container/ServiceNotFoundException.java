package com.acme.editor.runtime.container;

public class ServiceNotFoundException extends ServiceRegistryException {
  public ServiceNotFoundException(String token) {
    super(token, "Service '" + token + "' not found in registry");
  }

  public ServiceNotFoundException(String token, String message) {
    super(token, message);
  }
}
