package com.acme.editor.runtime.container;

public class AsyncAccessedSynchronouslyException extends ServiceRegistryException {
  public AsyncAccessedSynchronouslyException(String token) {
    super(
        token,
        "Service '"
            + token
            + "' is still being constructed asynchronously; use resolveAsync instead");
  }
}
