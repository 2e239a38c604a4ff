package com.acme.editor.runtime.container;

import java.util.concurrent.CompletionStage;

/**
 * Builds a service asynchronously. Services registered with an async factory can only be
 * resolved synchronously once their construction has completed.
 */
@FunctionalInterface
public interface AsyncServiceFactory<T> {
  CompletionStage<T> create(ServiceResolver resolver) throws Exception;
}
