package com.acme.editor.runtime.container;

/** Builds a service, pulling its dependencies from the resolver it is handed. */
@FunctionalInterface
public interface ServiceFactory<T> {
  T create(ServiceResolver resolver) throws Exception;
}
