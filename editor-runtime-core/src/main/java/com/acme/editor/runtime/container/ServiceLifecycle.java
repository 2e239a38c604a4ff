package com.acme.editor.runtime.container;

/** How the registry caches what a factory produces. */
public enum ServiceLifecycle {
  /** One instance per registry, constructed on first resolution */
  SINGLETON,

  /** A new instance on every resolution */
  TRANSIENT,

  /** One instance per {@link ServiceScope} */
  SCOPED,

  /** A constant supplied at registration or through {@link ServiceRegistry#update} */
  VALUE
}
