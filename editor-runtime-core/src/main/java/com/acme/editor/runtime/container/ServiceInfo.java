package com.acme.editor.runtime.container;

import java.util.List;

/** Read-only view of a registration, for diagnostics. */
public record ServiceInfo(
    String token,
    ServiceLifecycle lifecycle,
    ServicePhase phase,
    List<String> dependencies,
    boolean async,
    boolean resolved) {}
