package com.acme.editor.runtime.event;

import java.time.Instant;

/** Materialized state valid as of exactly {@code sequence}. */
public record Snapshot<S>(long sequence, S state, Instant timestamp) {}
