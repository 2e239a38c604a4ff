package com.acme.editor.runtime.history;

import java.time.Instant;

/** Named bookmark into the event log. */
public record Checkpoint(String id, long sequence, Instant timestamp) {}
