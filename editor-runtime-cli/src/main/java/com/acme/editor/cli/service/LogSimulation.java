package com.acme.editor.cli.service;

import java.util.List;

/**
 * Outcome of {@code log simulate}.
 *
 * @param matchesFullReplay {@code null} when the events needed for a full replay were compacted
 */
public record LogSimulation(
        int eventsAppended,
        long headSequence,
        int retainedEvents,
        long firstRetainedSequence,
        List<Long> snapshotSequences,
        long targetSequence,
        long snapshotUsed,
        int eventsReplayed,
        Boolean matchesFullReplay) {
}
