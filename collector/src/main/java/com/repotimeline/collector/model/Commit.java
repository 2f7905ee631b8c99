package com.repotimeline.collector.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single commit as returned by a platform provider.
 *
 * @param id        platform-native commit identifier (SHA or hash)
 * @param message   commit message
 * @param author    author display name
 * @param timestamp authoring or commit time, in UTC
 * @param merge     true when the commit has more than one parent
 */
public record Commit(
        String id,
        String message,
        String author,
        Instant timestamp,
        boolean merge
) {

    public Commit {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
