package io.rosterstore.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the roster journal. {@code entryNo} is the global version clock.
 */
public record JournalEntry(
        long entryNo,
        String owner,
        String contact,
        Instant timestamp,
        String operation
) {
    public JournalEntry {
        if (entryNo <= 0) throw new IllegalArgumentException("entryNo must be positive");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(contact, "contact");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(operation, "operation");
    }
}
