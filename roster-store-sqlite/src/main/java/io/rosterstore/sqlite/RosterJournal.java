package io.rosterstore.sqlite;

import io.rosterstore.core.JournalEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only log of roster mutations.
 *
 * <p>{@code entry} is AUTOINCREMENT, so numbers are never reused even after rows are pruned.
 * The largest entry of a pair is that item's version.
 */
final class RosterJournal {

    private final Clock clock;

    RosterJournal(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    long append(Connection connection, long ownerId, long contactId, String operation) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO journal (userid, contactid, timestamp, operation) VALUES (?, ?, ?, ?)")) {
            statement.setLong(1, ownerId);
            statement.setLong(2, contactId);
            statement.setLong(3, clock.millis());
            statement.setString(4, operation);
            statement.executeUpdate();
        }
        return Sql.lastInsertId(connection);
    }

    /**
     * Largest entry number ever written for the owner, 0 if none. Never decreases: rows are only
     * pruned below each owner's newest entry.
     */
    long highWaterMark(Connection connection, long ownerId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT ifnull(max(entry), 0) FROM journal WHERE userid = ?")) {
            statement.setLong(1, ownerId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    List<JournalEntry> entries(Connection connection, long ownerId, long contactId, String owner, String contact) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT entry, timestamp, operation FROM journal WHERE userid = ? AND contactid = ? ORDER BY entry")) {
            statement.setLong(1, ownerId);
            statement.setLong(2, contactId);
            try (ResultSet rs = statement.executeQuery()) {
                List<JournalEntry> entries = new ArrayList<>();
                while (rs.next()) {
                    entries.add(new JournalEntry(rs.getLong(1), owner, contact,
                            Instant.ofEpochMilli(rs.getLong(2)), rs.getString(3)));
                }
                return entries;
            }
        }
    }

    /**
     * Delete rows older than {@code cutoff} whose pair no longer has a roster item. Each owner's
     * newest row is kept so the owner's version high-water mark survives.
     */
    int pruneOrphans(Connection connection, Instant cutoff) throws SQLException {
        String sql = """
                     DELETE FROM journal
                     WHERE timestamp < ?
                       AND NOT EXISTS (SELECT 1 FROM rosteritem r
                                       WHERE r.userid = journal.userid AND r.contactid = journal.contactid)
                       AND entry NOT IN (SELECT max(entry) FROM journal GROUP BY userid)
                     """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, cutoff.toEpochMilli());
            return statement.executeUpdate();
        }
    }
}
