package io.rosterstore.sqlite;

import io.rosterstore.core.JournalOperations;
import io.rosterstore.core.RosterStoreException;
import io.rosterstore.core.Subscription;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The roster as callers see it: live items joined with their journal version.
 *
 * <p>Writes go through the three item intents below. Each one changes {@code rosteritem} and
 * appends one journal row for the pair, on the caller's transaction. Group changes made in the
 * same transaction are passed in as descriptors and recorded in that same row, so one operation
 * moves the pair's version exactly once.
 */
final class RosterView {

    private static final String SELECT_ROWS = """
                                              SELECT contactid, contact_jid, name, subscription, version
                                              FROM rosterview
                                              """;

    private final RosterJournal journal;

    RosterView(RosterJournal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    record Row(long contactId, String contact, String name, int subscription, long version) {
        boolean isTombstone() {
            return (subscription & Subscription.TOMBSTONE) != 0;
        }
    }

    Optional<Row> find(Connection connection, long ownerId, long contactId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                SELECT_ROWS + "WHERE userid = ? AND contactid = ?")) {
            statement.setLong(1, ownerId);
            statement.setLong(2, contactId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(readRow(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Owner's rows with a version above {@code sinceVersion}, ordered by (version, contact id).
     */
    List<Row> rows(Connection connection, long ownerId, long sinceVersion) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                SELECT_ROWS + "WHERE userid = ? AND version > ? ORDER BY version, contactid")) {
            statement.setLong(1, ownerId);
            statement.setLong(2, sinceVersion);
            try (ResultSet rs = statement.executeQuery()) {
                List<Row> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(readRow(rs));
                }
                return rows;
            }
        }
    }

    /**
     * @return the new version
     */
    long addItem(Connection connection, long ownerId, long contactId, String name, int subscription,
                 List<String> groupOps) throws SQLException {
        long version = journal.append(connection, ownerId, contactId,
                JournalOperations.combine(JournalOperations.insert(name, subscription), groupOps));
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO rosteritem (userid, contactid, name, subscription) VALUES (?, ?, ?, ?)")) {
            statement.setLong(1, ownerId);
            statement.setLong(2, contactId);
            statement.setString(3, name);
            statement.setInt(4, subscription);
            statement.executeUpdate();
        }
        return version;
    }

    /**
     * Overwrite name and subscription of an existing row. The journal row records the prior values.
     *
     * @return the new version
     */
    long updateItem(Connection connection, long ownerId, Row prior, String name, int subscription,
                    List<String> groupOps) throws SQLException {
        long version = journal.append(connection, ownerId, prior.contactId(),
                JournalOperations.combine(JournalOperations.update(prior.name(), prior.subscription()), groupOps));
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE rosteritem SET name = ?, subscription = ? WHERE userid = ? AND contactid = ?")) {
            statement.setString(1, name);
            statement.setInt(2, subscription);
            statement.setLong(3, ownerId);
            statement.setLong(4, prior.contactId());
            if (statement.executeUpdate() != 1) {
                throw new RosterStoreException.InconsistentState(
                        "Roster item " + prior.contact() + " disappeared during update");
            }
        }
        return version;
    }

    /**
     * Two-phase delete: a live row becomes a journaled tombstone, a tombstone is deleted outright.
     *
     * @return the new version, or empty when the row was physically deleted
     */
    OptionalLong removeItem(Connection connection, long ownerId, Row prior, List<String> groupOps) throws SQLException {
        if (prior.isTombstone()) {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM rosteritem WHERE userid = ? AND contactid = ?")) {
                statement.setLong(1, ownerId);
                statement.setLong(2, prior.contactId());
                statement.executeUpdate();
            }
            return OptionalLong.empty();
        }
        long version = journal.append(connection, ownerId, prior.contactId(),
                JournalOperations.combine(JournalOperations.delete(prior.name(), prior.subscription()), groupOps));
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE rosteritem SET subscription = subscription | ? WHERE userid = ? AND contactid = ?")) {
            statement.setInt(1, Subscription.TOMBSTONE);
            statement.setLong(2, ownerId);
            statement.setLong(3, prior.contactId());
            if (statement.executeUpdate() != 1) {
                throw new RosterStoreException.InconsistentState(
                        "Roster item " + prior.contact() + " disappeared during removal");
            }
        }
        return OptionalLong.of(version);
    }

    private static Row readRow(ResultSet rs) throws SQLException {
        return new Row(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getInt(4), rs.getLong(5));
    }
}
