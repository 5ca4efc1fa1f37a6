package io.rosterstore.sqlite;

import io.rosterstore.core.RosterStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-owner named groups and group membership.
 *
 * <p>Groups are created on first use of a name and never renamed. Membership changes do not write
 * the journal themselves; callers fold them into the pair's journal row.
 */
final class GroupCatalog {

    record Group(long id, String name) {
    }

    long resolveGroup(Connection connection, long ownerId, String name) throws SQLException {
        OptionalLong existing = findGroup(connection, ownerId, name);
        if (existing.isPresent()) {
            return existing.getAsLong();
        }
        return allocateGroup(connection, ownerId, name);
    }

    long allocateGroup(Connection connection, long ownerId, String name) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO rostergroup (groupid, userid, name) VALUES (NULL, ?, ?)")) {
            statement.setLong(1, ownerId);
            statement.setString(2, name);
            statement.executeUpdate();
        } catch (SQLException e) {
            if (!Database.isConstraintViolation(e)) {
                throw e;
            }
            return findGroup(connection, ownerId, name).orElseThrow(() ->
                    new RosterStoreException.InconsistentState("Group '" + name + "' vanished after allocation race"));
        }
        return Sql.lastInsertId(connection);
    }

    /**
     * Groups the owner has placed this contact into.
     */
    List<Group> membersOf(Connection connection, long ownerId, long contactId) throws SQLException {
        String sql = """
                     SELECT rg.groupid, rg.name
                     FROM rostergroup rg, groupitem gi
                     WHERE rg.userid = ? AND gi.groupid = rg.groupid AND gi.contactid = ?
                     ORDER BY rg.name
                     """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, ownerId);
            statement.setLong(2, contactId);
            try (ResultSet rs = statement.executeQuery()) {
                List<Group> groups = new ArrayList<>();
                while (rs.next()) {
                    groups.add(new Group(rs.getLong(1), rs.getString(2)));
                }
                return groups;
            }
        }
    }

    /**
     * Group names of every contact in the owner's groups, keyed by contact id.
     */
    Map<Long, Set<String>> groupsByContact(Connection connection, long ownerId) throws SQLException {
        String sql = """
                     SELECT gi.contactid, rg.name
                     FROM rostergroup rg, groupitem gi
                     WHERE rg.userid = ? AND gi.groupid = rg.groupid
                     """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, ownerId);
            try (ResultSet rs = statement.executeQuery()) {
                Map<Long, Set<String>> groups = new HashMap<>();
                while (rs.next()) {
                    groups.computeIfAbsent(rs.getLong(1), id -> new TreeSet<>()).add(rs.getString(2));
                }
                return groups;
            }
        }
    }

    /**
     * @return true if the contact was not already a member
     */
    boolean addMember(Connection connection, long groupId, long contactId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT OR IGNORE INTO groupitem (groupid, contactid) VALUES (?, ?)")) {
            statement.setLong(1, groupId);
            statement.setLong(2, contactId);
            return statement.executeUpdate() > 0;
        }
    }

    int removeMember(Connection connection, Collection<Long> groupIds, long contactId) throws SQLException {
        if (groupIds.isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM groupitem WHERE groupid IN (" + Sql.placeholders(groupIds) + ") AND contactid = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            Sql.bindLongs(statement, 1, groupIds);
            statement.setLong(groupIds.size() + 1, contactId);
            return statement.executeUpdate();
        }
    }

    /**
     * Drop every group of the owner together with its memberships.
     */
    int removeAll(Connection connection, long ownerId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "DELETE FROM groupitem WHERE groupid IN (SELECT groupid FROM rostergroup WHERE userid = ?)")) {
            statement.setLong(1, ownerId);
            statement.executeUpdate();
        }
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM rostergroup WHERE userid = ?")) {
            statement.setLong(1, ownerId);
            return statement.executeUpdate();
        }
    }

    /**
     * Drop the owner's groups that have no members left.
     */
    int collectEmpty(Connection connection, long ownerId) throws SQLException {
        String sql = """
                     DELETE FROM rostergroup
                     WHERE userid = ? AND NOT EXISTS (SELECT 1 FROM groupitem gi WHERE gi.groupid = rostergroup.groupid)
                     """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, ownerId);
            return statement.executeUpdate();
        }
    }

    private OptionalLong findGroup(Connection connection, long ownerId, String name) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT groupid FROM rostergroup WHERE userid = ? AND name = ?")) {
            statement.setLong(1, ownerId);
            statement.setString(2, name);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        }
    }
}
