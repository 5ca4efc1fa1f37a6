package io.rosterstore.sqlite;

import io.rosterstore.core.RosterStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.OptionalLong;

/**
 * Maps bare addresses to the small integer ids used as foreign keys everywhere else.
 *
 * <p>Ids are allocated once and never reused. A concurrent writer allocating the same address
 * loses on the UNIQUE constraint; the loser re-reads and returns the winner's id.
 */
final class IdentityInterner {

    OptionalLong find(Connection connection, String address) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT jidid FROM jidmap WHERE jid = ?")) {
            statement.setString(1, address);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        }
    }

    long resolve(Connection connection, String address) throws SQLException {
        OptionalLong existing = find(connection, address);
        if (existing.isPresent()) {
            return existing.getAsLong();
        }
        return allocate(connection, address);
    }

    /**
     * Insert the address; if another writer got there first, return its id instead.
     */
    long allocate(Connection connection, String address) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("INSERT INTO jidmap (jidid, jid) VALUES (NULL, ?)")) {
            statement.setString(1, address);
            statement.executeUpdate();
        } catch (SQLException e) {
            if (!Database.isConstraintViolation(e)) {
                throw e;
            }
            return find(connection, address).orElseThrow(() ->
                    new RosterStoreException.IdentityResolutionFailure("Lost allocation race for " + address, e));
        }
        return Sql.lastInsertId(connection);
    }
}
