package io.rosterstore.sqlite;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collection;
import java.util.Collections;

final class Sql {

    private Sql() {
    }

    static long lastInsertId(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next() || rs.getLong(1) <= 0) {
                throw new SQLException("No row id allocated");
            }
            return rs.getLong(1);
        }
    }

    /**
     * {@code ?,?,?} for an IN list of the given size.
     */
    static String placeholders(Collection<?> values) {
        return String.join(",", Collections.nCopies(values.size(), "?"));
    }

    static void bindLongs(PreparedStatement statement, int firstIndex, Collection<Long> values) throws SQLException {
        int index = firstIndex;
        for (long value : values) {
            statement.setLong(index++, value);
        }
    }
}
