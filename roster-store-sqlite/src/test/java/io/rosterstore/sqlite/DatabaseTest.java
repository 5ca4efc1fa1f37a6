package io.rosterstore.sqlite;

import io.rosterstore.core.RosterStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseTest {

    @TempDir
    Path tempDir;

    private Database database;

    @BeforeEach
    void setUp() {
        database = Database.open(tempDir.resolve("nested").resolve("test.sqlite"));
        database.execute("create table", connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate("CREATE TABLE t (k TEXT PRIMARY KEY)");
            }
        });
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void commitsWhenWorkReturns() {
        database.execute("insert", connection -> insert(connection, "a"));

        assertThat(count()).isEqualTo(1);
    }

    @Test
    void rollsBackWhenWorkThrows() {
        assertThatThrownBy(() -> database.execute("insert", connection -> {
            insert(connection, "a");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(count()).isZero();
    }

    @Test
    void rollsBackWhenWorkThrowsAnError() {
        assertThatThrownBy(() -> database.execute("insert", connection -> {
            insert(connection, "a");
            throw new StackOverflowError();
        })).isInstanceOf(StackOverflowError.class);

        assertThat(count()).isZero();
        database.execute("insert", connection -> insert(connection, "b"));
        assertThat(count()).isEqualTo(1);
    }

    @Test
    void wrapsSqlFailures() {
        assertThatThrownBy(() -> database.execute("query missing table", connection -> {
            insert(connection, "a");
            try (Statement statement = connection.createStatement()) {
                statement.executeQuery("SELECT * FROM missing");
            }
        }))
                .isInstanceOf(RosterStoreException.StorageFailure.class)
                .hasMessage("Failed to query missing table")
                .hasCauseInstanceOf(SQLException.class);

        assertThat(count()).isZero();
    }

    @Test
    void recognisesConstraintViolations() {
        database.execute("insert", connection -> insert(connection, "a"));

        boolean violation = database.inTransaction("insert duplicate", connection -> {
            try {
                insert(connection, "a");
                return false;
            } catch (SQLException e) {
                return Database.isConstraintViolation(e);
            }
        });

        assertThat(violation).isTrue();
    }

    private static void insert(java.sql.Connection connection, String key) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("INSERT INTO t (k) VALUES (?)")) {
            statement.setString(1, key);
            statement.executeUpdate();
        }
    }

    private long count() {
        return database.inTransaction("count", connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT count(*) FROM t")) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }
}
