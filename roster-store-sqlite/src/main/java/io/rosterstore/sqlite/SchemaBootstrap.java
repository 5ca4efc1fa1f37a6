package io.rosterstore.sqlite;

import io.rosterstore.core.RosterStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the roster tables on first use. Safe to run on every start.
 */
final class SchemaBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(SchemaBootstrap.class);

    private static final String TABLE_ITEM = "rosteritem";

    /** Table name used before roster versioning existed; renamed in place. */
    private static final String LEGACY_ITEM_TABLE = "roster";

    /** Name prefix of the triggers the trigger-based store installed. */
    private static final String LEGACY_TRIGGER_PREFIX = "roster_ver_";

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS jidmap (
              jidid         INTEGER PRIMARY KEY AUTOINCREMENT NOT NULL,
              jid           VARCHAR(255) NOT NULL,
              UNIQUE (jid)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS rosteritem (
              userid        INTEGER NOT NULL REFERENCES jidmap,
              contactid     INTEGER NOT NULL REFERENCES jidmap,
              name          VARCHAR(255),
              subscription  INTEGER NOT NULL DEFAULT 0,
              PRIMARY KEY (userid, contactid)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS rostergroup (
              groupid       INTEGER PRIMARY KEY NOT NULL,
              userid        INTEGER NOT NULL REFERENCES jidmap,
              name          VARCHAR(255),
              UNIQUE (userid, name)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS groupitem (
              groupid       INTEGER NOT NULL REFERENCES rostergroup,
              contactid     INTEGER NOT NULL REFERENCES jidmap,
              PRIMARY KEY (groupid, contactid)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS journal (
              entry         INTEGER PRIMARY KEY AUTOINCREMENT NOT NULL,
              userid        INTEGER NOT NULL REFERENCES jidmap,
              contactid     INTEGER NOT NULL REFERENCES jidmap,
              timestamp     INTEGER NOT NULL,
              operation     VARCHAR(255) NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS journal_pair ON journal (userid, contactid, entry)",
            """
            CREATE VIEW IF NOT EXISTS rosterview AS
            SELECT r.userid AS userid, r.contactid AS contactid, r.name AS name, r.subscription AS subscription,
                   jmc.jid AS contact_jid, ifnull(rv.ver, 0) AS version
            FROM rosteritem r
                 INNER JOIN jidmap jmc ON jmc.jidid = r.contactid
                 LEFT OUTER JOIN (SELECT userid, contactid, max(entry) AS ver
                                  FROM journal GROUP BY userid, contactid) rv
                   ON rv.userid = r.userid AND rv.contactid = r.contactid
            """
    );

    private SchemaBootstrap() {
    }

    static void install(Database database) {
        database.execute("install roster schema", connection -> {
            migrateLegacyItemTable(connection);
            dropLegacyTriggers(connection);
            try (Statement statement = connection.createStatement()) {
                for (String sql : SCHEMA) {
                    statement.executeUpdate(sql);
                }
            }
            convertLegacyTimestamps(connection);
        });
        logger.info("Created all roster tables");
    }

    private static void migrateLegacyItemTable(Connection connection) throws SQLException {
        if (!"table".equals(objectType(connection, LEGACY_ITEM_TABLE))) {
            return;
        }
        if (objectType(connection, TABLE_ITEM) != null) {
            throw new RosterStoreException.InconsistentState(
                    "Both legacy '" + LEGACY_ITEM_TABLE + "' and '" + TABLE_ITEM + "' tables exist");
        }
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("ALTER TABLE " + LEGACY_ITEM_TABLE + " RENAME TO " + TABLE_ITEM);
        }
        logger.info("Renamed legacy table '{}' to '{}'", LEGACY_ITEM_TABLE, TABLE_ITEM);
    }

    /**
     * Databases written by the trigger-based store journal every change through triggers on
     * {@code groupitem} and the old {@code roster} view. Left in place they would journal each
     * group change a second time.
     */
    private static void dropLegacyTriggers(Connection connection) throws SQLException {
        List<String> triggers = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type = 'trigger' AND substr(name, 1, ?) = ?")) {
            statement.setInt(1, LEGACY_TRIGGER_PREFIX.length());
            statement.setString(2, LEGACY_TRIGGER_PREFIX);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    triggers.add(rs.getString(1));
                }
            }
        }
        try (Statement statement = connection.createStatement()) {
            for (String trigger : triggers) {
                statement.executeUpdate("DROP TRIGGER IF EXISTS \"" + trigger + "\"");
            }
        }
        if (!triggers.isEmpty()) {
            logger.info("Dropped legacy roster triggers {}", triggers);
        }
    }

    /**
     * Older journals stored {@code CURRENT_TIMESTAMP} text (UTC); rewrite those as epoch millis.
     */
    private static void convertLegacyTimestamps(Connection connection) throws SQLException {
        String sql = """
                     UPDATE journal SET timestamp = CAST(strftime('%s', timestamp) AS INTEGER) * 1000
                     WHERE typeof(timestamp) = 'text' AND strftime('%s', timestamp) IS NOT NULL
                     """;
        try (Statement statement = connection.createStatement()) {
            int converted = statement.executeUpdate(sql);
            if (converted > 0) {
                logger.info("Converted {} legacy journal timestamps to epoch millis", converted);
            }
        }
    }

    private static String objectType(Connection connection, String name) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT type FROM sqlite_master WHERE name = ?")) {
            statement.setString(1, name);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }
}
