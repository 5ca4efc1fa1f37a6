/**
 * SQLite-backed roster store.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.rosterstore.sqlite.SqliteRosterStore} (the store and its update engine)</li>
 *   <li>{@link io.rosterstore.sqlite.RosterView} and {@link io.rosterstore.sqlite.RosterJournal}
 *       (versioned read model and the append-only version clock)</li>
 *   <li>{@link io.rosterstore.sqlite.RetentionSweeper} (tombstone purge)</li>
 * </ul>
 *
 * <p>Engine access goes through JDBC on a single connection owned by {@link io.rosterstore.sqlite.Database}.
 */
package io.rosterstore.sqlite;
