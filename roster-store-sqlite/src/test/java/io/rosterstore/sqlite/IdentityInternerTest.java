package io.rosterstore.sqlite;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityInternerTest {

    @TempDir
    Path tempDir;

    private Database database;
    private final IdentityInterner interner = new IdentityInterner();

    @BeforeEach
    void setUp() {
        database = Database.open(tempDir.resolve("roster.sqlite"));
        SchemaBootstrap.install(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void resolveIsIdempotent() {
        long first = database.inTransaction("resolve", connection -> interner.resolve(connection, "u@x"));
        long second = database.inTransaction("resolve", connection -> interner.resolve(connection, "u@x"));
        long other = database.inTransaction("resolve", connection -> interner.resolve(connection, "v@x"));

        assertThat(second).isEqualTo(first);
        assertThat(other).isNotEqualTo(first);
    }

    @Test
    void findDoesNotAllocate() {
        OptionalLong missing = database.inTransaction("find", connection -> interner.find(connection, "u@x"));
        assertThat(missing).isEmpty();

        long id = database.inTransaction("resolve", connection -> interner.resolve(connection, "u@x"));
        assertThat(database.<OptionalLong>inTransaction("find", connection -> interner.find(connection, "u@x"))).hasValue(id);
    }

    @Test
    void losingAllocationReturnsWinnersId() {
        long winner = database.inTransaction("resolve", connection -> interner.resolve(connection, "u@x"));

        long loser = database.inTransaction("allocate", connection -> interner.allocate(connection, "u@x"));

        assertThat(loser).isEqualTo(winner);
    }

    @Test
    void addressesAreCaseSensitive() {
        long lower = database.inTransaction("resolve", connection -> interner.resolve(connection, "u@x"));
        long upper = database.inTransaction("resolve", connection -> interner.resolve(connection, "U@x"));

        assertThat(upper).isNotEqualTo(lower);
    }

    @Test
    void concurrentResolveFromTwoConnectionsConvergesOnOneId() throws Exception {
        List<String> addresses = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            addresses.add("contact" + i + "@x");
        }
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try (Database other = Database.open(tempDir.resolve("roster.sqlite"))) {
            CountDownLatch start = new CountDownLatch(1);
            Future<List<Long>> first = executor.submit(() -> resolveAll(database, addresses, start));
            Future<List<Long>> second = executor.submit(() -> resolveAll(other, addresses, start));
            start.countDown();

            assertThat(second.get(30, TimeUnit.SECONDS)).isEqualTo(first.get(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        long rows = database.inTransaction("count", connection -> {
            try (var statement = connection.createStatement();
                 var rs = statement.executeQuery("SELECT count(*) FROM jidmap")) {
                rs.next();
                return rs.getLong(1);
            }
        });
        assertThat(rows).isEqualTo(addresses.size());
    }

    private List<Long> resolveAll(Database db, List<String> addresses, CountDownLatch start) throws InterruptedException {
        start.await();
        List<Long> ids = new ArrayList<>();
        for (String address : addresses) {
            ids.add(db.inTransaction("resolve " + address, connection -> interner.resolve(connection, address)));
        }
        return ids;
    }
}
