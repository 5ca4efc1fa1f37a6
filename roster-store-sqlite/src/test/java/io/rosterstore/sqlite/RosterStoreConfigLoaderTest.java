package io.rosterstore.sqlite;

import io.rosterstore.spi.RosterStoreConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterStoreConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final RosterStoreConfigLoader loader = new RosterStoreConfigLoader();

    @Test
    void readsEveryKey() {
        RosterStoreConfig config = loader.fromJson("""
                {
                  "database": "/var/lib/roster.sqlite",
                  "tombstoneRetention": "P7D",
                  "sweepOnStartup": false,
                  "sweepInterval": "PT6H",
                  "pruneOrphanedJournal": true,
                  "collectEmptyGroups": true
                }
                """, null);

        assertThat(config.databaseFile()).contains(Path.of("/var/lib/roster.sqlite"));
        assertThat(config.tombstoneRetention()).isEqualTo(Duration.ofDays(7));
        assertThat(config.sweepOnStartup()).isFalse();
        assertThat(config.sweepInterval()).contains(Duration.ofHours(6));
        assertThat(config.pruneOrphanedJournal()).isTrue();
        assertThat(config.collectEmptyGroups()).isTrue();
    }

    @Test
    void missingKeysKeepDefaults() {
        RosterStoreConfig config = loader.fromJson("{}", null);

        assertThat(config.databaseFile()).isEmpty();
        assertThat(config.tombstoneRetention()).isEqualTo(RosterStoreConfig.DEFAULT_TOMBSTONE_RETENTION);
        assertThat(config.sweepOnStartup()).isTrue();
        assertThat(config.sweepInterval()).isEmpty();
    }

    @Test
    void resolvesRelativeDatabaseAgainstConfigDirectory() throws IOException {
        Path file = tempDir.resolve("roster.json");
        Files.writeString(file, "{\"database\": \"data/roster.sqlite\"}");

        RosterStoreConfig config = loader.load(file);

        assertThat(config.databaseFile()).contains(tempDir.toAbsolutePath().resolve("data/roster.sqlite"));
    }

    @Test
    void rejectsUnknownKeys() {
        assertThatThrownBy(() -> loader.fromJson("{\"databse\": \"x\"}", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("databse");
    }

    @Test
    void rejectsMalformedValues() {
        assertThatThrownBy(() -> loader.fromJson("{\"tombstoneRetention\": \"three days\"}", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.fromJson("{\"sweepOnStartup\": \"yes\"}", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.fromJson("[]", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.fromJson("{", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
