package io.rosterstore.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rosterstore.spi.RosterStoreConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

/**
 * Reads {@link RosterStoreConfig} from a JSON document.
 *
 * <pre>{@code
 * {
 *   "database": "roster.sqlite",
 *   "tombstoneRetention": "P3D",
 *   "sweepOnStartup": true,
 *   "sweepInterval": "PT6H",
 *   "pruneOrphanedJournal": false,
 *   "collectEmptyGroups": false
 * }
 * }</pre>
 *
 * <p>A relative {@code database} path is resolved against the directory of the config file.
 */
public final class RosterStoreConfigLoader {

    private static final Set<String> KEYS = Set.of(
            "database", "tombstoneRetention", "sweepOnStartup", "sweepInterval", "pruneOrphanedJournal", "collectEmptyGroups");

    private final ObjectMapper mapper;

    public RosterStoreConfigLoader() {
        this(new ObjectMapper());
    }

    public RosterStoreConfigLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public RosterStoreConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path baseDir = file.toAbsolutePath().getParent();
        return parse(mapper.readTree(Files.readAllBytes(file)), baseDir);
    }

    /**
     * @param baseDir directory relative database paths resolve against; null keeps them as given
     * @throws IllegalArgumentException if the document is malformed or has unknown keys
     */
    public RosterStoreConfig fromJson(String json, Path baseDir) {
        try {
            return parse(mapper.readTree(json), baseDir);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed roster store configuration", e);
        }
    }

    private static RosterStoreConfig parse(JsonNode root, Path baseDir) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Roster store configuration must be a JSON object");
        }
        for (Iterator<String> names = root.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (!KEYS.contains(name)) {
                throw new IllegalArgumentException("Unknown roster store configuration key: " + name);
            }
        }

        RosterStoreConfig.Builder builder = RosterStoreConfig.builder();
        String database = text(root, "database");
        if (database != null) {
            Path path = Path.of(database);
            builder.databaseFile(baseDir == null || path.isAbsolute() ? path : baseDir.resolve(path));
        }
        String retention = text(root, "tombstoneRetention");
        if (retention != null) {
            builder.tombstoneRetention(duration("tombstoneRetention", retention));
        }
        String interval = text(root, "sweepInterval");
        if (interval != null) {
            builder.sweepInterval(duration("sweepInterval", interval));
        }
        if (root.has("sweepOnStartup")) {
            builder.sweepOnStartup(bool(root, "sweepOnStartup"));
        }
        if (root.has("pruneOrphanedJournal")) {
            builder.pruneOrphanedJournal(bool(root, "pruneOrphanedJournal"));
        }
        if (root.has("collectEmptyGroups")) {
            builder.collectEmptyGroups(bool(root, "collectEmptyGroups"));
        }
        return builder.build();
    }

    private static String text(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException(key + " must be a string");
        }
        return node.asText();
    }

    private static boolean bool(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isBoolean()) {
            throw new IllegalArgumentException(key + " must be a boolean");
        }
        return node.booleanValue();
    }

    private static Duration duration(String key, String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + " is not an ISO-8601 duration: " + value, e);
        }
    }
}
