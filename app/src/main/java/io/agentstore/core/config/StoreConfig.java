package io.agentstore.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Simple config holder for a store instance. */
public final class StoreConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String ENV_BACKEND = "AGENT_STORE_BACKEND";
    public static final String ENV_DATA_DIR = "AGENT_STORE_DATA_DIR";
    public static final String ENV_SYNC_WRITES = "AGENT_STORE_SYNC_WRITES";
    public static final String ENV_LOCK_TIMEOUT_MS = "AGENT_STORE_LOCK_TIMEOUT_MS";

    public enum Backend {
        IN_MEMORY,
        ROCKSDB;

        /** Accepts "in-memory", "in_memory", "memory", "rocksdb" in any case. */
        public static Backend parse(String value, String source) {
            String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            switch (v) {
                case "in-memory":
                case "memory":
                    return IN_MEMORY;
                case "rocksdb":
                case "rocks":
                    return ROCKSDB;
                default:
                    throw new IllegalArgumentException("Invalid backend for " + source + ": " + value);
            }
        }
    }

    public final Backend backend;
    public final Path dataDir;
    public final boolean syncWrites;
    public final long lockTimeoutMillis;

    public StoreConfig(Backend backend, Path dataDir, boolean syncWrites, long lockTimeoutMillis) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        if (lockTimeoutMillis < 0) {
            throw new IllegalArgumentException("Invalid value for lockTimeoutMillis: " + lockTimeoutMillis);
        }
        this.syncWrites = syncWrites;
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    public static StoreConfig defaultLocal() {
        return new StoreConfig(
                Backend.IN_MEMORY,
                Path.of("./data/agent-store"),
                true,      // fsync every commit
                1_000L     // native lock wait
        );
    }

    /** Defaults, then the JSON file (if it exists), then environment overrides. */
    public static StoreConfig resolve(Path configFile) {
        StoreConfig config = defaultLocal();
        if (configFile != null && Files.exists(configFile)) {
            config = config.merge(configFile);
        }
        return config.withEnvironment(System.getenv());
    }

    /** Load a JSON config file over {@link #defaultLocal()}. */
    public static StoreConfig load(Path path) {
        return defaultLocal().merge(path);
    }

    public StoreConfig withBackend(Backend backend, Path dataDir) {
        return new StoreConfig(backend, dataDir, this.syncWrites, this.lockTimeoutMillis);
    }

    /** Apply AGENT_STORE_* overrides from the given environment map. */
    public StoreConfig withEnvironment(Map<String, String> env) {
        Backend b = this.backend;
        Path dir = this.dataDir;
        boolean sync = this.syncWrites;
        long timeout = this.lockTimeoutMillis;

        String value = env.get(ENV_BACKEND);
        if (value != null && !value.isBlank()) {
            b = Backend.parse(value, ENV_BACKEND);
        }
        value = env.get(ENV_DATA_DIR);
        if (value != null && !value.isBlank()) {
            dir = Path.of(value);
        }
        value = env.get(ENV_SYNC_WRITES);
        if (value != null && !value.isBlank()) {
            sync = parseBoolean(value, ENV_SYNC_WRITES);
        }
        value = env.get(ENV_LOCK_TIMEOUT_MS);
        if (value != null && !value.isBlank()) {
            timeout = parseNonNegativeLong(value, ENV_LOCK_TIMEOUT_MS);
        }
        return new StoreConfig(b, dir, sync, timeout);
    }

    @Override
    public String toString() {
        return "StoreConfig{backend=" + backend + ", dataDir=" + dataDir
                + ", syncWrites=" + syncWrites + ", lockTimeoutMillis=" + lockTimeoutMillis + "}";
    }

    private StoreConfig merge(Path path) {
        JsonNode root;
        try {
            root = JSON.readTree(path.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read store config from " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Store config must be a JSON object: " + path);
        }
        Backend b = this.backend;
        Path dir = this.dataDir;
        boolean sync = this.syncWrites;
        long timeout = this.lockTimeoutMillis;

        if (root.hasNonNull("backend")) {
            b = Backend.parse(root.get("backend").asText(), "backend");
        }
        if (root.hasNonNull("dataDir")) {
            dir = Path.of(root.get("dataDir").asText());
        }
        if (root.hasNonNull("syncWrites")) {
            JsonNode node = root.get("syncWrites");
            if (!node.isBoolean()) {
                throw new IllegalArgumentException("Invalid value for syncWrites: " + node);
            }
            sync = node.booleanValue();
        }
        if (root.hasNonNull("lockTimeoutMillis")) {
            JsonNode node = root.get("lockTimeoutMillis");
            if (!node.canConvertToLong() || !node.isIntegralNumber() || node.longValue() < 0) {
                throw new IllegalArgumentException("Invalid value for lockTimeoutMillis: " + node);
            }
            timeout = node.longValue();
        }
        return new StoreConfig(b, dir, sync, timeout);
    }

    private static boolean parseBoolean(String value, String flag) {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
    }

    private static long parseNonNegativeLong(String value, String flag) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                throw new NumberFormatException();
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
        }
    }
}
