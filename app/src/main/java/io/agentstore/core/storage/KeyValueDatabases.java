package io.agentstore.core.storage;

import io.agentstore.core.config.StoreConfig;
import io.agentstore.core.error.StoreException;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Builds a ready-to-use {@link KeyValueDatabase} for a configuration.
 * Callers only ever see the interface type.
 */
public final class KeyValueDatabases {
    private static final Logger LOG = Logger.getLogger(KeyValueDatabases.class.getName());

    private KeyValueDatabases() {}

    public static KeyValueDatabase open(StoreConfig config) throws StoreException {
        LOG.info("Opening store: " + config);
        switch (config.backend) {
            case ROCKSDB:
                return rocks(config);
            case IN_MEMORY:
            default:
                return inMemory();
        }
    }

    /** Convenience factory for an in-memory store. */
    public static KeyValueDatabase inMemory() {
        return new InMemoryKeyValueDatabase();
    }

    /** Convenience factory for a RocksDB-backed store with default options. */
    public static KeyValueDatabase rocks(Path dataDir) throws StoreException {
        return rocks(StoreConfig.defaultLocal().withBackend(StoreConfig.Backend.ROCKSDB, dataDir));
    }

    private static KeyValueDatabase rocks(StoreConfig config) throws StoreException {
        RocksDBKeyValueDatabase db = new RocksDBKeyValueDatabase(config);
        db.open(config.dataDir);
        return db;
    }
}
