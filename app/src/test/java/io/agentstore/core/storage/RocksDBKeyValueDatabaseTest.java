package io.agentstore.core.storage;

import io.agentstore.core.config.StoreConfig;
import io.agentstore.core.error.ErrorKind;
import io.agentstore.core.error.StoreException;
import io.agentstore.core.metrics.StoreMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBKeyValueDatabaseTest extends KeyValueDatabaseContract {

    @TempDir
    Path tempDir;

    @Override
    protected KeyValueDatabase createDatabase() throws Exception {
        RocksDBKeyValueDatabase rocks = new RocksDBKeyValueDatabase();
        rocks.open(tempDir.resolve("agent-store"));
        return rocks;
    }

    @Test
    void openFailsWhenParentDirectoryIsMissing() {
        RocksDBKeyValueDatabase rocks = new RocksDBKeyValueDatabase();
        try {
            StoreException e = assertThrows(StoreException.class,
                    () -> rocks.open(tempDir.resolve("non-existing-junk-path").resolve("leaf")));
            assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
            assertTrue(e.getMessage().contains("No such file or directory"), e.getMessage());
        } finally {
            rocks.close();
        }
    }

    @Test
    void openCreatesDatabaseDirectory() throws Exception {
        Path dir = tempDir.resolve("fresh");
        assertFalse(Files.exists(dir));
        try (RocksDBKeyValueDatabase rocks = new RocksDBKeyValueDatabase()) {
            rocks.open(dir);
            assertTrue(Files.isDirectory(dir));
        }
    }

    @Test
    void secondOpenOfSamePathIsRejected() {
        RocksDBKeyValueDatabase other = new RocksDBKeyValueDatabase();
        try {
            StoreException e = assertThrows(StoreException.class, () -> other.open(tempDir.resolve("agent-store")));
            assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
        } finally {
            other.close();
        }
    }

    @Test
    void openTwiceOnSameInstanceIsRejected() {
        StoreException e = assertThrows(StoreException.class, () -> db.open(tempDir.resolve("elsewhere")));
        assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
    }

    @Test
    void operationsBeforeOpenFailWithBackendError() {
        try (RocksDBKeyValueDatabase rocks = new RocksDBKeyValueDatabase()) {
            StoreException e = assertThrows(StoreException.class, () -> rocks.read(bytes("k")));
            assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
            e = assertThrows(StoreException.class, () -> rocks.writeTransaction(txn -> txn.write(bytes("k"), bytes("v"))));
            assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
        }
    }

    @Test
    void committedDataSurvivesReopen() throws Exception {
        db.writeTransaction(txn -> {
            txn.write(bytes("foo"), bytes("bar"));
            txn.write(bytes("test"), bytes("val"));
        });
        assertThrows(StoreException.class, () -> db.writeTransaction(txn -> {
            txn.write(bytes("lost"), bytes("x"));
            throw StoreException.of(ErrorKind.CONDITION_ERROR, "abort");
        }));
        db.close();

        RocksDBKeyValueDatabase reopened = new RocksDBKeyValueDatabase();
        reopened.open(tempDir.resolve("agent-store"));
        db = reopened;

        assertArrayEquals(bytes("bar"), db.read(bytes("foo")));
        assertArrayEquals(bytes("val"), db.read(bytes("test")));
        assertKeyError("lost");
    }

    @Test
    void failedCommitRollsBackAndReportsBackendError() throws Exception {
        db.close();
        RocksDBKeyValueDatabase expiring = new RocksDBKeyValueDatabase(false, 1_000L, 50L);
        expiring.open(tempDir.resolve("agent-store"));
        db = expiring;
        db.write(bytes("existing"), bytes("old"));
        double errors = StoreMetrics.transactionCount("rocksdb", StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_ERROR);

        StoreException e = assertThrows(StoreException.class, () -> db.writeTransaction(txn -> {
            txn.write(bytes("existing"), bytes("new"));
            txn.write(bytes("staged"), bytes("x"));
            try {
                Thread.sleep(300);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ie);
            }
        }));

        assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
        assertTrue(e.getMessage().contains("commit failed"), e.getMessage());
        assertArrayEquals(bytes("old"), db.read(bytes("existing")));
        assertKeyError("staged");
        assertTrue(StoreMetrics.transactionCount("rocksdb", StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_ERROR) >= errors + 1);
    }

    @Test
    void defaultConstructorUsesDefaultLocalConfig() {
        try (RocksDBKeyValueDatabase rocks = new RocksDBKeyValueDatabase()) {
            assertEquals(StoreConfig.defaultLocal().syncWrites, rocks.syncWrites());
        }
    }

    @Test
    void backendName() {
        assertEquals("rocksdb", db.backendName());
    }
}
