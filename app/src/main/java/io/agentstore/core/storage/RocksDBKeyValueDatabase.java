package io.agentstore.core.storage;

import io.agentstore.core.config.StoreConfig;
import io.agentstore.core.error.ErrorKind;
import io.agentstore.core.error.StoreException;
import io.agentstore.core.metrics.StoreMetrics;
import io.micrometer.core.instrument.Timer;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.Snapshot;
import org.rocksdb.Status;
import org.rocksdb.TransactionDB;
import org.rocksdb.TransactionDBOptions;
import org.rocksdb.TransactionOptions;
import org.rocksdb.WriteOptions;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent KeyValueDatabase using a RocksDB TransactionDB.
 *
 * Layout: default column family, key = raw key bytes, val = raw value bytes.
 *
 * Mapping onto native primitives:
 *  - writeTransaction : beginTransaction -> put/delete/get(own writes) -> commit, rollback on any failure
 *  - readTransaction  : getSnapshot -> get(ReadOptions.setSnapshot) -> releaseSnapshot
 *  - write/remove     : a write transaction with a single operation
 *
 * Native failures are translated to StoreException(BACKEND_ERROR) at this boundary; the
 * RocksDB status text (e.g. "No such file or directory") is kept in the message.
 */
public final class RocksDBKeyValueDatabase implements KeyValueDatabase {
    private static final Logger LOG = Logger.getLogger(RocksDBKeyValueDatabase.class.getName());

    static final String BACKEND = "rocksdb";

    static {
        RocksDB.loadLibrary();
    }

    private final boolean syncWrites;
    private final long lockTimeoutMillis;
    private final long transactionExpirationMillis;

    // Serializes write transactions; held for the whole transaction.
    // Lock order: lifecycle read lock first, then writerLock.
    private final ReentrantLock writerLock = new ReentrantLock(true);
    // Shared by every operation, exclusive for open/close so native handles never vanish mid-call.
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();

    private TransactionDB db;
    private Options options;
    private TransactionDBOptions txnDbOptions;
    private WriteOptions writeOptions;
    private TransactionOptions transactionOptions;
    private Path location;

    public RocksDBKeyValueDatabase() {
        this(StoreConfig.defaultLocal());
    }

    public RocksDBKeyValueDatabase(StoreConfig config) {
        this(config.syncWrites, config.lockTimeoutMillis);
    }

    /**
     * @param syncWrites        fsync the RocksDB WAL on every commit
     * @param lockTimeoutMillis native row-lock wait before a transaction operation fails
     */
    public RocksDBKeyValueDatabase(boolean syncWrites, long lockTimeoutMillis) {
        this(syncWrites, lockTimeoutMillis, -1L);
    }

    /** @param transactionExpirationMillis native transaction expiration, -1 for none */
    RocksDBKeyValueDatabase(boolean syncWrites, long lockTimeoutMillis, long transactionExpirationMillis) {
        this.syncWrites = syncWrites;
        this.lockTimeoutMillis = lockTimeoutMillis;
        this.transactionExpirationMillis = transactionExpirationMillis;
    }

    boolean syncWrites() {
        return syncWrites;
    }

    /** Open/create the database at the given directory. The directory's parent must exist. */
    @Override
    public void open(Path path) throws StoreException {
        Objects.requireNonNull(path, "path");
        lifecycle.writeLock().lock();
        try {
            if (db != null) {
                throw StoreException.of(ErrorKind.BACKEND_ERROR, "Database already open at " + location);
            }
            Options opts = new Options().setCreateIfMissing(true);
            TransactionDBOptions txnOpts = new TransactionDBOptions()
                    .setTransactionLockTimeout(lockTimeoutMillis);
            String dir = path.toAbsolutePath().toString();
            try {
                db = TransactionDB.open(opts, txnOpts, dir);
            } catch (RocksDBException e) {
                txnOpts.close();
                opts.close();
                throw translate("Failed to open RocksDB at " + dir, e);
            }
            options = opts;
            txnDbOptions = txnOpts;
            writeOptions = new WriteOptions().setSync(syncWrites);
            transactionOptions = new TransactionOptions().setExpiration(transactionExpirationMillis);
            location = path;
            LOG.info("Opened RocksDB database at " + dir);
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    @Override
    public byte[] read(byte[] key) throws StoreException {
        Objects.requireNonNull(key, "key");
        lifecycle.readLock().lock();
        try {
            ensureOpen();
            byte[] value = db.get(key);
            if (value == null) {
                throw StoreException.keyNotFound();
            }
            return value;
        } catch (RocksDBException e) {
            throw translate("read failed", e);
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public void write(byte[] key, byte[] value) throws StoreException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        writeTransaction(txn -> txn.write(key, value));
    }

    @Override
    public void remove(byte[] key) throws StoreException {
        Objects.requireNonNull(key, "key");
        writeTransaction(txn -> txn.remove(key));
    }

    @Override
    public void writeTransaction(TransactionFunction<Transaction> body) throws StoreException {
        Objects.requireNonNull(body, "body");
        if (writerLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Write transaction already in progress on this thread");
        }
        lifecycle.readLock().lock();
        writerLock.lock();
        try {
            ensureOpen();
            try (ReadOptions readOptions = new ReadOptions();
                 org.rocksdb.Transaction nativeTxn = db.beginTransaction(writeOptions, transactionOptions)) {
                NativeWriteHandle handle = new NativeWriteHandle(nativeTxn, readOptions);
                boolean committed = false;
                try {
                    try {
                        body.apply(handle);
                    } catch (StoreException | RuntimeException e) {
                        StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_ROLLBACK);
                        throw e;
                    }
                    commit(nativeTxn);
                    committed = true;
                } finally {
                    handle.release();
                    if (!committed) {
                        rollbackQuietly(nativeTxn);
                    }
                }
            }
        } finally {
            writerLock.unlock();
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public void readTransaction(TransactionFunction<ReadOnlyTransaction> body) throws StoreException {
        Objects.requireNonNull(body, "body");
        lifecycle.readLock().lock();
        try {
            ensureOpen();
            Snapshot snapshot = db.getSnapshot();
            try (ReadOptions readOptions = new ReadOptions().setSnapshot(snapshot)) {
                SnapshotHandle handle = new SnapshotHandle(readOptions);
                try {
                    body.apply(handle);
                    StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_READ, StoreMetrics.OUTCOME_COMMIT);
                } catch (StoreException | RuntimeException e) {
                    StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_READ, StoreMetrics.OUTCOME_ROLLBACK);
                    throw e;
                } finally {
                    handle.release();
                }
            } finally {
                db.releaseSnapshot(snapshot);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public String backendName() {
        return BACKEND;
    }

    @Override
    public void close() {
        if (lifecycle.getReadHoldCount() > 0) {
            throw new IllegalStateException("close() called from inside a transaction");
        }
        lifecycle.writeLock().lock();
        try {
            if (db == null) return;
            // Close the DB first, then options
            db.close();
            transactionOptions.close();
            writeOptions.close();
            txnDbOptions.close();
            options.close();
            LOG.info("Closed RocksDB database at " + location);
        } finally {
            db = null;
            writeOptions = null;
            transactionOptions = null;
            txnDbOptions = null;
            options = null;
            location = null;
            lifecycle.writeLock().unlock();
        }
    }

    // -------------- helpers ----------------

    private void commit(org.rocksdb.Transaction nativeTxn) throws StoreException {
        Timer.Sample sample = StoreMetrics.startCommit();
        try {
            nativeTxn.commit();
        } catch (RocksDBException e) {
            StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_ERROR);
            throw translate("commit failed", e);
        }
        StoreMetrics.stopCommit(sample, BACKEND);
        StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_COMMIT);
    }

    private static void rollbackQuietly(org.rocksdb.Transaction nativeTxn) {
        try {
            nativeTxn.rollback();
            LOG.fine("Rolled back write transaction");
        } catch (RocksDBException e) {
            // the original failure is what the caller sees; the native txn is discarded on close anyway
            LOG.log(Level.WARNING, "RocksDB rollback failed", e);
        }
    }

    private void ensureOpen() throws StoreException {
        if (db == null) {
            throw StoreException.of(ErrorKind.BACKEND_ERROR, "Database is not open");
        }
    }

    static StoreException translate(String context, RocksDBException e) {
        Status status = e.getStatus();
        String code = status == null ? "Unknown" : status.getCodeString();
        LOG.log(Level.WARNING, "RocksDB " + context + " (" + code + ")", e);
        return StoreException.backend(context, e);
    }

    /** Write handle over a native RocksDB transaction; reads see its own staged writes. */
    private static final class NativeWriteHandle implements Transaction {
        private final org.rocksdb.Transaction txn;
        private final ReadOptions readOptions;
        private volatile boolean active = true;

        NativeWriteHandle(org.rocksdb.Transaction txn, ReadOptions readOptions) {
            this.txn = txn;
            this.readOptions = readOptions;
        }

        @Override
        public byte[] read(byte[] key) throws StoreException {
            Objects.requireNonNull(key, "key");
            ensureActive();
            byte[] value;
            try {
                value = txn.get(readOptions, key);
            } catch (RocksDBException e) {
                throw translate("transaction read failed", e);
            }
            if (value == null) {
                throw StoreException.keyNotFound();
            }
            return value;
        }

        @Override
        public void write(byte[] key, byte[] value) throws StoreException {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            ensureActive();
            try {
                txn.put(key, value);
            } catch (RocksDBException e) {
                throw translate("transaction write failed", e);
            }
        }

        @Override
        public void remove(byte[] key) throws StoreException {
            Objects.requireNonNull(key, "key");
            ensureActive();
            try {
                txn.delete(key);
            } catch (RocksDBException e) {
                throw translate("transaction remove failed", e);
            }
        }

        private void ensureActive() {
            if (!active) {
                throw new IllegalStateException("Transaction handle used after its transaction ended");
            }
        }

        void release() {
            active = false;
        }
    }

    /** Read-only handle pinned to a native snapshot. */
    private final class SnapshotHandle implements ReadOnlyTransaction {
        private final ReadOptions readOptions;
        private volatile boolean active = true;

        SnapshotHandle(ReadOptions readOptions) {
            this.readOptions = readOptions;
        }

        @Override
        public byte[] read(byte[] key) throws StoreException {
            Objects.requireNonNull(key, "key");
            if (!active) {
                throw new IllegalStateException("Transaction handle used after its transaction ended");
            }
            byte[] value;
            try {
                value = db.get(readOptions, key);
            } catch (RocksDBException e) {
                throw translate("snapshot read failed", e);
            }
            if (value == null) {
                throw StoreException.keyNotFound();
            }
            return value;
        }

        void release() {
            active = false;
        }
    }
}
