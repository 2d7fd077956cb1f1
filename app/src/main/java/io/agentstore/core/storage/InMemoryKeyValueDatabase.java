package io.agentstore.core.storage;

import io.agentstore.core.error.ErrorKind;
import io.agentstore.core.error.StoreException;
import io.agentstore.core.metrics.StoreMetrics;
import io.micrometer.core.instrument.Timer;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Simple, fast in-memory key-value database.
 * Good for tests and as the reference for what every backend must do.
 * Not persistent: resets every process run.
 * <p>
 * Committed state is an immutable map published through a volatile field. A commit
 * builds the next map from the current one plus the transaction's staging overlay and
 * swaps it in with a single write, so readers see either all of a transaction or none
 * of it; plain reads never take a lock.
 * <p>
 * Writers are serialized by a fair lock held for the whole write transaction; a second
 * writer blocks until the first finishes. Transactions also hold a shared lifecycle lock,
 * so {@link #close()} waits for them and is rejected when called from inside one.
 */
public final class InMemoryKeyValueDatabase implements KeyValueDatabase {
    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueDatabase.class.getName());

    static final String BACKEND = "in-memory";

    /** Map: key -> committed value. Never mutated after publication. */
    private volatile Map<BytesKey, byte[]> committed = Collections.emptyMap();

    // Lock order: lifecycle read lock first, then writerLock.
    private final ReentrantLock writerLock = new ReentrantLock(true);
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile boolean closed;

    @Override
    public void open(Path path) {
        // nothing to acquire
    }

    @Override
    public byte[] read(byte[] key) throws StoreException {
        Objects.requireNonNull(key, "key");
        ensureOpen();
        byte[] value = committed.get(new BytesKey(key));
        if (value == null) {
            throw StoreException.keyNotFound();
        }
        return value.clone();
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
        StagedTransaction txn = null;
        try {
            ensureOpen();
            txn = new StagedTransaction(committed);
            try {
                body.apply(txn);
            } catch (StoreException | RuntimeException e) {
                StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_ROLLBACK);
                LOG.fine(() -> "Rolled back write transaction (" + e + ")");
                throw e;
            }
            commit(txn);
        } finally {
            if (txn != null) {
                txn.release();
            }
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
            SnapshotView view = new SnapshotView(committed);
            try {
                body.apply(view);
                StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_READ, StoreMetrics.OUTCOME_COMMIT);
            } catch (StoreException | RuntimeException e) {
                StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_READ, StoreMetrics.OUTCOME_ROLLBACK);
                throw e;
            } finally {
                view.release();
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
            if (closed) return;
            closed = true;
            committed = Collections.emptyMap();
        } finally {
            lifecycle.writeLock().unlock();
        }
        LOG.info("Closed in-memory database");
    }

    /** Number of committed keys (debug/tests). */
    public int size() {
        return committed.size();
    }

    private void commit(StagedTransaction txn) {
        Timer.Sample sample = StoreMetrics.startCommit();
        // Full copy per commit: O(committed keys). Fine at reference-engine sizes; bulk
        // loads belong in one transaction, or in the RocksDB backend.
        Map<BytesKey, byte[]> next = new HashMap<>(committed);
        for (Map.Entry<BytesKey, Staged> entry : txn.overlay.entrySet()) {
            Staged staged = entry.getValue();
            if (staged.tombstone()) {
                next.remove(entry.getKey());
            } else {
                next.put(entry.getKey(), staged.value());
            }
        }
        committed = Collections.unmodifiableMap(next);
        StoreMetrics.stopCommit(sample, BACKEND);
        StoreMetrics.recordTransaction(BACKEND, StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_COMMIT);
        LOG.fine(() -> "Committed " + txn.overlay.size() + " staged change(s)");
    }

    private void ensureOpen() throws StoreException {
        if (closed) {
            throw StoreException.of(ErrorKind.BACKEND_ERROR, "Database is closed");
        }
    }

    /** Pending value, or a tombstone when value is null. */
    private record Staged(byte[] value) {
        static final Staged TOMBSTONE = new Staged(null);

        boolean tombstone() {
            return value == null;
        }
    }

    /** Read-only view over the committed map captured when the transaction began. */
    private static class SnapshotView implements ReadOnlyTransaction {
        final Map<BytesKey, byte[]> base;
        private volatile boolean active = true;

        SnapshotView(Map<BytesKey, byte[]> base) {
            this.base = base;
        }

        @Override
        public byte[] read(byte[] key) throws StoreException {
            Objects.requireNonNull(key, "key");
            ensureActive();
            return lookupBase(new BytesKey(key));
        }

        byte[] lookupBase(BytesKey key) throws StoreException {
            byte[] value = base.get(key);
            if (value == null) {
                throw StoreException.keyNotFound();
            }
            return value.clone();
        }

        void ensureActive() {
            if (!active) {
                throw new IllegalStateException("Transaction handle used after its transaction ended");
            }
        }

        void release() {
            active = false;
        }
    }

    /** Write handle: the base snapshot plus an exclusive staging overlay. */
    private static final class StagedTransaction extends SnapshotView implements Transaction {
        private final Map<BytesKey, Staged> overlay = new HashMap<>();

        StagedTransaction(Map<BytesKey, byte[]> base) {
            super(base);
        }

        @Override
        public byte[] read(byte[] key) throws StoreException {
            Objects.requireNonNull(key, "key");
            ensureActive();
            BytesKey k = new BytesKey(key);
            Staged staged = overlay.get(k);
            if (staged == null) {
                return lookupBase(k);
            }
            if (staged.tombstone()) {
                throw StoreException.keyNotFound();
            }
            return staged.value().clone();
        }

        @Override
        public void write(byte[] key, byte[] value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            ensureActive();
            overlay.put(new BytesKey(key), new Staged(value.clone()));
        }

        @Override
        public void remove(byte[] key) {
            Objects.requireNonNull(key, "key");
            ensureActive();
            overlay.put(new BytesKey(key), Staged.TOMBSTONE);
        }

        @Override
        void release() {
            super.release();
            overlay.clear();
        }
    }
}
