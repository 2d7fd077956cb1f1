package io.agentstore.core.storage;

import io.agentstore.core.error.StoreException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Transactional key-value API so we can swap implementations (RocksDB, in-memory).
 * Keys/values are raw bytes; callers handle encoding.
 * <p>
 * Semantics:
 *  - write()/remove() are atomic single-operation transactions.
 *  - writeTransaction() commits when the body returns normally, rolls back otherwise;
 *    partial effects are never observable.
 *  - readTransaction() sees a stable snapshot and never mutates the store.
 *  - At most one write transaction runs at a time; a second writer blocks until the
 *    first completes. Readers never block each other.
 */
public interface KeyValueDatabase extends AutoCloseable {

    /**
     * Backend-specific initialization. No-op for the in-memory engine.
     *
     * @throws StoreException BACKEND_ERROR carrying the native diagnostic if the path is unusable
     */
    void open(Path path) throws StoreException;

    /**
     * Latest committed value for a key.
     *
     * @throws StoreException KEY_ERROR if absent
     */
    byte[] read(byte[] key) throws StoreException;

    /** Store value under key, overwriting any existing value. */
    void write(byte[] key, byte[] value) throws StoreException;

    /** Remove key. Not an error if the key is already absent. */
    void remove(byte[] key) throws StoreException;

    /**
     * Run {@code body} inside a write transaction. Commits if it returns normally.
     * On any failure (from the body or the commit) the staged state is discarded and
     * that exact exception is rethrown.
     */
    void writeTransaction(TransactionFunction<Transaction> body) throws StoreException;

    /**
     * Run {@code body} against a read-only snapshot. The store is never mutated;
     * the body's exception, if any, is rethrown unchanged.
     */
    void readTransaction(TransactionFunction<ReadOnlyTransaction> body) throws StoreException;

    /** Short backend identifier used in logs and metric tags. */
    String backendName();

    /** Release resources. Safe to call more than once. */
    @Override
    void close();

    /** Lookup that maps a miss to {@link Optional#empty()}; other failures still throw. */
    default Optional<byte[]> find(byte[] key) throws StoreException {
        try {
            return Optional.of(read(key));
        } catch (StoreException e) {
            if (e.isKeyError()) {
                return Optional.empty();
            }
            throw e;
        }
    }
}
