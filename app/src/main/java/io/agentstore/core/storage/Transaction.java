package io.agentstore.core.storage;

import io.agentstore.core.error.StoreException;

/**
 * Handle bound to one in-flight write transaction.
 * <p>
 * Writes and removes are staged and become visible to other readers only when
 * the enclosing {@link KeyValueDatabase#writeTransaction} commits. Reads through
 * this handle observe the transaction's own staged writes (read-your-writes).
 */
public interface Transaction extends ReadOnlyTransaction {

    /** Stage {@code value} under {@code key}, replacing any earlier staged or committed value. */
    void write(byte[] key, byte[] value) throws StoreException;

    /** Stage a tombstone for {@code key}. Succeeds even if the key does not exist. */
    void remove(byte[] key) throws StoreException;
}
