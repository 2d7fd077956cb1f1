package io.agentstore.core.storage;

import io.agentstore.core.error.StoreException;

/**
 * Handle bound to one in-flight read transaction. It sees a stable snapshot
 * of the store taken when the transaction began.
 * <p>
 * Only valid inside the callback it was handed to; using it afterwards throws
 * {@link IllegalStateException}.
 */
public interface ReadOnlyTransaction {

    /**
     * @return the value visible to this transaction
     * @throws StoreException with {@code KEY_ERROR} if the key is absent from this view
     */
    byte[] read(byte[] key) throws StoreException;
}
