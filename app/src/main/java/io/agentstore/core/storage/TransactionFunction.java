package io.agentstore.core.storage;

import io.agentstore.core.error.StoreException;

/**
 * Caller-supplied body of a transaction. Returning normally asks for commit;
 * throwing aborts the transaction and the exception reaches the caller unchanged.
 *
 * @param <T> handle type: {@link Transaction} or {@link ReadOnlyTransaction}
 */
@FunctionalInterface
public interface TransactionFunction<T extends ReadOnlyTransaction> {
    void apply(T txn) throws StoreException;
}
