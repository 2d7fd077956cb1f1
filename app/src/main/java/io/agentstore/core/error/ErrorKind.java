package io.agentstore.core.error;

/**
 * Classification of a store failure. Callers branch on this, never on the message.
 */
public enum ErrorKind {
    /** No failure. Never carried by a thrown {@link StoreException}; a normal return means success. */
    NONE,
    /** Requested key is absent from the applicable view. Expected and recoverable. */
    KEY_ERROR,
    /** Failure inside the storage engine: open, commit or I/O. */
    BACKEND_ERROR,
    /** Opaque native or OS condition (permissions, I/O faults) wrapped for uniformity. */
    CONDITION_ERROR
}
