package io.agentstore.core.error;

import java.io.IOException;
import java.util.Objects;

/**
 * Structured store failure: a {@link ErrorKind} plus a diagnostic message.
 * Every backend funnels its native failures through this type.
 */
public class StoreException extends Exception {
    private static final long serialVersionUID = 1L;

    static final String KEY_NOT_FOUND = "Key Not found";

    private final ErrorKind kind;

    public StoreException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        Objects.requireNonNull(kind, "kind");
        if (kind == ErrorKind.NONE) {
            throw new IllegalArgumentException("NONE is not an error kind that can be raised");
        }
        this.kind = kind;
    }

    /** Build a classified error. */
    public static StoreException of(ErrorKind kind, String message) {
        return new StoreException(kind, message);
    }

    public static StoreException keyNotFound() {
        return new StoreException(ErrorKind.KEY_ERROR, KEY_NOT_FOUND);
    }

    public static StoreException backend(String message, Throwable cause) {
        return new StoreException(ErrorKind.BACKEND_ERROR, describe(message, cause), cause);
    }

    public static StoreException condition(String message, Throwable cause) {
        return new StoreException(ErrorKind.CONDITION_ERROR, describe(message, cause), cause);
    }

    public static StoreException condition(IOException cause) {
        return condition(null, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isKeyError() {
        return kind == ErrorKind.KEY_ERROR;
    }

    @Override
    public String toString() {
        return "StoreException{kind=" + kind + ", message=" + getMessage() + "}";
    }

    // Native diagnostics (e.g. "No such file or directory") are kept in the message text.
    private static String describe(String message, Throwable cause) {
        String nativeText = cause == null ? null : cause.getMessage();
        if (message == null || message.isBlank()) {
            return nativeText == null ? String.valueOf(cause) : nativeText;
        }
        return nativeText == null ? message : message + ": " + nativeText;
    }
}
