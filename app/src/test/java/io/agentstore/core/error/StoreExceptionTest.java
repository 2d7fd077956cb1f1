package io.agentstore.core.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class StoreExceptionTest {

    @Test
    void ofCarriesKindAndMessage() {
        StoreException e = StoreException.of(ErrorKind.KEY_ERROR, "Key Not found");
        assertEquals(ErrorKind.KEY_ERROR, e.kind());
        assertEquals("Key Not found", e.getMessage());
        assertTrue(e.isKeyError());
        assertNull(e.getCause());
    }

    @Test
    void keyNotFoundIsKeyError() {
        assertEquals(ErrorKind.KEY_ERROR, StoreException.keyNotFound().kind());
    }

    @Test
    void conditionKeepsNativeDiagnosticInMessage() {
        IOException io = new IOException("Permission denied");
        StoreException e = StoreException.condition("Failed to write state", io);
        assertEquals(ErrorKind.CONDITION_ERROR, e.kind());
        assertEquals("Failed to write state: Permission denied", e.getMessage());
        assertSame(io, e.getCause());

        StoreException bare = StoreException.condition(io);
        assertEquals("Permission denied", bare.getMessage());
    }

    @Test
    void backendWrapsCause() {
        RuntimeException nativeFailure = new RuntimeException("IO error: No such file or directory");
        StoreException e = StoreException.backend("open failed", nativeFailure);
        assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
        assertTrue(e.getMessage().contains("No such file or directory"));
        assertFalse(e.isKeyError());
    }

    @Test
    void noneCannotBeRaised() {
        assertThrows(IllegalArgumentException.class, () -> StoreException.of(ErrorKind.NONE, "ok"));
    }
}
