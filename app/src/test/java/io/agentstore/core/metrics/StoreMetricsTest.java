package io.agentstore.core.metrics;

import io.agentstore.core.error.ErrorKind;
import io.agentstore.core.error.StoreException;
import io.agentstore.core.storage.KeyValueDatabase;
import io.agentstore.core.storage.KeyValueDatabases;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StoreMetricsTest {

    @Test
    void countsCommitsAndRollbacks() throws Exception {
        double commits = StoreMetrics.transactionCount("in-memory", StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_COMMIT);
        double rollbacks = StoreMetrics.transactionCount("in-memory", StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_ROLLBACK);
        double reads = StoreMetrics.transactionCount("in-memory", StoreMetrics.MODE_READ, StoreMetrics.OUTCOME_COMMIT);

        try (KeyValueDatabase db = KeyValueDatabases.inMemory()) {
            byte[] key = "k".getBytes(StandardCharsets.UTF_8);
            db.write(key, key);
            assertThrows(StoreException.class, () -> db.writeTransaction(txn -> {
                throw StoreException.of(ErrorKind.CONDITION_ERROR, "abort");
            }));
            db.readTransaction(txn -> txn.read(key));
        }

        assertTrue(StoreMetrics.transactionCount("in-memory", StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_COMMIT) >= commits + 1);
        assertTrue(StoreMetrics.transactionCount("in-memory", StoreMetrics.MODE_WRITE, StoreMetrics.OUTCOME_ROLLBACK) >= rollbacks + 1);
        assertTrue(StoreMetrics.transactionCount("in-memory", StoreMetrics.MODE_READ, StoreMetrics.OUTCOME_COMMIT) >= reads + 1);
        assertTrue(StoreMetrics.scrapeMetrics().contains("store.transactions"));
        assertTrue(StoreMetrics.scrapeMetrics().contains("store.commit.time"));
    }

    @Test
    void commitTimerIsTaggedWithBackend() throws Exception {
        try (KeyValueDatabase db = KeyValueDatabases.inMemory()) {
            db.write("k".getBytes(StandardCharsets.UTF_8), new byte[] {1});
        }

        Timer timer = StoreMetrics.registry().find("store.commit.time").tag("backend", "in-memory").timer();
        assertNotNull(timer);
        assertTrue(timer.count() >= 1);
    }
}
