package io.agentstore.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public final class StoreMetrics {
    public static final String MODE_READ = "read";
    public static final String MODE_WRITE = "write";

    public static final String OUTCOME_COMMIT = "commit";
    public static final String OUTCOME_ROLLBACK = "rollback";
    public static final String OUTCOME_ERROR = "error";

    private static final MeterRegistry registry = new SimpleMeterRegistry();

    private StoreMetrics() {}

    /** Count one finished transaction. A read transaction that returns normally counts as "commit". */
    public static void recordTransaction(String backend, String mode, String outcome) {
        transactions(backend, mode, outcome).increment();
    }

    public static Timer.Sample startCommit() {
        return Timer.start(registry);
    }

    public static void stopCommit(Timer.Sample sample, String backend) {
        Timer timer = Timer
                .builder("store.commit.time")
                .description("Time spent merging staged writes into the store")
                .tag("backend", backend)
                .register(registry);
        sample.stop(timer);
    }

    public static double transactionCount(String backend, String mode, String outcome) {
        return transactions(backend, mode, outcome).count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{");
                m.getId().getTags().forEach(t -> sb.append(t.getKey()).append('=').append(t.getValue()).append(','));
                sb.append("stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }

    private static Counter transactions(String backend, String mode, String outcome) {
        return Counter.builder("store.transactions")
                .description("Finished store transactions by outcome")
                .tag("backend", backend)
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(registry);
    }
}
