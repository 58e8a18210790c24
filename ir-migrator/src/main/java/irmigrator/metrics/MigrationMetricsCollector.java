package irmigrator.metrics;

import irmigrator.engine.PassResult;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects metrics for a single migration.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector()
 *         .start(migrationId, snapshot.version(), table.size());
 *
 * PassResult pass = collector.timed(step.label(), () -&gt; applicator.apply(step, table));
 * collector.record(pass);
 *
 * MigrationMetrics metrics = collector.finish(targetVersion, table.size());
 * </pre>
 *
 * <p>One collector per migration; instances are not shared.
 *
 * @see MigrationMetrics
 */
public final class MigrationMetricsCollector {

    private final Map<String, Long> stepDurations = new LinkedHashMap<>();
    private MigrationMetrics.Builder builder;
    private Instant startTime;
    private int rewritten;
    private int appended;
    private int tombstoned;

    /**
     * Starts metrics collection.
     *
     * @param migrationId the migration identifier
     * @param sourceVersion the declared version of the snapshot
     * @param nodesBefore the node table size before migration
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(long migrationId, String sourceVersion, int nodesBefore) {
        this.startTime = Instant.now();
        this.stepDurations.clear();
        this.rewritten = 0;
        this.appended = 0;
        this.tombstoned = 0;
        this.builder = MigrationMetrics.builder()
                .migrationId(migrationId)
                .sourceVersion(sourceVersion)
                .startTime(startTime)
                .nodesBefore(nodesBefore);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a version step and return its result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(String stepLabel, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            stepDurations.put(stepLabel, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    /**
     * Accumulates the node counts of one pass.
     *
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector record(PassResult pass) {
        rewritten += pass.rewritten();
        appended += pass.appended();
        tombstoned += pass.tombstoned();
        return this;
    }

    /**
     * Finishes collection.
     *
     * @param targetVersion the version the snapshot ended at
     * @param nodesAfter the node table size after migration
     * @return the collected metrics
     */
    public MigrationMetrics finish(String targetVersion, int nodesAfter) {
        Instant endTime = Instant.now();
        return builder
                .targetVersion(targetVersion)
                .endTime(endTime)
                .stepDurations(stepDurations)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .nodesAfter(nodesAfter)
                .nodesRewritten(rewritten)
                .nodesAppended(appended)
                .nodesTombstoned(tombstoned)
                .build();
    }
}
