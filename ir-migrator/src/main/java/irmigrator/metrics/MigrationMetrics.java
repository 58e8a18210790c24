package irmigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one snapshot migration.
 *
 * <p>Captures:
 * <ul>
 *   <li>source and target versions</li>
 *   <li>timing (total duration, per-step durations in application order)</li>
 *   <li>node counts: table size before/after, rewritten, appended, tombstoned</li>
 * </ul>
 *
 * <p>Use {@link #summary()} for a human-readable line, or {@link #toMap()}
 * for serialization.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        long migrationId,
        String sourceVersion,
        String targetVersion,
        Instant startTime,
        Instant endTime,
        Map<String, Long> stepDurations,
        long totalDurationMs,
        int nodesBefore,
        int nodesAfter,
        int nodesRewritten,
        int nodesAppended,
        int nodesTombstoned
) {

    /** Number of version steps applied. */
    public int stepCount() {
        return stepDurations.size();
    }

    /** Returns the total migration duration. */
    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of one step.
     *
     * @param stepLabel label of the step, e.g. {@code 0.6 -> 0.7}
     * @return duration in milliseconds, or 0 if the step did not run
     */
    public long stepDuration(String stepLabel) {
        return stepDurations.getOrDefault(stepLabel, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Migration #%d %s -> %s in %dms | %d steps | Nodes: %d -> %d (%d rewritten, %d appended, %d tombstoned)",
                migrationId, sourceVersion, targetVersion, totalDurationMs, stepCount(),
                nodesBefore, nodesAfter, nodesRewritten, nodesAppended, nodesTombstoned);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("migrationId", migrationId);
        map.put("sourceVersion", sourceVersion);
        map.put("targetVersion", targetVersion);
        map.put("startTime", String.valueOf(startTime));
        map.put("endTime", String.valueOf(endTime));
        map.put("totalDurationMs", totalDurationMs);
        map.put("nodesBefore", nodesBefore);
        map.put("nodesAfter", nodesAfter);
        map.put("nodesRewritten", nodesRewritten);
        map.put("nodesAppended", nodesAppended);
        map.put("nodesTombstoned", nodesTombstoned);
        map.put("stepDurationsMs", stepDurations);
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing {@link MigrationMetrics} instances.
     */
    public static class Builder {
        private long migrationId;
        private String sourceVersion;
        private String targetVersion;
        private Instant startTime;
        private Instant endTime;
        private final Map<String, Long> stepDurations = new LinkedHashMap<>();
        private long totalDurationMs;
        private int nodesBefore, nodesAfter, nodesRewritten, nodesAppended, nodesTombstoned;

        public Builder migrationId(long id) { this.migrationId = id; return this; }
        public Builder sourceVersion(String v) { this.sourceVersion = v; return this; }
        public Builder targetVersion(String v) { this.targetVersion = v; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder stepDurations(Map<String, Long> durations) {
            this.stepDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder nodesBefore(int v) { this.nodesBefore = v; return this; }
        public Builder nodesAfter(int v) { this.nodesAfter = v; return this; }
        public Builder nodesRewritten(int v) { this.nodesRewritten = v; return this; }
        public Builder nodesAppended(int v) { this.nodesAppended = v; return this; }
        public Builder nodesTombstoned(int v) { this.nodesTombstoned = v; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(
                    migrationId, sourceVersion, targetVersion, startTime, endTime,
                    Collections.unmodifiableMap(new LinkedHashMap<>(stepDurations)),
                    totalDurationMs, nodesBefore, nodesAfter,
                    nodesRewritten, nodesAppended, nodesTombstoned
            );
        }
    }
}
