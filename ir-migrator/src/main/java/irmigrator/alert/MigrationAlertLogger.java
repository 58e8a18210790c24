package irmigrator.alert;

import irmigrator.config.AlertLevel;
import irmigrator.metrics.MigrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for migration events.
 *
 * <p>Entries use markers like MIGRATION_STARTED, STEP_COMPLETED, MIGRATION_FAILED
 * followed by key=value pairs, for log aggregators and alerting.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: migration started, step transitions, successful completion</li>
 *   <li>WARN: unknown source version (input rejected)</li>
 *   <li>ERROR: migration failed</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - MIGRATION_STARTED id=42 version=0.6.1 nodes=120
 * 12:00:00.001 INFO  migration - STEP_STARTED id=42 step="0.6 -> 0.7"
 * 12:00:00.004 INFO  migration - STEP_COMPLETED id=42 step="0.6 -> 0.7" rewritten=88 appended=31 tombstoned=2
 * 12:00:00.010 INFO  migration - MIGRATION_COMPLETED id=42 version=0.9 duration_ms=10 nodes=151
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private final AlertLevel alertLevel;

    public MigrationAlertLogger(AlertLevel alertLevel) {
        this.alertLevel = alertLevel != null ? alertLevel : AlertLevel.WARNING;
    }

    public AlertLevel alertLevel() {
        return alertLevel;
    }

    private boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public void migrationStarted(long migrationId, String version, int nodes) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_STARTED id={} version={} nodes={}", migrationId, version, nodes);
        }
    }

    public void stepStarted(long migrationId, String step) {
        if (shouldLogInfo()) {
            log.info("STEP_STARTED id={} step=\"{}\"", migrationId, step);
        }
    }

    public void stepCompleted(long migrationId, String step, int rewritten, int appended, int tombstoned) {
        if (shouldLogInfo()) {
            log.info("STEP_COMPLETED id={} step=\"{}\" rewritten={} appended={} tombstoned={}",
                    migrationId, step, rewritten, appended, tombstoned);
        }
    }

    public void migrationCompleted(long migrationId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_COMPLETED id={} version={} duration_ms={} nodes={}",
                    migrationId, metrics.targetVersion(), metrics.totalDurationMs(), metrics.nodesAfter());
        }
    }

    public void unknownVersion(long migrationId, String version) {
        if (shouldLogWarn()) {
            log.warn("UNKNOWN_SOURCE_VERSION id={} version={}", migrationId, version);
        }
    }

    /**
     * Log when a migration fails. Always logged.
     *
     * @param migrationId the migration identifier
     * @param error the error that caused the failure
     * @param step the step during which the failure occurred (may be null)
     */
    public void migrationFailed(long migrationId, Throwable error, String step) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        String stepName = step != null ? step : "NONE";
        log.error("MIGRATION_FAILED id={} step=\"{}\" error=\"{}\"", migrationId, stepName, errorMsg);
    }
}
