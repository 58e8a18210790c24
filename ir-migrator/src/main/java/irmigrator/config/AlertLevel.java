package irmigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events emitted by
 * {@link irmigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: started, step transitions, completed, failures</li>
 *   <li>{@link #WARNING} - warnings and failures (the default)</li>
 *   <li>{@link #ERROR} - failures only</li>
 * </ul>
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
