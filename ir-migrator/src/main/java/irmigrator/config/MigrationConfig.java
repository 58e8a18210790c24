package irmigrator.config;

import irmigrator.codec.SnapshotCodec;

import java.util.Objects;

/**
 * Central configuration for snapshot migration.
 *
 * <p>Covers:
 * <ul>
 *   <li>the envelope attribute holding the format version</li>
 *   <li>whether reference integrity is checked after every version step</li>
 *   <li>whether migrated snapshots are pretty-printed</li>
 *   <li>the alert level of the migration event log</li>
 * </ul>
 *
 * <p>Load from {@code migration.properties} or {@code migration.yml} with
 * {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    public static final MigrationConfig DEFAULTS = builder().build();

    private final String versionKey;
    private final boolean validateReferences;
    private final boolean prettyPrint;
    private final AlertLevel alertLevel;

    private MigrationConfig(Builder b) {
        this.versionKey = b.versionKey;
        this.validateReferences = b.validateReferences;
        this.prettyPrint = b.prettyPrint;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the envelope attribute holding the format version. */
    public String versionKey() { return versionKey; }

    /** Returns true if reference integrity is checked after each version step. */
    public boolean validateReferences() { return validateReferences; }

    /** Returns true if migrated snapshots are indented. */
    public boolean prettyPrint() { return prettyPrint; }

    /** Returns the alert level for migration events. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "versionKey=" + versionKey +
                ", validateReferences=" + validateReferences +
                ", prettyPrint=" + prettyPrint +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private String versionKey = SnapshotCodec.DEFAULT_VERSION_KEY;
        private boolean validateReferences = true;
        private boolean prettyPrint = true;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder versionKey(String key) {
            Objects.requireNonNull(key, "versionKey");
            if (key.isBlank()) throw new IllegalArgumentException("versionKey must not be blank");
            this.versionKey = key;
            return this;
        }

        public Builder validateReferences(boolean validate) {
            this.validateReferences = validate;
            return this;
        }

        public Builder prettyPrint(boolean pretty) {
            this.prettyPrint = pretty;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
