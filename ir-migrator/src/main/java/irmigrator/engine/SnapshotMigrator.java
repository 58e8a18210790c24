package irmigrator.engine;

import irmigrator.alert.MigrationAlertLogger;
import irmigrator.codec.RuntimeStringEncoder;
import irmigrator.codec.SnapshotCodec;
import irmigrator.config.MigrationConfig;
import irmigrator.config.MigrationConfigLoader;
import irmigrator.exceptions.MigrateException;
import irmigrator.exceptions.UnknownSourceVersionException;
import irmigrator.graph.NodeTable;
import irmigrator.graph.Snapshot;
import irmigrator.metrics.MigrationMetrics;
import irmigrator.metrics.MigrationMetricsCollector;
import irmigrator.phase.MigrationStepListener;
import irmigrator.phase.NoopStepListener;
import irmigrator.phase.StepContext;
import irmigrator.plan.VersionChain;
import irmigrator.plan.VersionRuleSet;
import irmigrator.tvm.TvmRuleSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Migrates snapshots from any known version of a {@link VersionChain} to a
 * later one, by default the terminal version.
 *
 * <p>A migration:
 * <ol>
 *   <li>decodes the envelope (text entry points only)</li>
 *   <li>selects the steps from the declared version to the target</li>
 *   <li>runs each step's {@link RuleApplicator} pass in order, validating
 *       reference integrity after every step when enabled</li>
 *   <li>stamps the target version once all steps have run</li>
 *   <li>re-encodes the envelope (text entry points only)</li>
 * </ol>
 *
 * <p>A snapshot already at the target version is returned unchanged, its
 * declared version included.
 *
 * <p>Failures are fatal: no output is produced and a {@link Snapshot} passed
 * in directly is left partially rewritten and must be discarded.
 *
 * <p>The migrator holds only immutable configuration, so one instance may run
 * concurrent migrations of independent snapshots.
 *
 * <h2>Example:</h2>
 * <pre>
 * SnapshotMigrator migrator = SnapshotMigrator.withDefaultRules();
 * String current = migrator.migrate(Files.readString(legacyJson));
 * </pre>
 */
public final class SnapshotMigrator {

    private static final Logger log = LoggerFactory.getLogger(SnapshotMigrator.class);

    private static final AtomicLong MIGRATION_COUNTER = new AtomicLong(1L);

    private final VersionChain chain;
    private final MigrationConfig config;
    private final SnapshotCodec codec;
    private final MigrationStepListener listener;
    private final MigrationAlertLogger alerts;
    private final RuleApplicator applicator = new RuleApplicator();
    private final ReferenceValidator validator = new ReferenceValidator();

    public SnapshotMigrator(VersionChain chain) {
        this(chain, MigrationConfig.DEFAULTS, null);
    }

    public SnapshotMigrator(VersionChain chain, MigrationConfig config) {
        this(chain, config, null);
    }

    /**
     * @param chain the version steps to apply
     * @param config migration configuration
     * @param listener step listener, or null for none
     */
    public SnapshotMigrator(VersionChain chain, MigrationConfig config, MigrationStepListener listener) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = listener == null ? NoopStepListener.INSTANCE : listener;
        this.codec = new SnapshotCodec(config.versionKey(), config.prettyPrint());
        this.alerts = new MigrationAlertLogger(config.alertLevel());
        log.debug("Created migrator for {} with {}", chain, config);
    }

    /**
     * Creates a migrator for the built-in IR version chain with default configuration.
     */
    public static SnapshotMigrator withDefaultRules() {
        return withDefaultRules(MigrationConfig.DEFAULTS);
    }

    /**
     * Creates a migrator for the built-in IR version chain.
     *
     * @param config migration configuration
     * @see TvmRuleSets#defaultChain(irmigrator.codec.ValueEncoder)
     */
    public static SnapshotMigrator withDefaultRules(MigrationConfig config) {
        return new SnapshotMigrator(TvmRuleSets.defaultChain(new RuntimeStringEncoder()), config);
    }

    /**
     * Creates a migrator for the built-in IR version chain, configured from
     * {@code migration.properties} or {@code migration.yml} on the classpath.
     *
     * @throws irmigrator.config.MigrationConfigException if no config file is found
     * @see MigrationConfigLoader#load()
     */
    public static SnapshotMigrator fromClasspathConfig() {
        return withDefaultRules(MigrationConfigLoader.load());
    }

    public VersionChain chain() {
        return chain;
    }

    public MigrationConfig config() {
        return config;
    }

    public SnapshotCodec codec() {
        return codec;
    }

    // ===== text entry points =====

    /**
     * Migrates serialized snapshot text to the terminal version.
     *
     * @param snapshotText the serialized envelope
     * @return the re-serialized, migrated envelope
     * @throws MigrateException if decoding or any version step fails
     */
    public String migrate(String snapshotText) throws MigrateException {
        return migrateTo(snapshotText, chain.terminalVersion());
    }

    /**
     * Migrates serialized snapshot text to a known target version.
     *
     * @param snapshotText the serialized envelope
     * @param targetVersion a known version at or after the declared one
     * @return the re-serialized, migrated envelope
     * @throws MigrateException if decoding or any version step fails
     */
    public String migrateTo(String snapshotText, String targetVersion) throws MigrateException {
        Snapshot snapshot = codec.decode(snapshotText);
        migrateTo(snapshot, targetVersion);
        return codec.encode(snapshot);
    }

    // ===== snapshot entry points =====

    /**
     * Migrates a decoded snapshot in place to the terminal version.
     *
     * @param snapshot the snapshot to rewrite
     * @return metrics of the migration
     * @throws MigrateException if any version step fails
     */
    public MigrationMetrics migrate(Snapshot snapshot) throws MigrateException {
        return migrateTo(snapshot, chain.terminalVersion());
    }

    /**
     * Migrates a decoded snapshot in place to a known target version.
     *
     * @param snapshot the snapshot to rewrite
     * @param targetVersion a known version at or after the declared one
     * @return metrics of the migration
     * @throws MigrateException if any version step fails
     * @throws IllegalArgumentException if the target is unknown or before the source
     */
    public MigrationMetrics migrateTo(Snapshot snapshot, String targetVersion) throws MigrateException {
        Objects.requireNonNull(snapshot, "snapshot");
        final long migrationId = MIGRATION_COUNTER.getAndIncrement();
        final String declared = snapshot.version();
        final NodeTable table = snapshot.nodes();
        final boolean liveRoot = table.contains(snapshot.root()) && !table.isTombstoned(snapshot.root());

        MigrationMetricsCollector collector = new MigrationMetricsCollector()
                .start(migrationId, declared, table.size());
        alerts.migrationStarted(migrationId, declared, table.size());

        List<VersionRuleSet> steps;
        try {
            steps = chain.stepsBetween(declared, targetVersion);
        } catch (UnknownSourceVersionException e) {
            alerts.unknownVersion(migrationId, declared);
            alerts.migrationFailed(migrationId, e, null);
            throw e;
        }

        String currentStep = null;
        try {
            for (VersionRuleSet step : steps) {
                currentStep = step.label();
                StepContext ctx = new StepContext(migrationId, step, table);
                listener.beforeStep(ctx);
                alerts.stepStarted(migrationId, currentStep);

                PassResult pass = collector.timed(currentStep, () -> runStep(step, snapshot, liveRoot));
                collector.record(pass);

                alerts.stepCompleted(migrationId, currentStep, pass.rewritten(), pass.appended(), pass.tombstoned());
                listener.afterStep(ctx, pass);
            }
        } catch (MigrateException e) {
            if (currentStep != null) e.atStage(currentStep);
            alerts.migrationFailed(migrationId, e, currentStep);
            throw e;
        } catch (RuntimeException e) {
            MigrateException wrapped = new MigrateException("Migration failed: " + e.getMessage(), e);
            if (currentStep != null) wrapped.atStage(currentStep);
            alerts.migrationFailed(migrationId, wrapped, currentStep);
            throw wrapped;
        }

        if (!steps.isEmpty()) {
            snapshot.version(targetVersion);
        } else {
            log.debug("Snapshot already at version {}, nothing to migrate", declared);
        }

        MigrationMetrics metrics = collector.finish(snapshot.version(), table.size());
        log.debug("Migration metrics: {}", metrics.summary());
        alerts.migrationCompleted(migrationId, metrics);
        return metrics;
    }

    private PassResult runStep(VersionRuleSet step, Snapshot snapshot, boolean liveRoot) throws MigrateException {
        PassResult pass = applicator.apply(step, snapshot.nodes());
        if (config.validateReferences()) {
            validator.validate(snapshot.nodes(), snapshot.root(), liveRoot);
        }
        return pass;
    }
}
