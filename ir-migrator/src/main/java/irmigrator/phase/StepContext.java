package irmigrator.phase;

import irmigrator.graph.NodeTable;
import irmigrator.plan.VersionRuleSet;

/**
 * Context information delivered to {@link MigrationStepListener} callbacks.
 */
public final class StepContext {

    private final long migrationId;
    private final VersionRuleSet step;
    private final NodeTable table;

    public StepContext(long migrationId, VersionRuleSet step, NodeTable table) {
        this.migrationId = migrationId;
        this.step = step;
        this.table = table;
    }

    /** Unique identifier of the migration. */
    public long migrationId() {
        return migrationId;
    }

    /** The version step being applied. */
    public VersionRuleSet step() {
        return step;
    }

    /** The node table being migrated. Listeners must not modify it. */
    public NodeTable table() {
        return table;
    }
}
