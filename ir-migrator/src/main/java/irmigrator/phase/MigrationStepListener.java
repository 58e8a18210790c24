package irmigrator.phase;

import irmigrator.engine.PassResult;
import irmigrator.exceptions.MigrateException;

/**
 * Receives a signal around every version step of a migration.
 *
 * <p>Listeners observe; they may refuse to continue by throwing, which fails
 * the whole migration like any rule failure.
 *
 * @see StepContext
 */
public interface MigrationStepListener {

    /**
     * Called before a version step is applied.
     *
     * @param ctx step context
     * @throws MigrateException if the migration should be aborted
     */
    void beforeStep(StepContext ctx) throws MigrateException;

    /**
     * Called after a version step was applied and, when enabled, its
     * references were validated.
     *
     * @param ctx step context
     * @param result node counts of the pass
     * @throws MigrateException if the migration should be aborted
     */
    void afterStep(StepContext ctx, PassResult result) throws MigrateException;
}
