package irmigrator.phase;

import irmigrator.engine.PassResult;

/**
 * Default listener used when none is supplied.
 */
public enum NoopStepListener implements MigrationStepListener {
    INSTANCE;

    @Override
    public void beforeStep(StepContext ctx) { /* no-op */ }

    @Override
    public void afterStep(StepContext ctx, PassResult result) { /* no-op */ }
}
