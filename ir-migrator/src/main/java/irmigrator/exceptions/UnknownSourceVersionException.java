package irmigrator.exceptions;

/**
 * Thrown when the version declared by a snapshot matches no known source
 * version of the configured version chain.
 *
 * <p>Migration never guesses an unknown source version and never silently
 * returns the input unchanged in that case.
 *
 * @see irmigrator.plan.VersionChain
 */
public class UnknownSourceVersionException extends MigrateException {

    private final String declaredVersion;

    /**
     * @param declaredVersion the version string found in the snapshot
     */
    public UnknownSourceVersionException(String declaredVersion) {
        super("Cannot update from version " + declaredVersion);
        this.declaredVersion = declaredVersion;
    }

    /** Returns the version string found in the snapshot. */
    public String getDeclaredVersion() {
        return declaredVersion;
    }
}
