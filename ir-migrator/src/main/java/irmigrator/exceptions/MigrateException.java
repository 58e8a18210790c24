package irmigrator.exceptions;

/**
 * Exception thrown when a snapshot migration fails.
 *
 * <p>Every failure is fatal for the migration in progress: the node table may
 * already be partially rewritten and must be discarded by the caller.
 *
 * <p>The exception carries diagnostic context that is appended to
 * {@link #getMessage()}:
 * <ul>
 *   <li>the version step being applied (for example {@code 0.6 -> 0.7})</li>
 *   <li>the index of the node being visited</li>
 *   <li>the type key of the offending node</li>
 * </ul>
 *
 * <p>The step and node index are usually unknown where the failure is detected
 * (inside a rewrite rule) and are attached later by the rule applicator via
 * {@link #atNode(String, int)}.
 *
 * @see irmigrator.engine.RuleApplicator
 * @see irmigrator.engine.SnapshotMigrator
 */
public class MigrateException extends Exception {

    private final String typeKey;

    private String stage;
    private Integer nodeIndex;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * Creates a new migration exception naming the type key of the node involved.
     *
     * @param message the error message
     * @param typeKey type key of the offending node (may be null)
     * @param cause the underlying cause (may be null)
     */
    public MigrateException(String message, String typeKey, Throwable cause) {
        super(message, cause);
        this.typeKey = typeKey;
    }

    // ---------------- context ----------------

    /**
     * Attaches the version step and node index to this exception, unless
     * they were already set by an inner layer.
     *
     * @param stage label of the version step being applied
     * @param nodeIndex index of the node being visited
     * @return this exception, for rethrowing
     */
    public MigrateException atNode(String stage, int nodeIndex) {
        if (this.stage == null) this.stage = stage;
        if (this.nodeIndex == null) this.nodeIndex = nodeIndex;
        return this;
    }

    /**
     * Attaches the version step to this exception, unless already set.
     *
     * @param stage label of the version step being applied
     * @return this exception, for rethrowing
     */
    public MigrateException atStage(String stage) {
        if (this.stage == null) this.stage = stage;
        return this;
    }

    // ---------------- getters ----------------

    /** Returns the version step label, or null if not set. */
    public String getStage() {
        return stage;
    }

    /** Returns the index of the node being visited, or null if not set. */
    public Integer getNodeIndex() {
        return nodeIndex;
    }

    /** Returns the type key of the offending node, or null if not set. */
    public String getTypeKey() {
        return typeKey;
    }

    /**
     * Returns the message without the diagnostic suffix.
     *
     * @return the message as passed to the constructor
     */
    public String getBaseMessage() {
        return super.getMessage();
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        String base = super.getMessage();
        StringBuilder sb = new StringBuilder(base == null ? "" : base);

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (nodeIndex != null) sb.append(" [node=").append(nodeIndex).append("]");
        if (typeKey != null) sb.append(" [type_key=").append(typeKey).append("]");

        return sb.toString();
    }
}
