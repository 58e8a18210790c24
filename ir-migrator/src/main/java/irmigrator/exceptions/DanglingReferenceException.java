package irmigrator.exceptions;

/**
 * Thrown when, at the end of a version step, a node holds an index reference
 * that points outside the node table or at a tombstoned node.
 *
 * @see irmigrator.engine.ReferenceValidator
 */
public class DanglingReferenceException extends MigrateException {

    private final int referencedIndex;

    /**
     * @param message description of the broken reference
     * @param typeKey type key of the node holding the reference
     * @param referencedIndex the index that failed to resolve
     */
    public DanglingReferenceException(String message, String typeKey, int referencedIndex) {
        super(message, typeKey, null);
        this.referencedIndex = referencedIndex;
    }

    /** Returns the index that failed to resolve. */
    public int getReferencedIndex() {
        return referencedIndex;
    }
}
