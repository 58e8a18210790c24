package irmigrator.exceptions;

/**
 * Thrown when a rewrite rule finds a node whose shape it does not expect:
 * wrong type key, missing attribute, or an attribute that should hold a node
 * index but does not resolve to one.
 *
 * <p>This signals a producer bug or a misregistered rule, not a recoverable
 * data problem.
 */
public class MalformedNodeException extends MigrateException {

    public MalformedNodeException(String message, String typeKey) {
        super(message, typeKey, null);
    }

    public MalformedNodeException(String message, String typeKey, Throwable cause) {
        super(message, typeKey, cause);
    }
}
