package irmigrator.exceptions;

/**
 * Thrown when snapshot text cannot be decoded into an envelope: invalid JSON,
 * missing {@code nodes}/{@code attrs}/{@code root}, or a node record of the
 * wrong shape.
 *
 * @see irmigrator.codec.SnapshotCodec
 */
public class SnapshotFormatException extends MigrateException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
