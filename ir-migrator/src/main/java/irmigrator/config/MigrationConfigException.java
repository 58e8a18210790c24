package irmigrator.config;

/**
 * Exception thrown when migration configuration cannot be loaded.
 *
 * <p>Unchecked, so that configuration loading can sit in initialization code
 * without forced exception handling.
 *
 * @see MigrationConfigLoader
 */
public class MigrationConfigException extends RuntimeException {

    public MigrationConfigException(String message) {
        super(message);
    }

    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
