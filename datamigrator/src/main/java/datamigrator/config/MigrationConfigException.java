package datamigrator.config;

/**
 * Exception thrown when migration configuration cannot be loaded.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>A configuration file cannot be parsed (invalid YAML or properties syntax)</li>
 * </ul>
 *
 * <p>Invalid individual values are not fatal: the loader logs them and keeps
 * the default. This is an unchecked exception so configuration loading can sit
 * in initialization code without forced exception handling.
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
