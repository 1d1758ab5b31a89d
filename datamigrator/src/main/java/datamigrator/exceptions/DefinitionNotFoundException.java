package datamigrator.exceptions;

/**
 * Thrown when classpath scanning finds no migration definitions.
 */
public class DefinitionNotFoundException extends RuntimeException {

    public DefinitionNotFoundException(String message) {
        super(message);
    }
}
