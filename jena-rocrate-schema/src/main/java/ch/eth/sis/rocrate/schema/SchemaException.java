package ch.eth.sis.rocrate.schema;

/**
 * Base class of the errors raised while building, resolving, validating or
 * importing a schema graph.
 *
 * <p>All subclasses signal defects of the caller's input rather than
 * transient conditions, so none of them is worth retrying.</p>
 */
public class SchemaException extends RuntimeException {

    private static final long serialVersionUID = 4517180313548112937L;

    /**
     * Creates a new instance with the message specified.
     *
     * @param message the error message
     */
    public SchemaException(final String message) {
        super(message);
    }

    /**
     * Creates a new instance with the message and cause specified.
     *
     * @param message the error message
     * @param cause the cause of this exception
     */
    public SchemaException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
