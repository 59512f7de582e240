package ch.eth.sis.rocrate.schema;

/**
 * Signals a JSON-LD document, or a node inside it, that lacks the structure
 * required for import (for instance a node without {@code @id}).
 */
public class MalformedDocumentException extends SchemaException {

    private static final long serialVersionUID = -1780563468019842235L;

    private final String node;

    /**
     * Creates a new instance for a document-level problem.
     *
     * @param message the error message
     */
    public MalformedDocumentException(final String message) {
        this(message, null, null);
    }

    /**
     * Creates a new instance for a problem found in the node specified.
     *
     * @param message the error message
     * @param node the JSON text of the offending node, may be null
     */
    public MalformedDocumentException(final String message, final String node) {
        this(message, node, null);
    }

    /**
     * Creates a new instance with node text and cause.
     *
     * @param message the error message
     * @param node the JSON text of the offending node, may be null
     * @param cause the cause, may be null
     */
    public MalformedDocumentException(final String message, final String node,
            final Throwable cause) {
        super(message + (node == null ? "" : "\nNode:\n" + node), cause);
        this.node = node;
    }

    /**
     * Returns the JSON text of the offending node, if known.
     *
     * @return the node text or null for document-level problems
     */
    public String getNode() {
        return node;
    }
}
