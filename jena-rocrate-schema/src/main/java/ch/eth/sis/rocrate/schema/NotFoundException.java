package ch.eth.sis.rocrate.schema;

import java.util.Objects;

/**
 * Signals a reference to a Type, property, restriction or entry id that is
 * not known to the current session.
 */
public class NotFoundException extends SchemaException {

    private static final long serialVersionUID = -2875210496127430512L;

    /**
     * Kind of element that could not be found.
     */
    public enum Kind {
        /** A Type (class) id. */
        TYPE,
        /** A property id. */
        PROPERTY,
        /** A restriction id. */
        RESTRICTION,
        /** A metadata entry id. */
        ENTRY
    }

    private final Kind kind;

    private final String id;

    /**
     * Creates a new instance for the missing element specified.
     *
     * @param kind the kind of the missing element
     * @param id the missing id
     */
    public NotFoundException(final Kind kind, final String id) {
        this(kind, id, null);
    }

    /**
     * Creates a new instance for the missing element specified, with an
     * additional message describing where the id was referenced.
     *
     * @param kind the kind of the missing element
     * @param id the missing id
     * @param detail optional detail appended to the generated message
     */
    public NotFoundException(final Kind kind, final String id, final String detail) {
        super("Unknown " + kind.name().toLowerCase() + " '" + id + "'"
            + (detail == null ? "" : " (" + detail + ")"));
        this.kind = Objects.requireNonNull(kind);
        this.id = id;
    }

    /**
     * Returns the kind of the missing element.
     *
     * @return the kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the id that could not be resolved.
     *
     * @return the missing id
     */
    public String getId() {
        return id;
    }
}
