package ch.eth.sis.rocrate.schema;

/**
 * Signals an instance object whose entry id cannot be derived
 * deterministically: it carries no explicit id and no literal field a
 * content id could be computed from.
 */
public class IdentityMissingException extends SchemaException {

    private static final long serialVersionUID = 7093529618404405716L;

    private final String classId;

    /**
     * Creates a new instance for an object of the class specified.
     *
     * @param classId the Type id the object was being extracted as
     * @param description a short description of the object
     */
    public IdentityMissingException(final String classId, final String description) {
        super("Cannot derive an identity for instance of '" + classId + "': "
            + description + " has no id and no literal fields");
        this.classId = classId;
    }

    /**
     * Returns the Type id of the offending object.
     *
     * @return the class id
     */
    public String getClassId() {
        return classId;
    }
}
