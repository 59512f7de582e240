package ch.eth.sis.rocrate.schema.registry;

import java.util.Objects;

/**
 * One field of a structured type as seen by the schema: its name, value
 * kind, whether it is mandatory, whether it holds several values, the
 * external property it maps to and a description.
 *
 * @param name the field name, used as property id and label
 * @param semanticType the value kind
 * @param required true if every instance must carry a value
 * @param list true if the field holds any number of values
 * @param ontology the equivalent external property, may be null
 * @param comment the description, may be null
 */
public record FieldDescriptor(String name, SemanticType semanticType,
        boolean required, boolean list, String ontology, String comment) {

    /**
     * Validates the name and value kind.
     */
    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(semanticType, "semanticType");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
    }

    /**
     * Creates an optional, single-valued field.
     *
     * @param name the field name
     * @param semanticType the value kind
     * @return the descriptor
     */
    public static FieldDescriptor of(final String name,
            final SemanticType semanticType) {
        return new FieldDescriptor(name, semanticType, false, false, null, null);
    }

    /**
     * Returns a copy with the required flag specified.
     *
     * @param value the required flag
     * @return the copy
     */
    public FieldDescriptor withRequired(final boolean value) {
        return new FieldDescriptor(name, semanticType, value, list, ontology, comment);
    }

    /**
     * Returns a copy with the list flag specified.
     *
     * @param value the list flag
     * @return the copy
     */
    public FieldDescriptor withList(final boolean value) {
        return new FieldDescriptor(name, semanticType, required, value, ontology, comment);
    }

    /**
     * Returns a copy mapped to the external property specified.
     *
     * @param value the external property, may be null
     * @return the copy
     */
    public FieldDescriptor withOntology(final String value) {
        return new FieldDescriptor(name, semanticType, required, list, value, comment);
    }

    /**
     * Returns a copy with the description specified.
     *
     * @param value the comment, may be null
     * @return the copy
     */
    public FieldDescriptor withComment(final String value) {
        return new FieldDescriptor(name, semanticType, required, list, ontology, value);
    }
}
