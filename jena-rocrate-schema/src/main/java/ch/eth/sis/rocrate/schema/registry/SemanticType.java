package ch.eth.sis.rocrate.schema.registry;

import ch.eth.sis.rocrate.schema.model.LiteralType;
import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.Objects;

/**
 * The value kind of a field: either a literal datatype or a reference to a
 * Type by id. The referenced Type may be registered later.
 *
 * @param literal the literal type, null for references
 * @param typeId the referenced Type id, null for literals
 */
public record SemanticType(LiteralType literal, String typeId) {

    /**
     * Validates that exactly one of the two components is set.
     */
    public SemanticType {
        if ((literal == null) == (typeId == null)) {
            throw new IllegalArgumentException(
                "Exactly one of literal and typeId must be set");
        }
        if (typeId != null) {
            typeId = Namespaces.canonical(typeId);
        }
    }

    /**
     * Creates a literal value kind.
     *
     * @param type the literal type
     * @return the semantic type
     */
    public static SemanticType of(final LiteralType type) {
        return new SemanticType(Objects.requireNonNull(type, "type"), null);
    }

    /**
     * Creates a reference to a Type.
     *
     * @param typeId the Type id
     * @return the semantic type
     */
    public static SemanticType reference(final String typeId) {
        return new SemanticType(null, Objects.requireNonNull(typeId, "typeId"));
    }

    /**
     * Checks whether values are literals.
     *
     * @return true for literal kinds
     */
    public boolean isLiteral() {
        return literal != null;
    }

    /**
     * Returns the id used as the property range.
     *
     * @return a literal datatype id or a Type id
     */
    public String rangeId() {
        return literal != null ? literal.getId() : typeId;
    }
}
