package ch.eth.sis.rocrate.schema.resolve;

import java.util.Objects;

/**
 * One extracted field of an instance.
 *
 * @param name the field name
 * @param value a literal, an object, an id, or a collection of them
 * @param reference true if the value points at other instances
 */
public record FieldValue(String name, Object value, boolean reference) {

    /**
     * Validates the name.
     */
    public FieldValue {
        Objects.requireNonNull(name, "name");
    }
}
