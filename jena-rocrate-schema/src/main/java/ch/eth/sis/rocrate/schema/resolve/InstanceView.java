package ch.eth.sis.rocrate.schema.resolve;

import java.util.List;
import java.util.Objects;

/**
 * What the resolver sees of an instance: the id of its Type, the id it
 * declares for itself (if any) and its fields in declaration order.
 *
 * @param classId the Type id
 * @param explicitId the declared id, or null
 * @param fields the fields, in order
 */
public record InstanceView(String classId, String explicitId,
        List<FieldValue> fields) {

    /**
     * Validates and copies the components.
     */
    public InstanceView {
        Objects.requireNonNull(classId, "classId");
        fields = List.copyOf(fields);
    }
}
