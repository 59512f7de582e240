package ch.eth.sis.rocrate.schema.resolve;

import ch.eth.sis.rocrate.schema.model.LiteralValues;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A generic, mutable instance: a Type id, an optional id and named field
 * values. Instances may point at each other in cycles.
 *
 * <pre>{@code
 * Instance sarah = new Instance("Person").id("sarah").set("name", "Sarah");
 * Instance marcus = new Instance("Person").id("marcus").set("name", "Marcus");
 * sarah.add("colleagues", marcus);
 * marcus.add("colleagues", sarah);
 * }</pre>
 *
 * <p>Identity is object identity; {@code equals} is not overridden.</p>
 */
public final class Instance {

    /** Extractor for {@link Instance} objects. */
    static final InstanceExtractor EXTRACTOR = new InstanceExtractor() {
        @Override
        public boolean supports(final Object instance) {
            return instance instanceof Instance;
        }

        @Override
        public InstanceView extract(final Object instance) {
            Instance i = (Instance) instance;
            return new InstanceView(i.classId, i.id, new ArrayList<>(i.fields.values()));
        }
    };

    private final String classId;

    private String id;

    private final Map<String, FieldValue> fields = new LinkedHashMap<>();

    /**
     * Creates an instance of the Type specified.
     *
     * @param classId the Type id
     */
    public Instance(final String classId) {
        this.classId = Objects.requireNonNull(classId, "classId");
    }

    /**
     * Sets the explicit id.
     *
     * @param value the id
     * @return this instance
     */
    public Instance id(final String value) {
        this.id = value;
        return this;
    }

    /**
     * Returns the id of the instance's Type.
     *
     * @return the Type id
     */
    public String getClassId() {
        return classId;
    }

    /**
     * Returns the explicit id.
     *
     * @return the id, or null if none was set
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the value of a field as it was set: a literal, an instance,
     * a list of either, or the ids given to {@link #reference}.
     *
     * @param name the field name
     * @return the value, or null if the field is not set
     */
    public Object get(final String name) {
        FieldValue field = fields.get(name);
        return field == null ? null : field.value();
    }

    /**
     * Returns the names of the fields set, in the order they were first set.
     *
     * @return the field names
     */
    public Set<String> getFieldNames() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    /**
     * Sets a field. Literal values (or collections of them) are literal
     * fields; any other object is a reference.
     *
     * @param name the field name
     * @param value the value
     * @return this instance
     */
    public Instance set(final String name, final Object value) {
        fields.put(name, new FieldValue(name, value, !isLiteralValue(value)));
        return this;
    }

    /**
     * Appends a value to a multi-valued field.
     *
     * @param name the field name
     * @param value the value to append
     * @return this instance
     */
    public Instance add(final String name, final Object value) {
        FieldValue current = fields.get(name);
        List<Object> values = new ArrayList<>();
        if (current != null) {
            if (current.value() instanceof Collection<?> existing) {
                values.addAll(existing);
            } else if (current.value() != null) {
                values.add(current.value());
            }
        }
        values.add(value);
        return set(name, values);
    }

    /**
     * Sets a reference field to the ids specified, for targets that are not
     * part of the resolved object graph.
     *
     * @param name the field name
     * @param targetIds the referenced ids
     * @return this instance
     */
    public Instance reference(final String name, final String... targetIds) {
        fields.put(name, new FieldValue(name, List.of(targetIds), true));
        return this;
    }

    private static boolean isLiteralValue(final Object value) {
        if (value instanceof Collection<?> values) {
            return values.isEmpty() || LiteralValues.isLiteral(values.iterator().next());
        }
        return value == null || LiteralValues.isLiteral(value);
    }

    @Override
    public String toString() {
        return "Instance[" + classId + (id == null ? "" : " " + id) + "]";
    }
}
