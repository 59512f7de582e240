package ch.eth.sis.rocrate.schema.registry;

import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.vocab.RoCrateVocab;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A structural description of a Type: an id, optional annotations and an
 * ordered list of fields. Referenced Types need not exist yet; they are
 * checked by {@link SchemaRegistry#resolveReferences()}.
 *
 * <p>Conversion to a {@link Type} creates one property per field, labelled
 * with the field name, and one restriction per field: at least one value if
 * the field is required, at most one value unless it is a list.</p>
 */
public final class TypeTemplate {

    private final String id;

    private final String comment;

    private final List<String> ontologicalAnnotations;

    private final List<FieldDescriptor> fields;

    private TypeTemplate(final Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.comment = builder.comment;
        this.ontologicalAnnotations = List.copyOf(builder.ontologicalAnnotations);
        this.fields = List.copyOf(builder.fields);
    }

    /**
     * Starts building a template.
     *
     * @param id the Type id
     * @return a new builder
     */
    public static Builder builder(final String id) {
        return new Builder(id);
    }

    /**
     * Describes a Java class through an introspector.
     *
     * @param javaType the class
     * @param introspector the field source
     * @return a template named after the class's simple name
     */
    public static TypeTemplate from(final Class<?> javaType,
            final ModelIntrospector introspector) {
        Builder b = builder(javaType.getSimpleName());
        introspector.describe(javaType).forEach(b::field);
        return b.build();
    }

    /**
     * Returns the id of the Type the template builds.
     *
     * @return the Type id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the description.
     *
     * @return the comment, or null
     */
    public String getComment() {
        return comment;
    }

    /**
     * Returns the external classes the Type is equivalent to.
     *
     * @return the IRIs
     */
    public List<String> getOntologicalAnnotations() {
        return ontologicalAnnotations;
    }

    /**
     * Returns the fields in declaration order.
     *
     * @return the fields
     */
    public List<FieldDescriptor> getFields() {
        return fields;
    }

    /**
     * Converts the template into a Type.
     *
     * @return the Type
     */
    public Type toType() {
        Type.Builder type = Type.builder(id)
            .label(id)
            .comment(comment)
            .subClassOf(RoCrateVocab.THING);
        ontologicalAnnotations.forEach(type::ontologicalAnnotation);
        for (FieldDescriptor field : fields) {
            TypeProperty.Builder property = TypeProperty.builder(field.name())
                .label(field.name())
                .comment(field.comment())
                .range(field.semanticType().rangeId())
                .required(field.required());
            if (field.ontology() != null) {
                property.ontologicalAnnotation(field.ontology());
            }
            type.property(property.build());
            type.restriction(Restriction.owned(id, field.name(),
                field.required() ? 1 : 0, field.list() ? null : 1));
        }
        return type.build();
    }

    @Override
    public String toString() {
        return "TypeTemplate[" + id + " fields=" + fields.size() + "]";
    }

    /**
     * Builder for {@link TypeTemplate}.
     */
    public static final class Builder {
        private final String id;
        private String comment;
        private final List<String> ontologicalAnnotations = new ArrayList<>();
        private final List<FieldDescriptor> fields = new ArrayList<>();

        private Builder(final String typeId) {
            this.id = typeId;
        }

        /**
         * Sets the description.
         *
         * @param value the comment, may be null
         * @return this builder
         */
        public Builder comment(final String value) {
            this.comment = value;
            return this;
        }

        /**
         * Adds an external class the Type is equivalent to.
         *
         * @param iri the external class IRI
         * @return this builder
         */
        public Builder ontologicalAnnotation(final String iri) {
            ontologicalAnnotations.add(iri);
            return this;
        }

        /**
         * Appends a field.
         *
         * @param field the field
         * @return this builder
         */
        public Builder field(final FieldDescriptor field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        /**
         * Builds the template.
         *
         * @return the immutable template
         */
        public TypeTemplate build() {
            return new TypeTemplate(this);
        }
    }
}
