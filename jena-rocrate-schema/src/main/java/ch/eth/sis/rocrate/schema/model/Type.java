package ch.eth.sis.rocrate.schema.model;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.OWL2;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;

/**
 * A class declaration in the schema graph together with the properties it
 * owns and the cardinality restrictions on them.
 *
 * <p>Building a Type keeps three things consistent:</p>
 * <ul>
 *   <li>every owned property has the Type in its domain;</li>
 *   <li>every required property has a restriction with a lower bound of
 *       at least one (one is generated if absent);</li>
 *   <li>a property restricted to at least one value is required.</li>
 * </ul>
 *
 * <p>Example:</p>
 * <pre>{@code
 * Type person = Type.builder("Person")
 *     .comment("A human being")
 *     .subClassOf("schema:Thing")
 *     .property(TypeProperty.builder("name").range(LiteralType.STRING)
 *         .required(true).build())
 *     .build();
 * }</pre>
 */
public final class Type {

    private final String id;

    private final String label;

    private final String comment;

    private final List<String> subClassOf;

    private final List<String> ontologicalAnnotations;

    private final List<TypeProperty> properties;

    private final List<Restriction> restrictions;

    private Type(final String id, final Builder builder,
            final List<TypeProperty> properties,
            final List<Restriction> restrictions) {
        this.id = id;
        this.label = builder.label;
        this.comment = builder.comment;
        this.subClassOf = List.copyOf(builder.subClassOf);
        this.ontologicalAnnotations = List.copyOf(builder.ontologicalAnnotations);
        this.properties = List.copyOf(properties);
        this.restrictions = List.copyOf(restrictions);
    }

    /**
     * Starts building a Type.
     *
     * @param id the Type id
     * @return a new builder
     */
    public static Builder builder(final String id) {
        return new Builder(id);
    }

    /**
     * Returns a builder initialized with this Type's state.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder(id).label(label).comment(comment);
        subClassOf.forEach(b::subClassOf);
        ontologicalAnnotations.forEach(b::ontologicalAnnotation);
        properties.forEach(b::property);
        restrictions.forEach(b::restriction);
        return b;
    }

    /**
     * Returns the Type id.
     *
     * @return the id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the label.
     *
     * @return the label, or null
     */
    public String getLabel() {
        return label;
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
     * Returns the parent classes, restrictions excluded.
     *
     * @return parent class ids
     */
    public List<String> getSubClassOf() {
        return subClassOf;
    }

    /**
     * Returns the external classes this Type is equivalent to.
     *
     * @return absolute IRIs
     */
    public List<String> getOntologicalAnnotations() {
        return ontologicalAnnotations;
    }

    /**
     * Returns the properties this Type owns, each with the Type in its domain.
     *
     * @return the properties, in insertion order
     */
    public List<TypeProperty> getProperties() {
        return properties;
    }

    /**
     * Returns the cardinality restrictions this Type owns.
     *
     * @return the restrictions, in property order
     */
    public List<Restriction> getRestrictions() {
        return restrictions;
    }

    /**
     * Looks up an owned property.
     *
     * @param propertyId the property id
     * @return the property, if this Type owns it
     */
    public Optional<TypeProperty> getProperty(final String propertyId) {
        String canonical = Namespaces.canonical(propertyId);
        return properties.stream()
            .filter(p -> p.getId().equals(canonical))
            .findFirst();
    }

    /**
     * Looks up the restriction on an owned property.
     *
     * @param propertyId the property id
     * @return the restriction, if there is one
     */
    public Optional<Restriction> getRestrictionFor(final String propertyId) {
        String canonical = Namespaces.canonical(propertyId);
        return restrictions.stream()
            .filter(r -> r.getPropertyId().equals(canonical))
            .findFirst();
    }

    /**
     * Emits the triples describing the class node only: its type, label,
     * comment, equivalent classes, parents and restriction links.
     *
     * @param namespaces the id to IRI mapping
     * @return the triples, in a fixed order
     */
    public List<Triple> classTriples(final Namespaces namespaces) {
        Node self = namespaces.iri(id);
        List<Triple> triples = new ArrayList<>();
        triples.add(Triple.create(self, RDF.type.asNode(), OWL2.Class.asNode()));
        if (label != null) {
            triples.add(Triple.create(self, RDFS.label.asNode(),
                NodeFactory.createLiteralString(label)));
        }
        if (comment != null) {
            triples.add(Triple.create(self, RDFS.comment.asNode(),
                NodeFactory.createLiteralString(comment)));
        }
        for (String annotation : ontologicalAnnotations) {
            triples.add(Triple.create(self, OWL2.equivalentClass.asNode(),
                NodeFactory.createURI(annotation)));
        }
        for (String parent : subClassOf) {
            triples.add(Triple.create(self, RDFS.subClassOf.asNode(),
                namespaces.iri(parent)));
        }
        for (Restriction restriction : restrictions) {
            triples.add(Triple.create(self, RDFS.subClassOf.asNode(),
                namespaces.iri(restriction.getId())));
        }
        return triples;
    }

    /**
     * Emits the class triples followed by the triples of every owned
     * property and restriction.
     *
     * @param namespaces the id to IRI mapping
     * @return the triples, in a fixed order
     */
    public List<Triple> toTriples(final Namespaces namespaces) {
        List<Triple> triples = classTriples(namespaces);
        for (TypeProperty property : properties) {
            triples.addAll(property.toTriples(namespaces));
        }
        for (Restriction restriction : restrictions) {
            triples.addAll(restriction.toTriples(namespaces));
        }
        return triples;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Type other)) {
            return false;
        }
        return id.equals(other.id) && Objects.equals(label, other.label)
            && Objects.equals(comment, other.comment)
            && subClassOf.equals(other.subClassOf)
            && ontologicalAnnotations.equals(other.ontologicalAnnotations)
            && properties.equals(other.properties)
            && restrictions.equals(other.restrictions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, comment, subClassOf,
            ontologicalAnnotations, properties, restrictions);
    }

    @Override
    public String toString() {
        return "Type[" + id + " properties=" + properties.size()
            + " restrictions=" + restrictions.size() + "]";
    }

    /**
     * Builder for {@link Type}.
     */
    public static final class Builder {
        private final String id;
        private String label;
        private String comment;
        private final List<String> subClassOf = new ArrayList<>();
        private final List<String> ontologicalAnnotations = new ArrayList<>();
        private final Map<String, TypeProperty> properties = new LinkedHashMap<>();
        private final Map<String, Restriction> restrictions = new LinkedHashMap<>();

        private Builder(final String typeId) {
            this.id = typeId;
        }

        /**
         * Sets the label ({@code rdfs:label}).
         *
         * @param value the label, may be null
         * @return this builder
         */
        public Builder label(final String value) {
            this.label = value;
            return this;
        }

        /**
         * Sets the description ({@code rdfs:comment}).
         *
         * @param value the comment, may be null
         * @return this builder
         */
        public Builder comment(final String value) {
            this.comment = value;
            return this;
        }

        /**
         * Adds a parent class.
         *
         * @param parentId a local Type id or an external class
         * @return this builder
         */
        public Builder subClassOf(final String parentId) {
            String canonical = Namespaces.canonical(parentId);
            if (!subClassOf.contains(canonical)) {
                subClassOf.add(canonical);
            }
            return this;
        }

        /**
         * Adds an external class this Type is equivalent to.
         *
         * @param iri the external class, absolute or with a well-known prefix
         * @return this builder
         */
        public Builder ontologicalAnnotation(final String iri) {
            String expanded = Namespaces.expandWellKnown(iri);
            if (!ontologicalAnnotations.contains(expanded)) {
                ontologicalAnnotations.add(expanded);
            }
            return this;
        }

        /**
         * Adds a property; a property with the same id replaces the earlier
         * one in place.
         *
         * @param property the property
         * @return this builder
         */
        public Builder property(final TypeProperty property) {
            Objects.requireNonNull(property, "property");
            properties.put(property.getId(), property);
            return this;
        }

        /**
         * Adds a restriction on an owned property; a restriction on the same
         * property replaces the earlier one in place.
         *
         * @param restriction the restriction
         * @return this builder
         */
        public Builder restriction(final Restriction restriction) {
            Objects.requireNonNull(restriction, "restriction");
            restrictions.put(restriction.getPropertyId(), restriction);
            return this;
        }

        /**
         * Builds the Type.
         *
         * @return the immutable Type
         * @throws IllegalArgumentException if a restriction targets a
         *     property the Type does not own, or a required property is
         *     restricted to an optional count
         */
        public Type build() {
            String typeId = Restriction.requireId(id, "id");
            for (String propertyId : restrictions.keySet()) {
                if (!properties.containsKey(propertyId)) {
                    throw new IllegalArgumentException("Type " + typeId
                        + " has a restriction on " + propertyId
                        + " but does not own that property");
                }
            }
            List<TypeProperty> builtProperties = new ArrayList<>(properties.size());
            List<Restriction> builtRestrictions = new ArrayList<>(properties.size());
            for (TypeProperty property : properties.values()) {
                Restriction restriction = restrictions.get(property.getId());
                TypeProperty owned = property.withDomain(typeId);
                if (restriction == null) {
                    if (owned.isRequired()) {
                        restriction = Restriction.owned(typeId, owned.getId(), 1, null);
                    }
                } else if (restriction.isMandatory()) {
                    owned = owned.withRequired(true);
                } else if (owned.isRequired()) {
                    throw new IllegalArgumentException("Property " + owned.getId()
                        + " is required on " + typeId + " but restricted by "
                        + restriction);
                }
                builtProperties.add(owned);
                if (restriction != null) {
                    builtRestrictions.add(restriction);
                }
            }
            return new Type(typeId, this, builtProperties, builtRestrictions);
        }
    }
}
