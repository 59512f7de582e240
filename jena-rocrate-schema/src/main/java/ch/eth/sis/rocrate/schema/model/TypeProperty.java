package ch.eth.sis.rocrate.schema.model;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.OWL2;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;

/**
 * An RDF property declaration: which Types may carry it (domain) and which
 * values it takes (range: literal datatypes or Type ids).
 *
 * <p>Instances are immutable; use {@link #builder(String)} or
 * {@link #toBuilder()} to derive new ones.</p>
 */
public final class TypeProperty {

    private final String id;

    private final String label;

    private final String comment;

    private final List<String> domainIncludes;

    private final List<String> rangeIncludes;

    private final List<String> ontologicalAnnotations;

    private final boolean required;

    private TypeProperty(final Builder builder) {
        this.id = Namespaces.canonical(Restriction.requireId(builder.id, "id"));
        this.label = builder.label;
        this.comment = builder.comment;
        this.domainIncludes = List.copyOf(builder.domainIncludes);
        this.rangeIncludes = List.copyOf(builder.rangeIncludes);
        this.ontologicalAnnotations = List.copyOf(builder.ontologicalAnnotations);
        this.required = builder.required;
    }

    /**
     * Starts building a property.
     *
     * @param id the property id
     * @return a new builder
     */
    public static Builder builder(final String id) {
        return new Builder(id);
    }

    /**
     * Returns a builder initialized with this property's state.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder(id)
            .label(label)
            .comment(comment)
            .required(required);
        domainIncludes.forEach(b::domain);
        rangeIncludes.forEach(b::range);
        ontologicalAnnotations.forEach(b::ontologicalAnnotation);
        return b;
    }

    /**
     * Returns a copy whose domain also includes the Type specified.
     *
     * @param typeId the Type id
     * @return this property if the Type is already in the domain, a copy
     *     otherwise
     */
    public TypeProperty withDomain(final String typeId) {
        if (domainIncludes.contains(Namespaces.canonical(typeId))) {
            return this;
        }
        return toBuilder().domain(typeId).build();
    }

    /**
     * Returns a copy whose domain drops the Type ids specified.
     *
     * @param typeIds the Type ids to remove
     * @return this property if none of them is in the domain, a copy
     *     otherwise
     */
    public TypeProperty withoutDomains(final Collection<String> typeIds) {
        List<String> kept = new ArrayList<>(domainIncludes);
        if (!kept.removeIf(typeIds::contains)) {
            return this;
        }
        Builder b = toBuilder();
        b.domainIncludes.clear();
        b.domainIncludes.addAll(kept);
        return b.build();
    }

    /**
     * Returns a copy with the required flag specified.
     *
     * @param value the required flag
     * @return this property if unchanged, a copy otherwise
     */
    public TypeProperty withRequired(final boolean value) {
        return value == required ? this : toBuilder().required(value).build();
    }

    /**
     * Returns the property id.
     *
     * @return the canonical id
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
     * Returns the Types that may carry this property.
     *
     * @return the domain, in insertion order
     */
    public List<String> getDomainIncludes() {
        return domainIncludes;
    }

    /**
     * Returns the allowed value types.
     *
     * @return the range, in insertion order
     */
    public List<String> getRangeIncludes() {
        return rangeIncludes;
    }

    /**
     * Returns the external properties this one is equivalent to.
     *
     * @return absolute IRIs
     */
    public List<String> getOntologicalAnnotations() {
        return ontologicalAnnotations;
    }

    /**
     * Checks whether the property is mandatory on the Types that own it.
     *
     * @return the required flag
     */
    public boolean isRequired() {
        return required;
    }

    /**
     * Emits the property declaration.
     *
     * @param namespaces the id to IRI mapping
     * @return the triples, in a fixed order
     */
    public List<Triple> toTriples(final Namespaces namespaces) {
        Node self = namespaces.iri(id);
        List<Triple> triples = new ArrayList<>();
        triples.add(Triple.create(self, RDF.type.asNode(), RDF.Property.asNode()));
        if (label != null) {
            triples.add(Triple.create(self, RDFS.label.asNode(),
                NodeFactory.createLiteralString(label)));
        }
        if (comment != null) {
            triples.add(Triple.create(self, RDFS.comment.asNode(),
                NodeFactory.createLiteralString(comment)));
        }
        for (String domain : domainIncludes) {
            triples.add(Triple.create(self, RDFS.domain.asNode(),
                namespaces.iri(domain)));
        }
        for (String range : rangeIncludes) {
            triples.add(Triple.create(self, RDFS.range.asNode(),
                namespaces.iri(range)));
        }
        for (String annotation : ontologicalAnnotations) {
            triples.add(Triple.create(self, OWL2.equivalentProperty.asNode(),
                NodeFactory.createURI(annotation)));
        }
        return triples;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypeProperty other)) {
            return false;
        }
        return required == other.required && id.equals(other.id)
            && Objects.equals(label, other.label)
            && Objects.equals(comment, other.comment)
            && domainIncludes.equals(other.domainIncludes)
            && rangeIncludes.equals(other.rangeIncludes)
            && ontologicalAnnotations.equals(other.ontologicalAnnotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, comment, domainIncludes, rangeIncludes,
            ontologicalAnnotations, required);
    }

    @Override
    public String toString() {
        return "TypeProperty[" + id + " domain=" + domainIncludes
            + " range=" + rangeIncludes + (required ? " required" : "") + "]";
    }

    /**
     * Builder for {@link TypeProperty}.
     */
    public static final class Builder {
        private final String id;
        private String label;
        private String comment;
        private final List<String> domainIncludes = new ArrayList<>();
        private final List<String> rangeIncludes = new ArrayList<>();
        private final List<String> ontologicalAnnotations = new ArrayList<>();
        private boolean required;

        private Builder(final String propertyId) {
            this.id = propertyId;
        }

        /**
         * Sets the human-readable label ({@code rdfs:label}).
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
         * Adds a Type id to the domain; duplicates are ignored.
         *
         * @param typeId the Type id
         * @return this builder
         */
        public Builder domain(final String typeId) {
            String canonical = Namespaces.canonical(typeId);
            if (!domainIncludes.contains(canonical)) {
                domainIncludes.add(canonical);
            }
            return this;
        }

        /**
         * Adds an allowed value type: a literal datatype id, a Type id or an
         * external class IRI; duplicates are ignored.
         *
         * @param typeId the range entry
         * @return this builder
         */
        public Builder range(final String typeId) {
            String canonical = Namespaces.canonical(typeId);
            if (!rangeIncludes.contains(canonical)) {
                rangeIncludes.add(canonical);
            }
            return this;
        }

        /**
         * Adds a literal datatype to the range.
         *
         * @param type the literal type
         * @return this builder
         */
        public Builder range(final LiteralType type) {
            return range(type.getId());
        }

        /**
         * Adds an external property this one is equivalent to.
         *
         * @param iri the external property, absolute or with a well-known
         *     prefix
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
         * Marks the property as mandatory on the Types that own it.
         *
         * @param value the required flag
         * @return this builder
         */
        public Builder required(final boolean value) {
            this.required = value;
            return this;
        }

        /**
         * Builds the property.
         *
         * @return the immutable property
         */
        public TypeProperty build() {
            return new TypeProperty(this);
        }
    }
}
