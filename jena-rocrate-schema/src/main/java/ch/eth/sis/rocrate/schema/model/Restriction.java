package ch.eth.sis.rocrate.schema.model;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.OWL2;
import org.apache.jena.vocabulary.RDF;

/**
 * An OWL cardinality restriction on a property. Either bound may be absent;
 * when both are present {@code min <= max}.
 */
public final class Restriction {

    /** Suffix of generated restriction ids. */
    public static final String ID_SUFFIX = "_restriction";

    private final String id;

    private final String propertyId;

    private final Integer minCardinality;

    private final Integer maxCardinality;

    /**
     * Creates a restriction.
     *
     * @param id the restriction id
     * @param propertyId the restricted property id
     * @param minCardinality lower bound, null when unbounded
     * @param maxCardinality upper bound, null when unbounded
     */
    public Restriction(final String id, final String propertyId,
            final Integer minCardinality, final Integer maxCardinality) {
        this.id = requireId(id, "id");
        this.propertyId = Namespaces.canonical(requireId(propertyId, "propertyId"));
        if (minCardinality != null && minCardinality < 0) {
            throw new IllegalArgumentException(
                "minCardinality must not be negative: " + minCardinality);
        }
        if (maxCardinality != null && maxCardinality < 0) {
            throw new IllegalArgumentException(
                "maxCardinality must not be negative: " + maxCardinality);
        }
        if (minCardinality != null && maxCardinality != null
                && minCardinality > maxCardinality) {
            throw new IllegalArgumentException("minCardinality " + minCardinality
                + " exceeds maxCardinality " + maxCardinality + " on " + propertyId);
        }
        this.minCardinality = minCardinality;
        this.maxCardinality = maxCardinality;
    }

    /**
     * Creates a restriction with the default id {@code <property>_restriction}.
     *
     * @param propertyId the restricted property id
     * @param minCardinality lower bound, null when unbounded
     * @param maxCardinality upper bound, null when unbounded
     * @return the restriction
     */
    public static Restriction on(final String propertyId,
            final Integer minCardinality, final Integer maxCardinality) {
        return new Restriction(propertyId + ID_SUFFIX, propertyId,
            minCardinality, maxCardinality);
    }

    /**
     * Creates the restriction a Type owns for one of its properties, with
     * the id {@code <type>_<property>_restriction}.
     *
     * @param typeId the owning Type id
     * @param propertyId the restricted property id
     * @param minCardinality lower bound, null when unbounded
     * @param maxCardinality upper bound, null when unbounded
     * @return the restriction
     */
    public static Restriction owned(final String typeId, final String propertyId,
            final Integer minCardinality, final Integer maxCardinality) {
        return new Restriction(typeId + "_" + propertyId + ID_SUFFIX, propertyId,
            minCardinality, maxCardinality);
    }

    static String requireId(final String value, final String what) {
        Objects.requireNonNull(value, what);
        if (value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return value;
    }

    /**
     * Returns the restriction id.
     *
     * @return the id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the id of the restricted property.
     *
     * @return the property id
     */
    public String getPropertyId() {
        return propertyId;
    }

    /**
     * Returns the lower bound.
     *
     * @return the bound, or null if unbounded
     */
    public Integer getMinCardinality() {
        return minCardinality;
    }

    /**
     * Returns the upper bound.
     *
     * @return the bound, or null if unbounded
     */
    public Integer getMaxCardinality() {
        return maxCardinality;
    }

    /**
     * Checks whether the restriction makes its property mandatory.
     *
     * @return true if the lower bound is at least one
     */
    public boolean isMandatory() {
        return minCardinality != null && minCardinality >= 1;
    }

    /**
     * Checks whether a number of values satisfies both bounds.
     *
     * @param count the number of values
     * @return true if the count is within bounds
     */
    public boolean admits(final int count) {
        return (minCardinality == null || count >= minCardinality)
            && (maxCardinality == null || count <= maxCardinality);
    }

    /**
     * Emits the restriction node: its {@code owl:Restriction} type, the
     * restricted property and whichever bounds are present.
     *
     * @param namespaces the id to IRI mapping
     * @return the triples, in a fixed order
     */
    public List<Triple> toTriples(final Namespaces namespaces) {
        Node self = namespaces.iri(id);
        List<Triple> triples = new ArrayList<>(4);
        triples.add(Triple.create(self, RDF.type.asNode(), OWL2.Restriction.asNode()));
        triples.add(Triple.create(self, OWL2.onProperty.asNode(),
            namespaces.iri(propertyId)));
        if (minCardinality != null) {
            triples.add(Triple.create(self, OWL2.minCardinality.asNode(),
                cardinality(minCardinality)));
        }
        if (maxCardinality != null) {
            triples.add(Triple.create(self, OWL2.maxCardinality.asNode(),
                cardinality(maxCardinality)));
        }
        return triples;
    }

    private static Node cardinality(final int value) {
        return NodeFactory.createLiteralDT(Integer.toString(value),
            XSDDatatype.XSDinteger);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Restriction other)) {
            return false;
        }
        return id.equals(other.id) && propertyId.equals(other.propertyId)
            && Objects.equals(minCardinality, other.minCardinality)
            && Objects.equals(maxCardinality, other.maxCardinality);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, propertyId, minCardinality, maxCardinality);
    }

    @Override
    public String toString() {
        return "Restriction[" + id + " on " + propertyId + " "
            + (minCardinality == null ? "*" : minCardinality) + ".."
            + (maxCardinality == null ? "*" : maxCardinality) + "]";
    }
}
