package ch.eth.sis.rocrate.schema.model;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import ch.eth.sis.rocrate.schema.vocab.RoCrateVocab;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.RDF;

/**
 * One instance node of the metadata graph: an id, the Type it belongs to,
 * its literal properties and its references to other nodes.
 *
 * <p>Literal properties hold either a single value or an unmodifiable list
 * of values. References are always lists of ids, a single reference being a
 * one-element list. Both maps keep insertion order, which is the order
 * triples are emitted in.</p>
 *
 * <p>An entry whose Type could not be resolved on import has the class id
 * {@value RoCrateVocab#UNKNOWN_CLASS} and keeps the declared type IRI so
 * that re-export reproduces the original node.</p>
 */
public final class MetadataEntry {

    private final String id;

    private final String classId;

    private final String declaredType;

    private final Map<String, Object> properties;

    private final Map<String, List<String>> references;

    private MetadataEntry(final Builder builder) {
        this.id = Restriction.requireId(builder.id, "id");
        this.classId = Restriction.requireId(builder.classId, "classId");
        this.declaredType = builder.declaredType;
        this.properties = Collections.unmodifiableMap(
            new LinkedHashMap<>(builder.properties));
        Map<String, List<String>> refs = new LinkedHashMap<>();
        builder.references.forEach((k, v) -> refs.put(k, List.copyOf(v)));
        this.references = Collections.unmodifiableMap(refs);
    }

    /**
     * Starts building an entry.
     *
     * @param id the entry id
     * @param classId the id of the entry's Type
     * @return a new builder
     */
    public static Builder builder(final String id, final String classId) {
        return new Builder(id, classId);
    }

    /**
     * Returns a builder initialized with this entry's state.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder(id, classId).declaredType(declaredType);
        b.properties.putAll(properties);
        references.forEach((k, v) -> b.references.put(k, new ArrayList<>(v)));
        return b;
    }

    /**
     * Returns the entry id.
     *
     * @return the id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the id of the entry's Type.
     *
     * @return the Type id, {@value RoCrateVocab#UNKNOWN_CLASS} for opaque entries
     */
    public String getClassId() {
        return classId;
    }

    /**
     * Returns the type the source document declared for an entry whose Type
     * is unknown.
     *
     * @return the declared type id, or null
     */
    public String getDeclaredType() {
        return declaredType;
    }

    /**
     * Returns the literal properties.
     *
     * @return property name to a value or a list of values
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Returns the references to other nodes.
     *
     * @return property name to the referenced ids
     */
    public Map<String, List<String>> getReferences() {
        return references;
    }

    /**
     * Checks whether the entry's Type is unknown.
     *
     * @return true for opaque entries
     */
    public boolean isOpaque() {
        return RoCrateVocab.UNKNOWN_CLASS.equals(classId);
    }

    /**
     * Returns every value of a literal property as a list.
     *
     * @param name the property name
     * @return the values, empty if the property is absent
     */
    public List<Object> getValues(final String name) {
        Object value = properties.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<Object>(list));
        }
        return List.of(value);
    }

    /**
     * Counts literal values and references recorded under a name.
     *
     * @param name the property name
     * @return the number of values
     */
    public int valueCount(final String name) {
        return getValues(name).size()
            + references.getOrDefault(name, List.of()).size();
    }

    /**
     * Returns a copy whose references are rewritten through a mapping; ids
     * not in the mapping are kept.
     *
     * @param mapping old id to new id
     * @return this entry if nothing changed, a copy otherwise
     */
    public MetadataEntry rewriteReferences(final Map<String, String> mapping) {
        boolean changed = false;
        Builder b = new Builder(id, classId).declaredType(declaredType);
        b.properties.putAll(properties);
        for (Map.Entry<String, List<String>> e : references.entrySet()) {
            List<String> targets = new ArrayList<>(e.getValue().size());
            for (String target : e.getValue()) {
                String replacement = mapping.getOrDefault(target, target);
                changed |= !replacement.equals(target);
                targets.add(replacement);
            }
            b.references.put(e.getKey(), targets);
        }
        return changed ? b.build() : this;
    }

    /**
     * Emits the entry's triples: its type, then one triple per literal
     * value, then one triple per reference.
     *
     * @param namespaces the id to IRI mapping
     * @return the triples, in a fixed order
     */
    public List<Triple> toTriples(final Namespaces namespaces) {
        Node self = namespaces.iri(id);
        List<Triple> triples = new ArrayList<>();
        if (!isOpaque()) {
            triples.add(Triple.create(self, RDF.type.asNode(),
                namespaces.iri(classId)));
        } else if (declaredType != null) {
            triples.add(Triple.create(self, RDF.type.asNode(),
                namespaces.iri(declaredType)));
        }
        for (String name : properties.keySet()) {
            Node predicate = namespaces.iri(name);
            for (Object value : getValues(name)) {
                triples.add(Triple.create(self, predicate, LiteralValues.toNode(value)));
            }
        }
        for (Map.Entry<String, List<String>> e : references.entrySet()) {
            Node predicate = namespaces.iri(e.getKey());
            for (String target : e.getValue()) {
                triples.add(Triple.create(self, predicate, namespaces.iri(target)));
            }
        }
        return triples;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetadataEntry other)) {
            return false;
        }
        return id.equals(other.id) && classId.equals(other.classId)
            && Objects.equals(declaredType, other.declaredType)
            && properties.equals(other.properties)
            && references.equals(other.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, classId, declaredType, properties, references);
    }

    @Override
    public String toString() {
        return "MetadataEntry[" + id + " a " + classId + " properties="
            + properties + " references=" + references + "]";
    }

    /**
     * Builder for {@link MetadataEntry}.
     */
    public static final class Builder {
        private final String id;
        private final String classId;
        private String declaredType;
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private final Map<String, List<String>> references = new LinkedHashMap<>();

        private Builder(final String entryId, final String entryClassId) {
            this.id = entryId;
            this.classId = entryClassId;
        }

        /**
         * Records the type declared by the source document for an opaque
         * entry.
         *
         * @param value the declared type id, may be null
         * @return this builder
         */
        public Builder declaredType(final String value) {
            this.declaredType = value;
            return this;
        }

        /**
         * Sets a literal property. A collection stores every element, a
         * one-element collection is stored as a single value and an empty
         * collection or null value is ignored.
         *
         * @param name the property name
         * @param value a literal value or a collection of literal values
         * @return this builder
         * @throws IllegalArgumentException if a value is not of a literal
         *     kind
         */
        public Builder property(final String name, final Object value) {
            Objects.requireNonNull(name, "name");
            if (value == null) {
                return this;
            }
            if (value instanceof Collection<?> values) {
                List<Object> normalized = new ArrayList<>(values.size());
                for (Object item : values) {
                    normalized.add(literal(name, item));
                }
                if (normalized.size() == 1) {
                    properties.put(name, normalized.get(0));
                } else if (!normalized.isEmpty()) {
                    properties.put(name, Collections.unmodifiableList(normalized));
                }
                return this;
            }
            properties.put(name, literal(name, value));
            return this;
        }

        private static Object literal(final String name, final Object value) {
            if (!LiteralValues.isLiteral(value)) {
                throw new IllegalArgumentException("Value of " + name
                    + " is not a literal: " + value);
            }
            return LiteralValues.normalize(value);
        }

        /**
         * Appends a reference to another node.
         *
         * @param name the property name
         * @param targetId the referenced id
         * @return this builder
         */
        public Builder reference(final String name, final String targetId) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(targetId, "targetId");
            references.computeIfAbsent(name, k -> new ArrayList<>()).add(targetId);
            return this;
        }

        /**
         * Appends references to other nodes; an empty collection is
         * ignored.
         *
         * @param name the property name
         * @param targetIds the referenced ids, in order
         * @return this builder
         */
        public Builder references(final String name,
                final Collection<String> targetIds) {
            for (String targetId : targetIds) {
                reference(name, targetId);
            }
            return this;
        }

        /**
         * Builds the entry.
         *
         * @return the immutable entry
         */
        public MetadataEntry build() {
            return new MetadataEntry(this);
        }
    }
}
