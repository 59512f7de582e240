package ch.eth.sis.rocrate.schema.graph;

import ch.eth.sis.rocrate.schema.NotFoundException;
import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.tracing.TracingUtil;
import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.jena.graph.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges schema triples and instance triples into one graph.
 *
 * <p>Triples are emitted in sections: the class triples of every Type, then
 * properties (owned by Types in Type order, then standalone), then
 * restrictions (same order), then entries in the order given. Each element
 * emits its triples in declaration order and a triple seen before is not
 * emitted again, so identical inputs produce identical output.</p>
 */
public final class GraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        GraphBuilder.class);

    private final Namespaces namespaces;

    /**
     * Creates a builder minting IRIs with the namespaces specified.
     *
     * @param namespaces the namespaces
     */
    public GraphBuilder(final Namespaces namespaces) {
        this.namespaces = namespaces;
    }

    /**
     * Creates a builder with the default namespaces.
     */
    public GraphBuilder() {
        this(Namespaces.defaults());
    }

    /**
     * Returns the namespaces IRIs are minted with.
     *
     * @return the namespaces
     */
    public Namespaces getNamespaces() {
        return namespaces;
    }

    /**
     * Builds the graph.
     *
     * @param types the Types, in registration order
     * @param properties standalone properties
     * @param restrictions standalone restrictions
     * @param entries the entries, in creation order
     * @return the graph
     * @throws NotFoundException if an entry's class id names no Type
     */
    public SchemaGraph buildGraph(final List<Type> types,
            final List<TypeProperty> properties,
            final List<Restriction> restrictions,
            final List<MetadataEntry> entries) {
        return TracingUtil.inSpan(TracingUtil.SCOPE_GRAPH_BUILDER,
            "GraphBuilder.buildGraph", span -> {
                span.setAttribute(TracingUtil.ATTR_TYPES, (long) types.size());
                span.setAttribute(TracingUtil.ATTR_ENTRIES, (long) entries.size());
                SchemaGraph graph = build(types, properties, restrictions, entries);
                span.setAttribute(TracingUtil.ATTR_TRIPLES, (long) graph.size());
                return graph;
            });
    }

    private SchemaGraph build(final List<Type> types,
            final List<TypeProperty> properties,
            final List<Restriction> restrictions,
            final List<MetadataEntry> entries) {
        Set<String> typeIds = new HashSet<>();
        for (Type type : types) {
            typeIds.add(type.getId());
        }
        Set<String> entryIds = new HashSet<>();
        for (MetadataEntry entry : entries) {
            entryIds.add(entry.getId());
        }

        Set<Triple> triples = new LinkedHashSet<>();
        for (Type type : types) {
            triples.addAll(type.classTriples(namespaces));
        }
        for (Type type : types) {
            for (TypeProperty property : type.getProperties()) {
                triples.addAll(property.toTriples(namespaces));
            }
        }
        for (TypeProperty property : properties) {
            triples.addAll(property.toTriples(namespaces));
        }
        for (Type type : types) {
            for (Restriction restriction : type.getRestrictions()) {
                triples.addAll(restriction.toTriples(namespaces));
            }
        }
        for (Restriction restriction : restrictions) {
            triples.addAll(restriction.toTriples(namespaces));
        }

        List<UnresolvedReference> unresolved = new ArrayList<>();
        for (MetadataEntry entry : entries) {
            if (!entry.isOpaque() && !typeIds.contains(entry.getClassId())) {
                throw new NotFoundException(NotFoundException.Kind.TYPE,
                    entry.getClassId(), "class of entry " + entry.getId());
            }
            for (Map.Entry<String, List<String>> ref : entry.getReferences().entrySet()) {
                for (String target : ref.getValue()) {
                    if (!Namespaces.isQualified(target) && !Namespaces.isBlank(target)
                            && !entryIds.contains(target) && !typeIds.contains(target)) {
                        unresolved.add(new UnresolvedReference(entry.getId(),
                            ref.getKey(), target));
                        if (LOGGER.isWarnEnabled()) {
                            LOGGER.warn("Entry {} references unknown id {} via {}",
                                entry.getId(), target, ref.getKey());
                        }
                    }
                }
            }
            triples.addAll(entry.toTriples(namespaces));
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built {} triple(s) from {} type(s), {} standalone "
                + "properties, {} standalone restrictions and {} entries",
                triples.size(), types.size(), properties.size(),
                restrictions.size(), entries.size());
        }
        return new SchemaGraph(triples, namespaces, unresolved);
    }
}
