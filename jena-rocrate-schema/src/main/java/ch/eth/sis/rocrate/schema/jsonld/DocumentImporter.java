package ch.eth.sis.rocrate.schema.jsonld;

import ch.eth.sis.rocrate.schema.MalformedDocumentException;
import ch.eth.sis.rocrate.schema.model.LiteralValues;
import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import ch.eth.sis.rocrate.schema.vocab.RoCrateVocab;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.jena.vocabulary.OWL2;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a JSON-LD document back into Types, properties, restrictions and
 * entries.
 *
 * <p>Phase one classifies every node by its {@code @type}. Phase two links
 * restrictions to the Types that list them as {@code rdfs:subClassOf} and
 * properties to the Types in their domain. Properties and restrictions no
 * Type claims are returned as standalone elements.</p>
 */
final class DocumentImporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        DocumentImporter.class);

    /** Ids of the crate-level nodes that describe the package itself. */
    private static final Set<String> SKIPPED_IDS = Set.of(
        "./", "ro-crate-metadata.json");

    private static final String RDFS_PROPERTY =
        Namespaces.expandWellKnown("rdfs:Property");

    private final Namespaces defaults;

    private Namespaces namespaces;

    private JsonLdContext context;

    DocumentImporter(final Namespaces namespaces) {
        this.defaults = namespaces;
    }

    SchemaContent importDocument(final ObjectNode document) {
        JsonNode rawContext = document.get("@context");
        context = JsonLdContext.parse(rawContext, defaults.getBase());
        namespaces = defaults;
        String declaredBase = context.prefix(defaults.getBasePrefix());
        if (declaredBase != null && !declaredBase.equals(defaults.getBase())) {
            namespaces = new Namespaces(declaredBase, defaults.getBasePrefix());
            context = JsonLdContext.parse(rawContext, declaredBase);
        }

        List<ObjectNode> typeNodes = new ArrayList<>();
        List<ObjectNode> propertyNodes = new ArrayList<>();
        List<ObjectNode> restrictionNodes = new ArrayList<>();
        List<ObjectNode> entryNodes = new ArrayList<>();
        List<ObjectNode> nodes = graphNodes(document);
        for (ObjectNode node : nodes) {
            JsonNode id = node.get("@id");
            if (id == null || !id.isTextual() || id.asText().isEmpty()) {
                throw new MalformedDocumentException("Node without @id",
                    node.toString());
            }
            if (SKIPPED_IDS.contains(id.asText())) {
                continue;
            }
            List<String> types = typeIris(node);
            if (types.contains(OWL2.Class.getURI()) || types.contains(RDFS.Class.getURI())) {
                typeNodes.add(node);
            } else if (types.contains(RDF.Property.getURI())
                    || types.contains(RDFS_PROPERTY)) {
                propertyNodes.add(node);
            } else if (types.contains(OWL2.Restriction.getURI())) {
                restrictionNodes.add(node);
            } else {
                entryNodes.add(node);
            }
        }

        Map<String, Restriction> restrictions = new LinkedHashMap<>();
        for (ObjectNode node : restrictionNodes) {
            Restriction restriction = readRestriction(node);
            restrictions.put(restriction.getId(), restriction);
        }
        Map<String, TypeProperty> properties = new LinkedHashMap<>();
        for (ObjectNode node : propertyNodes) {
            TypeProperty property = readProperty(node);
            properties.put(property.getId(), property);
        }
        Set<String> typeIds = new HashSet<>();
        for (ObjectNode node : typeNodes) {
            typeIds.add(id(node));
        }

        Set<String> ownedRestrictions = new HashSet<>();
        Set<String> ownedProperties = new HashSet<>();
        List<Type> types = new ArrayList<>();
        for (ObjectNode node : typeNodes) {
            types.add(readType(node, typeIds, restrictions, properties,
                ownedRestrictions, ownedProperties));
        }

        List<TypeProperty> standaloneProperties = new ArrayList<>();
        for (TypeProperty property : properties.values()) {
            if (!ownedProperties.contains(property.getId())) {
                standaloneProperties.add(property);
            }
        }
        List<Restriction> standaloneRestrictions = new ArrayList<>();
        for (Restriction restriction : restrictions.values()) {
            if (!ownedRestrictions.contains(restriction.getId())) {
                standaloneRestrictions.add(restriction);
            }
        }
        List<MetadataEntry> entries = new ArrayList<>();
        for (ObjectNode node : entryNodes) {
            entries.add(readEntry(node, typeIds));
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Imported {} node(s): {} type(s), {} standalone "
                + "properties, {} standalone restrictions, {} entries",
                nodes.size(), types.size(), standaloneProperties.size(),
                standaloneRestrictions.size(), entries.size());
        }
        return new SchemaContent(types, standaloneProperties,
            standaloneRestrictions, entries, namespaces);
    }

    private static List<ObjectNode> graphNodes(final ObjectNode document) {
        JsonNode graph = document.get("@graph");
        List<ObjectNode> nodes = new ArrayList<>();
        if (graph == null) {
            if (!document.has("@id")) {
                throw new MalformedDocumentException("Document has no @graph");
            }
            ObjectNode single = document.deepCopy();
            single.remove("@context");
            nodes.add(single);
            return nodes;
        }
        if (!graph.isArray()) {
            throw new MalformedDocumentException("@graph is not an array",
                graph.toString());
        }
        for (JsonNode element : graph) {
            if (!element.isObject()) {
                throw new MalformedDocumentException("@graph element is not an object",
                    element.toString());
            }
            nodes.add((ObjectNode) element);
        }
        return nodes;
    }

    private String id(final ObjectNode node) {
        return namespaces.shorten(context.expandId(node.get("@id").asText()));
    }

    private List<String> typeIris(final ObjectNode node) {
        List<String> iris = new ArrayList<>();
        for (JsonNode type : values(node.get("@type"))) {
            if (type.isTextual()) {
                iris.add(context.expandVocab(type.asText()));
            }
        }
        return iris;
    }

    /** Node fields other than keywords, keyed by expanded IRI. */
    private Map<String, List<JsonNode>> fields(final ObjectNode node) {
        Map<String, List<JsonNode>> fields = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey().startsWith("@")) {
                continue;
            }
            fields.computeIfAbsent(context.expandVocab(e.getKey()), k -> new ArrayList<>())
                .addAll(values(e.getValue()));
        }
        return fields;
    }

    private static List<JsonNode> values(final JsonNode value) {
        List<JsonNode> values = new ArrayList<>();
        if (value == null || value.isNull()) {
            return values;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                values.addAll(values(element));
            }
        } else if (value.isObject() && (value.has("@list") || value.has("@set"))) {
            values.addAll(values(value.has("@list") ? value.get("@list") : value.get("@set")));
        } else {
            values.add(value);
        }
        return values;
    }

    private static String text(final List<JsonNode> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        JsonNode first = values.get(0);
        if (first.isObject() && first.has("@value")) {
            return first.get("@value").asText();
        }
        return first.asText();
    }

    private List<String> ids(final List<JsonNode> values) {
        List<String> ids = new ArrayList<>();
        if (values == null) {
            return ids;
        }
        for (JsonNode value : values) {
            if (value.isObject() && value.has("@id")) {
                ids.add(namespaces.shorten(context.expandId(value.get("@id").asText())));
            } else if (value.isTextual()) {
                ids.add(namespaces.shorten(context.expandVocab(value.asText())));
            }
        }
        return ids;
    }

    private List<String> iris(final List<JsonNode> values) {
        List<String> iris = new ArrayList<>();
        for (String id : ids(values)) {
            iris.add(namespaces.expand(id));
        }
        return iris;
    }

    private static Integer cardinality(final List<JsonNode> values, final ObjectNode node) {
        String text = text(values);
        if (text == null) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            throw new MalformedDocumentException("Invalid cardinality " + text,
                node.toString(), e);
        }
    }

    private void warnUnknown(final ObjectNode node, final Map<String, List<JsonNode>> fields,
            final Set<String> known) {
        for (String key : fields.keySet()) {
            if (!known.contains(key) && LOGGER.isWarnEnabled()) {
                LOGGER.warn("Dropping {} on schema node {}", key, node.get("@id").asText());
            }
        }
    }

    private Restriction readRestriction(final ObjectNode node) {
        Map<String, List<JsonNode>> fields = fields(node);
        List<String> onProperty = ids(fields.get(OWL2.onProperty.getURI()));
        if (onProperty.isEmpty()) {
            throw new MalformedDocumentException("Restriction without owl:onProperty",
                node.toString());
        }
        warnUnknown(node, fields, Set.of(OWL2.onProperty.getURI(),
            OWL2.minCardinality.getURI(), OWL2.maxCardinality.getURI()));
        try {
            return new Restriction(id(node), onProperty.get(0),
                cardinality(fields.get(OWL2.minCardinality.getURI()), node),
                cardinality(fields.get(OWL2.maxCardinality.getURI()), node));
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException(e.getMessage(), node.toString(), e);
        }
    }

    private TypeProperty readProperty(final ObjectNode node) {
        Map<String, List<JsonNode>> fields = fields(node);
        TypeProperty.Builder property = TypeProperty.builder(id(node))
            .label(text(fields.get(RDFS.label.getURI())))
            .comment(text(fields.get(RDFS.comment.getURI())));
        List<JsonNode> domains = new ArrayList<>();
        domains.addAll(fields.getOrDefault(RDFS.domain.getURI(), List.of()));
        domains.addAll(fields.getOrDefault(RoCrateVocab.domainIncludes.getURI(), List.of()));
        ids(domains).forEach(property::domain);
        List<JsonNode> ranges = new ArrayList<>();
        ranges.addAll(fields.getOrDefault(RDFS.range.getURI(), List.of()));
        ranges.addAll(fields.getOrDefault(RoCrateVocab.rangeIncludes.getURI(), List.of()));
        ids(ranges).forEach(property::range);
        iris(fields.get(OWL2.equivalentProperty.getURI()))
            .forEach(property::ontologicalAnnotation);
        warnUnknown(node, fields, Set.of(RDFS.label.getURI(), RDFS.comment.getURI(),
            RDFS.domain.getURI(), RDFS.range.getURI(), OWL2.equivalentProperty.getURI(),
            RoCrateVocab.domainIncludes.getURI(), RoCrateVocab.rangeIncludes.getURI()));
        return property.build();
    }

    private Type readType(final ObjectNode node, final Set<String> typeIds,
            final Map<String, Restriction> restrictions,
            final Map<String, TypeProperty> properties, final Set<String> ownedRestrictions,
            final Set<String> ownedProperties) {
        Map<String, List<JsonNode>> fields = fields(node);
        String typeId = id(node);
        // a shared property's merged domain is split back over its owners
        Set<String> otherTypes = new HashSet<>(typeIds);
        otherTypes.remove(typeId);
        Type.Builder type = Type.builder(typeId)
            .label(text(fields.get(RDFS.label.getURI())))
            .comment(text(fields.get(RDFS.comment.getURI())));
        iris(fields.get(OWL2.equivalentClass.getURI())).forEach(type::ontologicalAnnotation);

        List<Restriction> owned = new ArrayList<>();
        for (String parent : ids(fields.get(RDFS.subClassOf.getURI()))) {
            Restriction restriction = restrictions.get(parent);
            if (restriction != null) {
                owned.add(restriction);
            } else {
                type.subClassOf(parent);
            }
        }
        Set<String> linked = new HashSet<>();
        for (TypeProperty property : properties.values()) {
            if (property.getDomainIncludes().contains(typeId)) {
                type.property(property.withoutDomains(otherTypes));
                linked.add(property.getId());
                ownedProperties.add(property.getId());
            }
        }
        for (Restriction restriction : owned) {
            if (!linked.contains(restriction.getPropertyId())) {
                TypeProperty property = properties.get(restriction.getPropertyId());
                if (property == null) {
                    throw new MalformedDocumentException("Restriction "
                        + restriction.getId() + " on undeclared property "
                        + restriction.getPropertyId(), node.toString());
                }
                type.property(property.withoutDomains(otherTypes));
                linked.add(property.getId());
                ownedProperties.add(property.getId());
            }
            type.restriction(restriction);
            ownedRestrictions.add(restriction.getId());
        }
        warnUnknown(node, fields, Set.of(RDFS.label.getURI(), RDFS.comment.getURI(),
            OWL2.equivalentClass.getURI(), RDFS.subClassOf.getURI()));
        try {
            return type.build();
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException(e.getMessage(), node.toString(), e);
        }
    }

    private MetadataEntry readEntry(final ObjectNode node, final Set<String> typeIds) {
        List<String> declared = new ArrayList<>();
        for (String iri : typeIris(node)) {
            declared.add(namespaces.shorten(iri));
        }
        String classId = null;
        for (String type : declared) {
            if (typeIds.contains(type)) {
                classId = type;
                break;
            }
        }
        MetadataEntry.Builder entry;
        if (classId != null) {
            entry = MetadataEntry.builder(id(node), classId);
        } else {
            entry = MetadataEntry.builder(id(node), RoCrateVocab.UNKNOWN_CLASS)
                .declaredType(declared.isEmpty() ? null : declared.get(0));
            classId = declared.isEmpty() ? null : declared.get(0);
        }
        if (declared.size() > 1 && LOGGER.isWarnEnabled()) {
            LOGGER.warn("Entry {} declares types {}; keeping {}",
                node.get("@id").asText(), declared, classId);
        }

        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey().startsWith("@")) {
                continue;
            }
            String name = namespaces.shorten(context.expandVocab(e.getKey()));
            boolean referenceTerm = context.isReferenceTerm(e.getKey());
            List<Object> literals = new ArrayList<>();
            for (JsonNode value : values(e.getValue())) {
                if (value.isObject() && value.has("@id")) {
                    entry.reference(name, namespaces.shorten(
                        context.expandId(value.get("@id").asText())));
                } else if (value.isTextual() && referenceTerm) {
                    entry.reference(name, namespaces.shorten(context.expandId(value.asText())));
                } else {
                    literals.add(literal(value, node));
                }
            }
            entry.property(name, literals);
        }
        return entry.build();
    }

    private Object literal(final JsonNode value, final ObjectNode node) {
        if (value.isObject()) {
            JsonNode raw = value.get("@value");
            if (raw == null) {
                throw new MalformedDocumentException("Embedded node without @id",
                    node.toString());
            }
            JsonNode type = value.get("@type");
            if (type != null && type.isTextual()) {
                return LiteralValues.fromLexical(raw.asText(),
                    context.expandVocab(type.asText()));
            }
            return literal(raw, node);
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.asText();
    }
}
