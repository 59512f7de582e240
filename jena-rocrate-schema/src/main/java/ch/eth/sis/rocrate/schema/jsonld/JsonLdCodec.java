package ch.eth.sis.rocrate.schema.jsonld;

import ch.eth.sis.rocrate.schema.MalformedDocumentException;
import ch.eth.sis.rocrate.schema.SchemaSettings;
import ch.eth.sis.rocrate.schema.graph.SchemaGraph;
import ch.eth.sis.rocrate.schema.tracing.TracingUtil;
import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between built graphs and JSON-LD documents.
 *
 * <p>An exported document has a {@code @context} with the prefixes its
 * compact IRIs use and a {@code @graph} with one node per subject, in the
 * order subjects first appear in the graph:</p>
 * <pre>
 * {
 *   "@context" : { "base" : "http://example.com/", "owl" : "..." },
 *   "@graph" : [ {
 *     "@id" : "base:Person",
 *     "@type" : "owl:Class",
 *     "rdfs:label" : "Person"
 *   } ]
 * }
 * </pre>
 *
 * <p>Strings, integers and booleans are written as JSON values; other
 * literals as value objects with their datatype.</p>
 */
public final class JsonLdCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        JsonLdCodec.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final SchemaSettings settings;

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Creates a codec with default settings.
     */
    public JsonLdCodec() {
        this(SchemaSettings.defaults());
    }

    /**
     * Creates a codec with the settings specified.
     *
     * @param settings the settings
     */
    public JsonLdCodec(final SchemaSettings settings) {
        this.settings = settings;
    }

    /**
     * Serializes a graph as a JSON-LD document.
     *
     * @param graph the graph
     * @return the document
     */
    public ObjectNode toDocument(final SchemaGraph graph) {
        return TracingUtil.inSpan(TracingUtil.SCOPE_CODEC,
            "JsonLdCodec.toDocument", span -> {
                span.setAttribute(TracingUtil.ATTR_TRIPLES, (long) graph.size());
                ObjectNode document = new Exporter(graph).export();
                span.setAttribute(TracingUtil.ATTR_NODES,
                    (long) document.get("@graph").size());
                return document;
            });
    }

    /**
     * Reads the Types, properties, restrictions and entries of a document.
     *
     * @param document the document
     * @return the content
     * @throws MalformedDocumentException if the document is not a graph
     *     of identified nodes
     */
    public SchemaContent fromDocument(final ObjectNode document) {
        return TracingUtil.inSpan(TracingUtil.SCOPE_CODEC,
            "JsonLdCodec.fromDocument", span -> {
                SchemaContent content = new DocumentImporter(
                    settings.getNamespaces()).importDocument(document);
                span.setAttribute(TracingUtil.ATTR_TYPES, (long) content.types().size());
                span.setAttribute(TracingUtil.ATTR_ENTRIES,
                    (long) content.entries().size());
                return content;
            });
    }

    /**
     * Writes a document as JSON text.
     *
     * @param document the document
     * @return the JSON text, indented if the settings ask for it
     */
    public String write(final ObjectNode document) {
        try {
            return settings.isPrettyPrint()
                ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                : mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses JSON text into a document.
     *
     * @param json the JSON text
     * @return the document
     * @throws MalformedDocumentException if the text is not a JSON object
     */
    public ObjectNode read(final String json) {
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("Invalid JSON: "
                + e.getOriginalMessage(), null, e);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedDocumentException("Document is not a JSON object");
        }
        return (ObjectNode) tree;
    }

    /** State of one export. */
    private final class Exporter {
        private final SchemaGraph graph;
        private final Namespaces namespaces;
        private final Map<String, String> detected = new LinkedHashMap<>();
        private final Set<String> usedPrefixes = new HashSet<>();

        Exporter(final SchemaGraph schemaGraph) {
            this.graph = schemaGraph;
            this.namespaces = schemaGraph.getNamespaces();
        }

        ObjectNode export() {
            if (settings.isDetectNamespaces()) {
                detectNamespaces();
            }
            Map<Node, List<Triple>> bySubject = new LinkedHashMap<>();
            for (Triple t : graph.getTriples()) {
                bySubject.computeIfAbsent(t.getSubject(), k -> new ArrayList<>()).add(t);
            }
            ArrayNode nodes = NODES.arrayNode();
            for (Map.Entry<Node, List<Triple>> e : bySubject.entrySet()) {
                nodes.add(encodeNode(e.getKey(), e.getValue()));
            }

            ObjectNode context = NODES.objectNode();
            for (Map.Entry<String, String> p : namespaces.getPrefixes().entrySet()) {
                if (usedPrefixes.contains(p.getKey())) {
                    context.put(p.getKey(), p.getValue());
                }
            }
            for (Map.Entry<String, String> p : detected.entrySet()) {
                if (usedPrefixes.contains(p.getValue())) {
                    context.put(p.getValue(), p.getKey());
                }
            }
            ObjectNode document = NODES.objectNode();
            document.set("@context", context);
            document.set("@graph", nodes);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Exported {} triple(s) as {} node(s) with {} prefix(es)",
                    graph.size(), nodes.size(), context.size());
            }
            return document;
        }

        private ObjectNode encodeNode(final Node subject, final List<Triple> triples) {
            List<Node> types = new ArrayList<>();
            Map<Node, List<Node>> values = new LinkedHashMap<>();
            for (Triple t : triples) {
                if (t.getPredicate().equals(RDF.type.asNode()) && t.getObject().isURI()) {
                    types.add(t.getObject());
                } else {
                    values.computeIfAbsent(t.getPredicate(), k -> new ArrayList<>())
                        .add(t.getObject());
                }
            }
            ObjectNode node = NODES.objectNode();
            node.put("@id", compactNode(subject));
            if (types.size() == 1) {
                node.put("@type", compact(types.get(0).getURI()));
            } else if (types.size() > 1) {
                ArrayNode array = node.putArray("@type");
                types.forEach(type -> array.add(compact(type.getURI())));
            }
            for (Map.Entry<Node, List<Node>> e : values.entrySet()) {
                String key = compact(e.getKey().getURI());
                if (e.getValue().size() == 1) {
                    node.set(key, encodeValue(e.getValue().get(0)));
                } else {
                    ArrayNode array = node.putArray(key);
                    e.getValue().forEach(value -> array.add(encodeValue(value)));
                }
            }
            return node;
        }

        private JsonNode encodeValue(final Node value) {
            if (!value.isLiteral()) {
                return NODES.objectNode().put("@id", compactNode(value));
            }
            String lexical = value.getLiteralLexicalForm();
            String language = value.getLiteralLanguage();
            if (language != null && !language.isEmpty()) {
                return NODES.objectNode().put("@value", lexical).put("@language", language);
            }
            String datatype = value.getLiteralDatatypeURI();
            if (XSDDatatype.XSDstring.getURI().equals(datatype)) {
                return NODES.textNode(lexical);
            }
            if (XSDDatatype.XSDboolean.getURI().equals(datatype)
                    && ("true".equals(lexical) || "false".equals(lexical))) {
                return NODES.booleanNode(Boolean.parseBoolean(lexical));
            }
            if (XSDDatatype.XSDinteger.getURI().equals(datatype)) {
                JsonNode number = integerNode(lexical);
                if (number != null) {
                    return number;
                }
            }
            return NODES.objectNode()
                .put("@value", lexical)
                .put("@type", compact(datatype));
        }

        private JsonNode integerNode(final String lexical) {
            BigInteger parsed;
            try {
                parsed = new BigInteger(lexical);
            } catch (NumberFormatException e) {
                return null;
            }
            if (!parsed.toString().equals(lexical)) {
                return null;
            }
            return parsed.bitLength() < Long.SIZE
                ? NODES.numberNode(parsed.longValue())
                : NODES.numberNode(parsed);
        }

        private String compactNode(final Node node) {
            if (node.isBlank()) {
                return "_:" + node.getBlankNodeLabel();
            }
            return compact(node.getURI());
        }

        private String compact(final String iri) {
            String base = namespaces.getBase();
            if (iri.startsWith(base) && iri.length() > base.length()) {
                usedPrefixes.add(namespaces.getBasePrefix());
                return namespaces.getBasePrefix() + ":" + iri.substring(base.length());
            }
            for (Map.Entry<String, String> p : Namespaces.wellKnownPrefixes().entrySet()) {
                if (iri.startsWith(p.getValue()) && iri.length() > p.getValue().length()) {
                    usedPrefixes.add(p.getKey());
                    return p.getKey() + ":" + iri.substring(p.getValue().length());
                }
            }
            String ns = Namespaces.namespaceOf(iri);
            String prefix = detected.get(ns);
            if (prefix != null && iri.length() > ns.length()) {
                usedPrefixes.add(prefix);
                return prefix + ":" + iri.substring(ns.length());
            }
            return iri;
        }

        private void detectNamespaces() {
            Map<String, Integer> uses = new LinkedHashMap<>();
            for (Triple t : graph.getTriples()) {
                count(uses, t.getSubject());
                count(uses, t.getPredicate());
                count(uses, t.getObject());
            }
            Set<String> taken = new HashSet<>(namespaces.getPrefixes().keySet());
            for (Map.Entry<String, Integer> e : uses.entrySet()) {
                if (e.getValue() < settings.getMinNamespaceUses()) {
                    continue;
                }
                String label = hostLabel(e.getKey());
                if (label == null) {
                    continue;
                }
                String prefix = label;
                for (int i = 1; taken.contains(prefix); i++) {
                    prefix = label + i;
                }
                taken.add(prefix);
                detected.put(e.getKey(), prefix);
            }
            if (!detected.isEmpty() && LOGGER.isDebugEnabled()) {
                LOGGER.debug("Detected namespaces {}", detected);
            }
        }

        private void count(final Map<String, Integer> uses, final Node node) {
            String iri;
            if (node.isURI()) {
                iri = node.getURI();
            } else if (node.isLiteral()) {
                iri = node.getLiteralDatatypeURI();
            } else {
                return;
            }
            if (iri == null || iri.startsWith(namespaces.getBase())
                    || !Namespaces.canonical(iri).equals(iri)) {
                return;
            }
            String ns = Namespaces.namespaceOf(iri);
            if (!ns.isEmpty() && iri.length() > ns.length()) {
                uses.merge(ns, 1, Integer::sum);
            }
        }
    }

    /**
     * Derives a prefix from a namespace: the first label of its host name,
     * if the host name has a dot.
     *
     * @param namespace the namespace IRI
     * @return the prefix, or null if none can be derived
     */
    static String hostLabel(final String namespace) {
        int scheme = namespace.indexOf("://");
        if (scheme < 0) {
            return null;
        }
        int start = scheme + 3;
        int end = start;
        while (end < namespace.length() && namespace.charAt(end) != '/'
                && namespace.charAt(end) != ':' && namespace.charAt(end) != '#') {
            end++;
        }
        String host = namespace.substring(start, end).toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int dot = host.indexOf('.');
        if (dot <= 0) {
            return null;
        }
        String label = host.substring(0, dot).replaceAll("[^a-z0-9]", "");
        if (label.isEmpty() || !Character.isLetter(label.charAt(0))) {
            return null;
        }
        return label;
    }
}
