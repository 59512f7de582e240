package ch.eth.sis.rocrate.schema.vocab;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.sys.JenaSystem;
import org.apache.jena.vocabulary.OWL2;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;
import org.apache.jena.vocabulary.XSD;

/**
 * Maps between the short ids used in the object model and the IRIs used in
 * the graph.
 *
 * <ul>
 *   <li>a local id {@code Person} is minted as {@code <base>Person};</li>
 *   <li>a compact id with a well-known prefix ({@code xsd:string},
 *       {@code schema:Thing}) is expanded;</li>
 *   <li>an absolute IRI is used unchanged;</li>
 *   <li>a blank node id {@code _:b1} stays a blank node.</li>
 * </ul>
 *
 * <p>{@link #shorten(String)} is the inverse used on import.</p>
 */
public final class Namespaces {

    /** Well-known prefixes, in the order they appear in a context. */
    private static final Map<String, String> WELL_KNOWN;

    static {
        JenaSystem.init();
        Map<String, String> known = new LinkedHashMap<>();
        known.put("schema", RoCrateVocab.SCHEMA_NS);
        known.put("rdf", RDF.getURI());
        known.put("rdfs", RDFS.getURI());
        known.put("owl", OWL2.getURI());
        known.put("xsd", XSD.getURI());
        WELL_KNOWN = Collections.unmodifiableMap(known);
    }

    /** Prefix of blank node ids. */
    public static final String BLANK_PREFIX = "_:";

    /** Namespace IRI local ids are minted in. */
    private final String base;

    /** Prefix bound to {@link #base}. */
    private final String basePrefix;

    /**
     * Creates a namespace mapping for the base IRI and prefix specified.
     *
     * @param baseIri namespace for local ids, ending in '/' or '#'
     * @param prefix the prefix bound to the base namespace
     */
    public Namespaces(final String baseIri, final String prefix) {
        Objects.requireNonNull(baseIri, "baseIri");
        Objects.requireNonNull(prefix, "prefix");
        if (!baseIri.endsWith("/") && !baseIri.endsWith("#")) {
            throw new IllegalArgumentException(
                "Base namespace must end with '/' or '#': " + baseIri);
        }
        if (WELL_KNOWN.containsKey(prefix)) {
            throw new IllegalArgumentException(
                "Base prefix clashes with a well-known prefix: " + prefix);
        }
        this.base = baseIri;
        this.basePrefix = prefix;
    }

    /**
     * Returns the mapping for the default base namespace.
     *
     * @return default namespaces
     */
    public static Namespaces defaults() {
        return new Namespaces(RoCrateVocab.DEFAULT_BASE,
            RoCrateVocab.DEFAULT_BASE_PREFIX);
    }

    /**
     * Returns the base namespace IRI.
     *
     * @return the base IRI
     */
    public String getBase() {
        return base;
    }

    /**
     * Returns the prefix bound to the base namespace.
     *
     * @return the base prefix
     */
    public String getBasePrefix() {
        return basePrefix;
    }

    /**
     * Returns all prefixes this mapping knows, base prefix first.
     *
     * @return ordered prefix to namespace map
     */
    public Map<String, String> getPrefixes() {
        Map<String, String> all = new LinkedHashMap<>();
        all.put(basePrefix, base);
        all.putAll(WELL_KNOWN);
        return all;
    }

    /**
     * Returns the well-known prefixes (schema, rdf, rdfs, owl, xsd).
     *
     * @return ordered prefix to namespace map
     */
    public static Map<String, String> wellKnownPrefixes() {
        return WELL_KNOWN;
    }

    /**
     * Checks whether a value is an absolute IRI: a scheme followed by
     * {@code //}, or one of the opaque schemes {@code urn:}, {@code mailto:}
     * and {@code tag:}.
     *
     * @param value the value to check
     * @return true for absolute IRIs
     */
    public static boolean isAbsolute(final String value) {
        int colon = value.indexOf(':');
        if (colon <= 0) {
            return false;
        }
        if (value.startsWith("urn:") || value.startsWith("mailto:")
                || value.startsWith("tag:")) {
            return true;
        }
        return value.startsWith("//", colon + 1);
    }

    /**
     * Checks whether a value is a blank node id such as {@code _:b1}.
     *
     * @param value the value to check
     * @return true for blank node ids
     */
    public static boolean isBlank(final String value) {
        return value.startsWith(BLANK_PREFIX) && value.length() > BLANK_PREFIX.length();
    }

    /**
     * Checks whether a value names something outside the base namespace:
     * an absolute IRI or a compact id with a well-known prefix.
     *
     * @param value the value to check
     * @return true if the value does not denote a local id
     */
    public static boolean isQualified(final String value) {
        if (isAbsolute(value)) {
            return true;
        }
        int colon = value.indexOf(':');
        return colon > 0 && WELL_KNOWN.containsKey(value.substring(0, colon));
    }

    /**
     * Brings a model-level reference (range, domain, parent class) into its
     * canonical form: {@code base:} is dropped and IRIs in a well-known
     * namespace are compacted.
     *
     * @param ref the reference
     * @return the canonical reference
     */
    public static String canonical(final String ref) {
        Objects.requireNonNull(ref, "ref");
        String prefixed = RoCrateVocab.DEFAULT_BASE_PREFIX + ":";
        if (ref.startsWith(prefixed)) {
            return ref.substring(prefixed.length());
        }
        for (Map.Entry<String, String> e : WELL_KNOWN.entrySet()) {
            if (ref.startsWith(e.getValue()) && ref.length() > e.getValue().length()) {
                return e.getKey() + ":" + ref.substring(e.getValue().length());
            }
        }
        return ref;
    }

    /**
     * Expands a compact id with a well-known prefix; other values are
     * returned unchanged.
     *
     * @param value the value
     * @return the expanded IRI or the value itself
     */
    public static String expandWellKnown(final String value) {
        int colon = value.indexOf(':');
        if (colon > 0 && !isAbsolute(value)) {
            String ns = WELL_KNOWN.get(value.substring(0, colon));
            if (ns != null) {
                return ns + value.substring(colon + 1);
            }
        }
        return value;
    }

    /**
     * Expands an id into a full IRI.
     *
     * @param id a local id, a compact id or an absolute IRI
     * @return the full IRI; blank node ids are returned unchanged
     */
    public String expand(final String id) {
        Objects.requireNonNull(id, "id");
        if (isAbsolute(id) || isBlank(id)) {
            return id;
        }
        int colon = id.indexOf(':');
        if (colon > 0) {
            String prefix = id.substring(0, colon);
            if (prefix.equals(basePrefix)) {
                return base + id.substring(colon + 1);
            }
            String ns = WELL_KNOWN.get(prefix);
            if (ns != null) {
                return ns + id.substring(colon + 1);
            }
        }
        return base + id;
    }

    /**
     * Creates the IRI node for an id.
     *
     * @param id a local id, a compact id, an absolute IRI or a blank node id
     * @return the URI node, or a blank node for {@code _:} ids
     */
    public Node iri(final String id) {
        if (isBlank(id)) {
            return NodeFactory.createBlankNode(id.substring(BLANK_PREFIX.length()));
        }
        return NodeFactory.createURI(expand(id));
    }

    /**
     * Turns an IRI back into the id used in the object model: base IRIs
     * become local ids, IRIs in a well-known namespace become compact ids;
     * blank node ids and everything else stay as they are.
     *
     * @param iri the IRI
     * @return the model id
     */
    public String shorten(final String iri) {
        Objects.requireNonNull(iri, "iri");
        if (isBlank(iri)) {
            return iri;
        }
        if (iri.startsWith(base) && iri.length() > base.length()) {
            return iri.substring(base.length());
        }
        return canonical(iri);
    }

    /**
     * Splits an IRI into its namespace part, up to and including the last
     * '#' or '/'.
     *
     * @param iri the IRI
     * @return the namespace, or the empty string if there is none
     */
    public static String namespaceOf(final String iri) {
        int cut = Math.max(iri.lastIndexOf('#'), iri.lastIndexOf('/'));
        return cut < 0 ? "" : iri.substring(0, cut + 1);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Namespaces other)) {
            return false;
        }
        return base.equals(other.base) && basePrefix.equals(other.basePrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, basePrefix);
    }

    @Override
    public String toString() {
        return "Namespaces[" + basePrefix + "=" + base + "]";
    }
}
