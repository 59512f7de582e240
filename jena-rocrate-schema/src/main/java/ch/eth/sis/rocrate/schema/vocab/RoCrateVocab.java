package ch.eth.sis.rocrate.schema.vocab;

import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.ResourceFactory;
import org.apache.jena.sys.JenaSystem;

/**
 * Vocabulary terms used by RO-Crate schema graphs that are not covered by
 * Jena's own {@code RDF}, {@code RDFS}, {@code OWL2} and {@code XSD}
 * vocabulary classes.
 *
 * <p>RO-Crate metadata relies on schema.org for domain and range hints:</p>
 * <pre>
 * base:name a rdf:Property ;
 *     schema:domainIncludes base:Person ;
 *     schema:rangeIncludes xsd:string .
 * </pre>
 */
public final class RoCrateVocab {

    static {
        JenaSystem.init();
    }

    /** The schema.org namespace URI. */
    public static final String SCHEMA_NS = "https://schema.org/";

    /** Default namespace for local ids (types, properties, entries). */
    public static final String DEFAULT_BASE = "http://example.com/";

    /** Default prefix bound to the base namespace. */
    public static final String DEFAULT_BASE_PREFIX = "base";

    /** Class id given to imported nodes whose type cannot be resolved. */
    public static final String UNKNOWN_CLASS = "unknown";

    /** Default parent class of Types built from templates. */
    public static final String THING = "schema:Thing";

    /**
     * Returns the schema.org namespace URI.
     *
     * @return the namespace URI
     */
    public static String getURI() {
        return SCHEMA_NS;
    }

    private static Resource resource(final String localName) {
        return ResourceFactory.createResource(SCHEMA_NS + localName);
    }

    private static Property property(final String localName) {
        return ResourceFactory.createProperty(SCHEMA_NS, localName);
    }

    /** {@code schema:Thing}, the root class. */
    public static final Resource Thing = resource("Thing");

    /** {@code schema:domainIncludes}, accepted on import as rdfs:domain. */
    public static final Property domainIncludes = property("domainIncludes");

    /** {@code schema:rangeIncludes}, accepted on import as rdfs:range. */
    public static final Property rangeIncludes = property("rangeIncludes");

    private RoCrateVocab() {
        throw new AssertionError("No instances");
    }
}
