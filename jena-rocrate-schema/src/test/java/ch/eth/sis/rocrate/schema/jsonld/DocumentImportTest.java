package ch.eth.sis.rocrate.schema.jsonld;

import ch.eth.sis.rocrate.schema.MalformedDocumentException;
import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.model.TypedValue;
import ch.eth.sis.rocrate.schema.vocab.RoCrateVocab;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the import side of {@link JsonLdCodec}.
 */
public class DocumentImportTest {

    private final JsonLdCodec codec = new JsonLdCodec();

    private SchemaContent load(final String json) {
        return codec.fromDocument(codec.read(json));
    }

    private static MetadataEntry entry(final SchemaContent content, final String id) {
        return content.entries().stream()
            .filter(e -> e.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No entry " + id));
    }

    @Test
    @DisplayName("Test importing a schema with types, properties and restrictions")
    public void testSchemaNodes() {
        SchemaContent content = load("""
            {
              "@context": {
                "base": "http://example.com/",
                "owl": "http://www.w3.org/2002/07/owl#",
                "rdf": "http://www.w3.org/1999/02/22-rdf-syntax-ns#",
                "rdfs": "http://www.w3.org/2000/01/rdf-schema#",
                "xsd": "http://www.w3.org/2001/XMLSchema#"
              },
              "@graph": [
                {"@id": "base:Person", "@type": "owl:Class",
                 "rdfs:label": "Person",
                 "rdfs:subClassOf": [{"@id": "schema:Thing"},
                                     {"@id": "base:Person_name_restriction"}]},
                {"@id": "base:name", "@type": "rdf:Property",
                 "rdfs:domain": {"@id": "base:Person"},
                 "rdfs:range": {"@id": "xsd:string"}},
                {"@id": "base:motto", "@type": "rdf:Property",
                 "rdfs:range": {"@id": "xsd:string"}},
                {"@id": "base:Person_name_restriction", "@type": "owl:Restriction",
                 "owl:onProperty": {"@id": "base:name"},
                 "owl:minCardinality": 1, "owl:maxCardinality": 1},
                {"@id": "base:alice", "@type": "base:Person", "base:name": "Alice"}
              ]
            }
            """);

        assertEquals(1, content.types().size());
        Type person = content.types().get(0);
        assertEquals("Person", person.getId());
        assertEquals("Person", person.getLabel());
        assertEquals(List.of("schema:Thing"), person.getSubClassOf());
        assertTrue(person.getProperty("name").orElseThrow().isRequired());
        Restriction restriction = person.getRestrictionFor("name").orElseThrow();
        assertEquals(Integer.valueOf(1), restriction.getMinCardinality());
        assertEquals(Integer.valueOf(1), restriction.getMaxCardinality());

        assertEquals(1, content.properties().size());
        assertEquals("motto", content.properties().get(0).getId());
        assertTrue(content.restrictions().isEmpty());

        MetadataEntry alice = entry(content, "alice");
        assertEquals("Person", alice.getClassId());
        assertEquals(List.of("Alice"), alice.getValues("name"));
    }

    @Test
    @DisplayName("Test nodes of unknown type become opaque entries")
    public void testUnknownType() {
        SchemaContent content = load("""
            {
              "@context": {"base": "http://example.com/"},
              "@graph": [
                {"@id": "base:data", "@type": "schema:Dataset", "schema:name": "Run 7"},
                {"@id": "base:loose", "base:note": "no type"}
              ]
            }
            """);

        MetadataEntry data = entry(content, "data");
        assertEquals(RoCrateVocab.UNKNOWN_CLASS, data.getClassId());
        assertTrue(data.isOpaque());
        assertEquals("schema:Dataset", data.getDeclaredType());
        assertEquals(List.of("Run 7"), data.getValues("schema:name"));

        MetadataEntry loose = entry(content, "loose");
        assertTrue(loose.isOpaque());
        assertNull(loose.getDeclaredType());
    }

    @Test
    @DisplayName("Test literal values keep their datatypes")
    public void testLiterals() {
        SchemaContent content = load("""
            {
              "@context": {"base": "http://example.com/",
                           "xsd": "http://www.w3.org/2001/XMLSchema#"},
              "@graph": [
                {"@id": "base:m1", "@type": "base:Measurement",
                 "base:count": 12,
                 "base:ok": false,
                 "base:weight": {"@value": "2.5", "@type": "xsd:double"},
                 "base:when": {"@value": "2024-03-01", "@type": "xsd:date"},
                 "base:padded": {"@value": "007", "@type": "xsd:integer"},
                 "base:tags": ["x", "y"]}
              ]
            }
            """);

        MetadataEntry m1 = entry(content, "m1");
        assertEquals(List.of(12L), m1.getValues("count"));
        assertEquals(List.of(false), m1.getValues("ok"));
        assertEquals(List.of(2.5d), m1.getValues("weight"));
        assertEquals(List.of(LocalDate.of(2024, 3, 1)), m1.getValues("when"));
        assertEquals(List.of(new TypedValue("007",
            "http://www.w3.org/2001/XMLSchema#integer")), m1.getValues("padded"));
        assertEquals(List.of("x", "y"), m1.getValues("tags"));
    }

    @Test
    @DisplayName("Test term definitions, @vocab and id-typed terms")
    public void testContextTerms() {
        SchemaContent content = load("""
            {
              "@context": [
                "https://w3id.org/ro/crate/1.1/context",
                {
                  "@vocab": "http://example.com/",
                  "ex": "http://example.com/",
                  "friend": {"@id": "ex:knows", "@type": "@id"},
                  "fullName": "ex:name"
                }
              ],
              "@graph": [
                {"@id": "./", "@type": "Dataset"},
                {"@id": "ro-crate-metadata.json", "@type": "CreativeWork"},
                {"@id": "Person", "@type": "http://www.w3.org/2002/07/owl#Class"},
                {"@id": "bob", "@type": "Person", "fullName": "Bob"},
                {"@id": "carol", "@type": "Person", "fullName": "Carol", "friend": "bob"}
              ]
            }
            """);

        assertEquals(2, content.entries().size());
        MetadataEntry carol = entry(content, "carol");
        assertEquals("Person", carol.getClassId());
        assertEquals(List.of("Carol"), carol.getValues("name"));
        assertEquals(List.of("bob"), carol.getReferences().get("knows"));
    }

    @Test
    @DisplayName("Test schema.org domain and range hints")
    public void testDomainIncludes() {
        SchemaContent content = load("""
            {
              "@context": {"base": "http://example.com/"},
              "@graph": [
                {"@id": "base:Book", "@type": "rdfs:Class"},
                {"@id": "base:isbn", "@type": "rdf:Property",
                 "schema:domainIncludes": {"@id": "base:Book"},
                 "schema:rangeIncludes": {"@id": "xsd:string"}}
              ]
            }
            """);

        Type book = content.types().get(0);
        TypeProperty isbn = book.getProperty("isbn").orElseThrow();
        assertEquals(List.of("Book"), isbn.getDomainIncludes());
        assertEquals(List.of("xsd:string"), isbn.getRangeIncludes());
        assertTrue(content.properties().isEmpty());
    }

    @Test
    @DisplayName("Test a context binding the base prefix elsewhere moves the base")
    public void testDeclaredBase() {
        SchemaContent content = load("""
            {
              "@context": {"base": "https://lab.example.org/ns/"},
              "@graph": [
                {"@id": "base:Sample", "@type": "owl:Class"},
                {"@id": "base:s1", "@type": "base:Sample"}
              ]
            }
            """);

        assertEquals("https://lab.example.org/ns/", content.namespaces().getBase());
        assertEquals("Sample", content.types().get(0).getId());
        assertEquals("Sample", entry(content, "s1").getClassId());
    }

    @Test
    @DisplayName("Test a document that is a single node")
    public void testSingleNode() {
        SchemaContent content = load("""
            {"@context": {"base": "http://example.com/"},
             "@id": "base:only", "base:note": "alone"}
            """);

        assertEquals(List.of("alone"), entry(content, "only").getValues("note"));
    }

    @Test
    @DisplayName("Test malformed documents raise MalformedDocumentException")
    public void testMalformed() {
        assertThrows(MalformedDocumentException.class,
            () -> load("{\"@context\": {}}"));
        assertThrows(MalformedDocumentException.class,
            () -> load("{\"@graph\": {\"@id\": \"x\"}}"));
        assertThrows(MalformedDocumentException.class,
            () -> load("{\"@graph\": [{\"@type\": \"owl:Class\"}]}"));
        assertThrows(MalformedDocumentException.class,
            () -> load("{\"@graph\": [{\"@id\": \"r\", \"@type\": \"owl:Restriction\"}]}"));
        assertThrows(MalformedDocumentException.class,
            () -> load("{\"@graph\": [{\"@id\": \"r\", \"@type\": \"owl:Restriction\","
                + " \"owl:onProperty\": {\"@id\": \"p\"}, \"owl:minCardinality\": \"many\"}]}"));
        assertThrows(MalformedDocumentException.class,
            () -> load("{\"@graph\": [{\"@id\": \"x\", \"base:part\": {\"base:y\": 1}}]}"));
    }

    @Test
    @DisplayName("Test a restriction on an undeclared property is rejected")
    public void testRestrictionOnUndeclaredProperty() {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
            () -> load("""
                {
                  "@graph": [
                    {"@id": "T", "@type": "owl:Class", "rdfs:subClassOf": {"@id": "T_p_restriction"}},
                    {"@id": "T_p_restriction", "@type": "owl:Restriction",
                     "owl:onProperty": {"@id": "p"}, "owl:minCardinality": 1}
                  ]
                }
                """));
        assertNotNull(e.getNode());
    }
}
