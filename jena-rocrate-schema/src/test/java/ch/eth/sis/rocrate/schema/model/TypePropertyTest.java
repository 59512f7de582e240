package ch.eth.sis.rocrate.schema.model;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.List;
import java.util.Set;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.OWL2;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;
import org.apache.jena.vocabulary.XSD;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TypeProperty}.
 */
public class TypePropertyTest {

    @Test
    @DisplayName("Test references are stored in canonical form")
    public void testCanonicalReferences() {
        TypeProperty property = TypeProperty.builder("base:name")
            .domain("base:Person")
            .domain("Person")
            .range(XSD.getURI() + "string")
            .ontologicalAnnotation("schema:name")
            .build();

        assertEquals("name", property.getId());
        assertEquals(List.of("Person"), property.getDomainIncludes());
        assertEquals(List.of("xsd:string"), property.getRangeIncludes());
        assertEquals(List.of("https://schema.org/name"), property.getOntologicalAnnotations());
    }

    @Test
    @DisplayName("Test withDomain returns the same instance when unchanged")
    public void testWithDomain() {
        TypeProperty property = TypeProperty.builder("name").domain("Person").build();
        assertSame(property, property.withDomain("Person"));
        assertEquals(List.of("Person", "Dog"),
            property.withDomain("Dog").getDomainIncludes());
    }

    @Test
    @DisplayName("Test withoutDomains drops only the Types specified")
    public void testWithoutDomains() {
        TypeProperty property = TypeProperty.builder("name").range("xsd:string")
            .domain("Person").domain("Organization").domain("schema:Thing").build();

        TypeProperty narrowed = property.withoutDomains(Set.of("Organization", "Dog"));

        assertEquals(List.of("Person", "schema:Thing"), narrowed.getDomainIncludes());
        assertEquals(property.getRangeIncludes(), narrowed.getRangeIncludes());
        assertSame(property, property.withoutDomains(Set.of("Dog")));
    }

    @Test
    @DisplayName("Test property triples")
    public void testToTriples() {
        TypeProperty property = TypeProperty.builder("name")
            .label("name")
            .domain("Person")
            .range(LiteralType.STRING)
            .ontologicalAnnotation("schema:name")
            .build();
        Node self = NodeFactory.createURI("http://example.com/name");

        assertEquals(List.of(
            Triple.create(self, RDF.type.asNode(), RDF.Property.asNode()),
            Triple.create(self, RDFS.label.asNode(), NodeFactory.createLiteralString("name")),
            Triple.create(self, RDFS.domain.asNode(),
                NodeFactory.createURI("http://example.com/Person")),
            Triple.create(self, RDFS.range.asNode(), XSD.xstring.asNode()),
            Triple.create(self, OWL2.equivalentProperty.asNode(),
                NodeFactory.createURI("https://schema.org/name"))),
            property.toTriples(Namespaces.defaults()));
    }

    @Test
    @DisplayName("Test equality covers every attribute")
    public void testEquality() {
        TypeProperty a = TypeProperty.builder("name").range(LiteralType.STRING).build();
        TypeProperty b = TypeProperty.builder("name").range(LiteralType.STRING).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.withRequired(true));
        assertEquals(a, a.toBuilder().build());
    }
}
