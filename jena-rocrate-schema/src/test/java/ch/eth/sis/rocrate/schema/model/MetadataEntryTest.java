package ch.eth.sis.rocrate.schema.model;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import ch.eth.sis.rocrate.schema.vocab.RoCrateVocab;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.vocabulary.RDF;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MetadataEntry}.
 */
public class MetadataEntryTest {

    @Test
    @DisplayName("Test literal values are normalized")
    public void testNormalization() {
        MetadataEntry entry = MetadataEntry.builder("alice", "Person")
            .property("age", 30)
            .property("nicknames", List.of("Al"))
            .property("scores", List.of(1, 2))
            .property("empty", List.of())
            .property("nothing", null)
            .build();

        assertEquals(30L, entry.getProperties().get("age"));
        assertEquals("Al", entry.getProperties().get("nicknames"));
        assertEquals(List.of(1L, 2L), entry.getProperties().get("scores"));
        assertFalse(entry.getProperties().containsKey("empty"));
        assertFalse(entry.getProperties().containsKey("nothing"));
    }

    @Test
    @DisplayName("Test non-literal values are rejected")
    public void testNonLiteralRejected() {
        MetadataEntry.Builder builder = MetadataEntry.builder("alice", "Person");
        assertThrows(IllegalArgumentException.class, () -> builder.property("friend", new Object()));
    }

    @Test
    @DisplayName("Test value counts include literals and references")
    public void testValueCount() {
        MetadataEntry entry = MetadataEntry.builder("alice", "Person")
            .property("name", "Alice")
            .property("tags", List.of("a", "b"))
            .references("knows", List.of("bob", "carol"))
            .build();
        assertEquals(1, entry.valueCount("name"));
        assertEquals(2, entry.valueCount("tags"));
        assertEquals(2, entry.valueCount("knows"));
        assertEquals(0, entry.valueCount("missing"));
    }

    @Test
    @DisplayName("Test reference rewriting")
    public void testRewriteReferences() {
        MetadataEntry entry = MetadataEntry.builder("alice", "Person")
            .reference("knows", "tmp-1")
            .reference("knows", "carol")
            .build();
        MetadataEntry rewritten = entry.rewriteReferences(Map.of("tmp-1", "bob"));

        assertEquals(List.of("bob", "carol"), rewritten.getReferences().get("knows"));
        assertSame(entry, entry.rewriteReferences(Map.of("other", "x")));
    }

    @Test
    @DisplayName("Test entry triples in declaration order")
    public void testToTriples() {
        MetadataEntry entry = MetadataEntry.builder("alice", "Person")
            .property("name", "Alice")
            .property("tags", List.of("a", "b"))
            .reference("knows", "bob")
            .build();
        Node self = NodeFactory.createURI("http://example.com/alice");

        assertEquals(List.of(
            Triple.create(self, RDF.type.asNode(), NodeFactory.createURI("http://example.com/Person")),
            Triple.create(self, NodeFactory.createURI("http://example.com/name"),
                NodeFactory.createLiteralString("Alice")),
            Triple.create(self, NodeFactory.createURI("http://example.com/tags"),
                NodeFactory.createLiteralString("a")),
            Triple.create(self, NodeFactory.createURI("http://example.com/tags"),
                NodeFactory.createLiteralString("b")),
            Triple.create(self, NodeFactory.createURI("http://example.com/knows"),
                NodeFactory.createURI("http://example.com/bob"))),
            entry.toTriples(Namespaces.defaults()));
    }

    @Test
    @DisplayName("Test opaque entries emit their declared type")
    public void testOpaqueEntry() {
        MetadataEntry entry = MetadataEntry.builder("./", RoCrateVocab.UNKNOWN_CLASS)
            .declaredType("schema:Dataset")
            .property("name", "Crate")
            .build();
        assertTrue(entry.isOpaque());
        Triple type = entry.toTriples(Namespaces.defaults()).get(0);
        assertEquals(NodeFactory.createURI("https://schema.org/Dataset"), type.getObject());

        MetadataEntry untyped = MetadataEntry.builder("x", RoCrateVocab.UNKNOWN_CLASS)
            .property("name", "X")
            .build();
        assertEquals(1, untyped.toTriples(Namespaces.defaults()).size());
    }
}
