package ch.eth.sis.rocrate.schema.model;

import java.math.BigInteger;
import java.time.LocalDate;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LiteralType}. Runs in its own JVM, so the enum is the
 * first class to touch Jena.
 */
public class LiteralTypeTest {

    @Test
    @DisplayName("Test literal types resolve Jena's registered datatypes")
    public void testDatatypes() {
        assertEquals("http://www.w3.org/2001/XMLSchema#string", LiteralType.STRING.getIri());
        assertSame(XSDDatatype.XSDinteger, LiteralType.INTEGER.getDatatype());
        assertEquals("http://www.w3.org/1999/02/22-rdf-syntax-ns#XMLLiteral",
            LiteralType.XML_LITERAL.getIri());
    }

    @Test
    @DisplayName("Test lookup by compact id, full IRI and Java class")
    public void testLookup() {
        assertEquals(LiteralType.DATE, LiteralType.fromId("xsd:date").orElseThrow());
        assertEquals(LiteralType.BOOLEAN,
            LiteralType.fromId("http://www.w3.org/2001/XMLSchema#boolean").orElseThrow());
        assertTrue(LiteralType.fromId("xsd:nope").isEmpty());
        assertEquals(LiteralType.INTEGER, LiteralType.forJavaType(BigInteger.class).orElseThrow());
        assertEquals(LiteralType.DATE, LiteralType.forJavaType(LocalDate.class).orElseThrow());
        assertTrue(LiteralType.forJavaType(Object.class).isEmpty());
    }
}
