package ch.eth.sis.rocrate.schema.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LiteralValues}.
 */
public class LiteralValuesTest {

    @Test
    @DisplayName("Test small integer kinds normalize to Long")
    public void testNormalizeIntegers() {
        assertEquals(5L, LiteralValues.normalize(5));
        assertEquals(5L, LiteralValues.normalize((short) 5));
        assertEquals(5L, LiteralValues.normalize((byte) 5));
        assertEquals("x", LiteralValues.normalize('x'));
    }

    @Test
    @DisplayName("Test big integers within 64 bits normalize to Long")
    public void testNormalizeBigIntegers() {
        assertEquals(5L, LiteralValues.normalize(BigInteger.valueOf(5)));
        assertEquals(Long.MAX_VALUE, LiteralValues.normalize(BigInteger.valueOf(Long.MAX_VALUE)));
        assertEquals(Long.MIN_VALUE, LiteralValues.normalize(BigInteger.valueOf(Long.MIN_VALUE)));

        BigInteger beyond = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
        assertEquals(beyond, LiteralValues.normalize(beyond));
        assertEquals(LiteralValues.normalize(BigInteger.valueOf(42)),
            LiteralValues.fromNode(LiteralValues.toNode(BigInteger.valueOf(42))));
    }

    @Test
    @DisplayName("Test instants normalize to UTC offset date-times")
    public void testNormalizeInstant() {
        Instant instant = Instant.parse("2024-03-01T12:00:00Z");
        assertEquals(OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC),
            LiteralValues.normalize(instant));
    }

    @Test
    @DisplayName("Test datatypes follow the value kind")
    public void testTypeOf() {
        assertEquals(LiteralType.STRING, LiteralValues.typeOf("a"));
        assertEquals(LiteralType.INTEGER, LiteralValues.typeOf(3));
        assertEquals(LiteralType.INTEGER, LiteralValues.typeOf(BigInteger.TEN));
        assertEquals(LiteralType.FLOAT, LiteralValues.typeOf(1.5f));
        assertEquals(LiteralType.DOUBLE, LiteralValues.typeOf(1.5d));
        assertEquals(LiteralType.DECIMAL, LiteralValues.typeOf(new BigDecimal("1.50")));
        assertEquals(LiteralType.BOOLEAN, LiteralValues.typeOf(true));
        assertEquals(LiteralType.DATETIME, LiteralValues.typeOf(LocalDateTime.of(2024, 1, 1, 10, 0)));
        assertEquals(LiteralType.DATE, LiteralValues.typeOf(LocalDate.of(2024, 1, 1)));
        assertEquals(LiteralType.TIME, LiteralValues.typeOf(LocalTime.of(10, 0)));
    }

    @Test
    @DisplayName("Test lexical forms are ISO-8601 and XSD compatible")
    public void testLexicalForm() {
        assertEquals("2024-01-01T10:00:00", LiteralValues.lexicalForm(LocalDateTime.of(2024, 1, 1, 10, 0)));
        assertEquals("10:00:00", LiteralValues.lexicalForm(LocalTime.of(10, 0)));
        assertEquals("2024-01-01", LiteralValues.lexicalForm(LocalDate.of(2024, 1, 1)));
        assertEquals("INF", LiteralValues.lexicalForm(Double.POSITIVE_INFINITY));
        assertEquals("-INF", LiteralValues.lexicalForm(Float.NEGATIVE_INFINITY));
        assertEquals("1.50", LiteralValues.lexicalForm(new BigDecimal("1.50")));
    }

    @Test
    @DisplayName("Test literal nodes carry the datatype of the value")
    public void testToNode() {
        Node string = LiteralValues.toNode("Alice");
        assertEquals("Alice", string.getLiteralLexicalForm());
        assertEquals(XSDDatatype.XSDstring.getURI(), string.getLiteralDatatypeURI());

        Node integer = LiteralValues.toNode(42);
        assertEquals("42", integer.getLiteralLexicalForm());
        assertEquals(XSDDatatype.XSDinteger.getURI(), integer.getLiteralDatatypeURI());

        Node date = LiteralValues.toNode(LocalDate.of(2024, 2, 29));
        assertEquals(XSDDatatype.XSDdate.getURI(), date.getLiteralDatatypeURI());
    }

    @Test
    @DisplayName("Test values read back from their nodes")
    public void testFromNode() {
        Object[] values = {"Alice", 42L, 1.5d, 2.5f, true, new BigDecimal("3.14"),
            LocalDate.of(2024, 2, 29), LocalDateTime.of(2024, 1, 1, 10, 0, 30),
            OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.ofHours(2))};
        for (Object value : values) {
            assertEquals(value, LiteralValues.fromNode(LiteralValues.toNode(value)),
                "Value " + value + " should survive conversion");
        }
    }

    @Test
    @DisplayName("Test non-canonical lexical forms are kept verbatim")
    public void testFromLexicalKeepsNonCanonical() {
        String integer = XSDDatatype.XSDinteger.getURI();
        assertEquals(7L, LiteralValues.fromLexical("7", integer));
        assertEquals(new TypedValue("007", integer), LiteralValues.fromLexical("007", integer));
        assertEquals(new TypedValue("abc", integer), LiteralValues.fromLexical("abc", integer));

        String intType = XSDDatatype.XSDint.getURI();
        assertEquals(new TypedValue("7", intType), LiteralValues.fromLexical("7", intType));

        String custom = "http://pokemon.org/level";
        Object value = LiteralValues.fromLexical("12", custom);
        assertEquals(new TypedValue("12", custom), value);
        assertEquals(custom, LiteralValues.toNode(value).getLiteralDatatypeURI());
    }

    @Test
    @DisplayName("Test literal kinds are recognized")
    public void testIsLiteral() {
        assertTrue(LiteralValues.isLiteral("a"));
        assertTrue(LiteralValues.isLiteral(1));
        assertTrue(LiteralValues.isLiteral(Instant.now()));
        assertFalse(LiteralValues.isLiteral(new Object()));
        assertFalse(LiteralValues.isLiteral(null));
    }
}
