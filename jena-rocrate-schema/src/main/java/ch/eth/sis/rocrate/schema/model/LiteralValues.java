package ch.eth.sis.rocrate.schema.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import org.apache.jena.datatypes.RDFDatatype;
import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * Conversions between Java literal values and RDF literal nodes.
 *
 * <p>Supported value kinds, after {@link #normalize(Object)}: {@link String},
 * {@link Long}, {@link BigInteger}, {@link Float}, {@link Double},
 * {@link BigDecimal}, {@link Boolean}, {@link LocalDateTime},
 * {@link OffsetDateTime}, {@link LocalDate}, {@link LocalTime} and
 * {@link TypedValue}.</p>
 */
public final class LiteralValues {

    private LiteralValues() {
        throw new AssertionError("No instances");
    }

    /**
     * Checks whether a value is of a literal kind (before or after
     * normalization).
     *
     * @param value the value
     * @return true if the value can be stored as a literal
     */
    public static boolean isLiteral(final Object value) {
        return value instanceof String || value instanceof Character
            || value instanceof Long || value instanceof Integer
            || value instanceof Short || value instanceof Byte
            || value instanceof BigInteger || value instanceof Float
            || value instanceof Double || value instanceof BigDecimal
            || value instanceof Boolean || value instanceof LocalDateTime
            || value instanceof OffsetDateTime || value instanceof ZonedDateTime
            || value instanceof Instant || value instanceof LocalDate
            || value instanceof LocalTime || value instanceof TypedValue;
    }

    /**
     * Brings a literal value into its canonical Java kind: integers that fit
     * in 64 bits become {@link Long}, characters become strings, zoned instants become
     * {@link OffsetDateTime}.
     *
     * @param value the value
     * @return the normalized value
     * @throws IllegalArgumentException if the value is not a literal kind
     */
    public static Object normalize(final Object value) {
        if (!isLiteral(value)) {
            throw new IllegalArgumentException("Not a literal value: "
                + (value == null ? "null" : value.getClass().getName()));
        }
        if (value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        if (value instanceof Character c) {
            return c.toString();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        return value;
    }

    /**
     * Returns the literal type matching a value's kind.
     *
     * @param value the value
     * @return the literal type, or null for {@link TypedValue}s
     */
    public static LiteralType typeOf(final Object value) {
        Object v = normalize(value);
        if (v instanceof TypedValue) {
            return null;
        }
        return LiteralType.forJavaType(v.getClass()).orElseThrow();
    }

    /**
     * Returns the ISO-8601 / XSD lexical form of a value.
     *
     * @param value the value
     * @return the lexical form
     */
    public static String lexicalForm(final Object value) {
        Object v = normalize(value);
        if (v instanceof TypedValue tv) {
            return tv.lexicalForm();
        }
        if (v instanceof Float f) {
            return floatingLexical(f.doubleValue(), f.toString());
        }
        if (v instanceof Double d) {
            return floatingLexical(d, d.toString());
        }
        if (v instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (v instanceof LocalDateTime ldt) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(ldt);
        }
        if (v instanceof OffsetDateTime odt) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt);
        }
        if (v instanceof LocalDate ld) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(ld);
        }
        if (v instanceof LocalTime lt) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format(lt);
        }
        return v.toString();
    }

    private static String floatingLexical(final double d, final String javaForm) {
        if (Double.isInfinite(d)) {
            return d > 0 ? "INF" : "-INF";
        }
        return javaForm;
    }

    /**
     * Creates the literal node for a value, typed after its kind.
     *
     * @param value the value
     * @return the literal node
     */
    public static Node toNode(final Object value) {
        Object v = normalize(value);
        if (v instanceof String s) {
            return NodeFactory.createLiteralString(s);
        }
        RDFDatatype datatype;
        if (v instanceof TypedValue tv) {
            datatype = TypeMapper.getInstance().getSafeTypeByName(tv.datatypeIri());
        } else {
            datatype = typeOf(v).getDatatype();
        }
        return NodeFactory.createLiteralDT(lexicalForm(v), datatype);
    }

    /**
     * Converts a literal node back into a Java value.
     *
     * @param node a literal node
     * @return the value
     */
    public static Object fromNode(final Node node) {
        if (!node.isLiteral()) {
            throw new IllegalArgumentException("Not a literal: " + node);
        }
        String lang = node.getLiteralLanguage();
        if (lang != null && !lang.isEmpty()) {
            return node.getLiteralLexicalForm();
        }
        return fromLexical(node.getLiteralLexicalForm(),
            node.getLiteralDatatypeURI());
    }

    /**
     * Converts a lexical form and datatype into a Java value. Lexical forms
     * that do not parse, that are not in the form {@link #lexicalForm(Object)}
     * would print, and datatypes without a Java kind, are kept as
     * {@link TypedValue} so the literal is reproduced exactly.
     *
     * @param lexical the lexical form
     * @param datatypeIri the datatype IRI, null for plain strings
     * @return the value
     */
    public static Object fromLexical(final String lexical, final String datatypeIri) {
        if (datatypeIri == null || XSDDatatype.XSDstring.getURI().equals(datatypeIri)) {
            return lexical;
        }
        try {
            Object parsed = parse(lexical, datatypeIri);
            if (parsed != null && typeOf(parsed).getIri().equals(datatypeIri)
                    && lexicalForm(parsed).equals(lexical)) {
                return parsed;
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            return new TypedValue(lexical, datatypeIri);
        }
        return new TypedValue(lexical, datatypeIri);
    }

    private static Object parse(final String lexical, final String datatypeIri) {
        String local = datatypeIri.startsWith(XSDDatatype.XSD + "#")
            ? datatypeIri.substring(XSDDatatype.XSD.length() + 1)
            : null;
        if (local == null) {
            return null;
        }
        String text = lexical.trim();
        switch (local) {
            case "integer":
                BigInteger big = new BigInteger(text);
                return big.bitLength() < Long.SIZE ? (Object) big.longValue() : big;
            case "float":
                return Float.valueOf(floatingText(text));
            case "double":
                return Double.valueOf(floatingText(text));
            case "decimal":
                return new BigDecimal(text);
            case "boolean":
                if ("true".equals(text) || "false".equals(text)) {
                    return Boolean.valueOf(text);
                }
                return null;
            case "dateTime":
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    text, OffsetDateTime::from, LocalDateTime::from);
                return parsed;
            case "date":
                return LocalDate.parse(text);
            case "time":
                return LocalTime.parse(text);
            default:
                return null;
        }
    }

    private static String floatingText(final String text) {
        if ("INF".equals(text)) {
            return "Infinity";
        }
        if ("-INF".equals(text)) {
            return "-Infinity";
        }
        return text;
    }
}
