package ch.eth.sis.rocrate.schema.model;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.apache.jena.datatypes.RDFDatatype;
import org.apache.jena.datatypes.TypeMapper;

/**
 * Literal datatypes a property range may name, with their compact ids.
 */
public enum LiteralType {
    /** Plain string. */
    STRING("xsd:string"),
    /** Arbitrary-size integer. */
    INTEGER("xsd:integer"),
    /** 32 bit float. */
    FLOAT("xsd:float"),
    /** 64 bit float. */
    DOUBLE("xsd:double"),
    /** Arbitrary-precision decimal. */
    DECIMAL("xsd:decimal"),
    /** Boolean. */
    BOOLEAN("xsd:boolean"),
    /** Date and time, with or without offset. */
    DATETIME("xsd:dateTime"),
    /** Calendar date. */
    DATE("xsd:date"),
    /** Time of day. */
    TIME("xsd:time"),
    /** XML fragment. */
    XML_LITERAL("rdf:XMLLiteral");

    private final String id;

    private final RDFDatatype datatype;

    LiteralType(final String compactId) {
        this.id = compactId;
        // Namespaces starts Jena, so it must be touched before TypeMapper
        String iri = Namespaces.expandWellKnown(compactId);
        this.datatype = TypeMapper.getInstance().getSafeTypeByName(iri);
    }

    /**
     * Returns the compact id, e.g. {@code xsd:string}.
     *
     * @return the compact id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the full datatype IRI.
     *
     * @return the datatype IRI
     */
    public String getIri() {
        return datatype.getURI();
    }

    /**
     * Returns the Jena datatype.
     *
     * @return the datatype
     */
    public RDFDatatype getDatatype() {
        return datatype;
    }

    /**
     * Looks up a literal type by compact id or full datatype IRI.
     *
     * @param idOrIri {@code xsd:string} or its full IRI
     * @return the literal type, if the value names one
     */
    public static Optional<LiteralType> fromId(final String idOrIri) {
        for (LiteralType type : values()) {
            if (type.id.equals(idOrIri) || type.getIri().equals(idOrIri)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the literal type used for values of a Java class.
     *
     * @param javaType the Java class, primitive or boxed
     * @return the literal type, empty if the class is not a literal kind
     */
    public static Optional<LiteralType> forJavaType(final Class<?> javaType) {
        if (javaType == String.class || javaType == char.class
                || javaType == Character.class) {
            return Optional.of(STRING);
        }
        if (javaType == int.class || javaType == long.class
                || javaType == short.class || javaType == byte.class
                || javaType == Integer.class || javaType == Long.class
                || javaType == Short.class || javaType == Byte.class
                || javaType == BigInteger.class) {
            return Optional.of(INTEGER);
        }
        if (javaType == float.class || javaType == Float.class) {
            return Optional.of(FLOAT);
        }
        if (javaType == double.class || javaType == Double.class) {
            return Optional.of(DOUBLE);
        }
        if (javaType == BigDecimal.class) {
            return Optional.of(DECIMAL);
        }
        if (javaType == boolean.class || javaType == Boolean.class) {
            return Optional.of(BOOLEAN);
        }
        if (javaType == LocalDateTime.class || javaType == OffsetDateTime.class
                || javaType == ZonedDateTime.class || javaType == Instant.class) {
            return Optional.of(DATETIME);
        }
        if (javaType == LocalDate.class) {
            return Optional.of(DATE);
        }
        if (javaType == LocalTime.class) {
            return Optional.of(TIME);
        }
        return Optional.empty();
    }
}
