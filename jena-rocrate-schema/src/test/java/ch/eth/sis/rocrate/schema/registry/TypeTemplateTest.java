package ch.eth.sis.rocrate.schema.registry;

import ch.eth.sis.rocrate.schema.model.LiteralType;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TypeTemplate}.
 */
public class TypeTemplateTest {

    private static TypeTemplate person() {
        return TypeTemplate.builder("Person")
            .comment("A human being")
            .ontologicalAnnotation("schema:Person")
            .field(FieldDescriptor.of("name", SemanticType.of(LiteralType.STRING))
                .withRequired(true)
                .withOntology("schema:name"))
            .field(FieldDescriptor.of("colleagues", SemanticType.reference("Person"))
                .withList(true))
            .field(FieldDescriptor.of("birthDate", SemanticType.of(LiteralType.DATE))
                .withComment("Date of birth"))
            .build();
    }

    @Test
    @DisplayName("Test conversion creates one property per field")
    public void testProperties() {
        Type type = person().toType();

        assertEquals("Person", type.getId());
        assertEquals("Person", type.getLabel());
        assertEquals("A human being", type.getComment());
        assertEquals(List.of("schema:Thing"), type.getSubClassOf());
        assertEquals(List.of("https://schema.org/Person"), type.getOntologicalAnnotations());
        assertEquals(List.of("name", "colleagues", "birthDate"),
            type.getProperties().stream().map(TypeProperty::getId).toList());

        TypeProperty name = type.getProperty("name").orElseThrow();
        assertEquals("name", name.getLabel());
        assertEquals(List.of("xsd:string"), name.getRangeIncludes());
        assertEquals(List.of("Person"), name.getDomainIncludes());
        assertEquals(List.of("https://schema.org/name"), name.getOntologicalAnnotations());
        assertTrue(name.isRequired());

        assertEquals(List.of("Person"),
            type.getProperty("colleagues").orElseThrow().getRangeIncludes());
        assertEquals("Date of birth", type.getProperty("birthDate").orElseThrow().getComment());
    }

    @Test
    @DisplayName("Test restriction bounds follow required and list flags")
    public void testRestrictions() {
        Type type = person().toType();

        Restriction name = type.getRestrictionFor("name").orElseThrow();
        assertEquals(1, name.getMinCardinality());
        assertEquals(1, name.getMaxCardinality());

        Restriction colleagues = type.getRestrictionFor("colleagues").orElseThrow();
        assertEquals(0, colleagues.getMinCardinality());
        assertNull(colleagues.getMaxCardinality());

        Restriction birthDate = type.getRestrictionFor("birthDate").orElseThrow();
        assertEquals(0, birthDate.getMinCardinality());
        assertEquals(1, birthDate.getMaxCardinality());
    }

    @Test
    @DisplayName("Test semantic types accept exactly one component")
    public void testSemanticType() {
        assertThrows(IllegalArgumentException.class, () -> new SemanticType(null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new SemanticType(LiteralType.STRING, "Person"));
        assertEquals("Person", SemanticType.reference("base:Person").rangeId());
        assertEquals("xsd:integer", SemanticType.of(LiteralType.INTEGER).rangeId());
    }
}
