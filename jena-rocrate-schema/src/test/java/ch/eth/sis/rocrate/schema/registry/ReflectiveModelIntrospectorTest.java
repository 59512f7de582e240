package ch.eth.sis.rocrate.schema.registry;

import ch.eth.sis.rocrate.schema.model.LiteralType;
import ch.eth.sis.rocrate.schema.model.Type;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ReflectiveModelIntrospector}.
 */
public class ReflectiveModelIntrospectorTest {

    record Person(String id, String name, int age, Optional<LocalDate> birthDate,
            List<Person> colleagues, Dog pet) {
    }

    record Dog(String name) {
    }

    static class Project {
        private static final String KIND = "project";
        private String title;
        private long budget;
        private List<String> keywords;
    }

    private final ReflectiveModelIntrospector introspector = new ReflectiveModelIntrospector();

    @Test
    @DisplayName("Test record components are described in declaration order")
    public void testRecord() {
        List<FieldDescriptor> fields = introspector.describe(Person.class);

        assertEquals(List.of("name", "age", "birthDate", "colleagues", "pet"),
            fields.stream().map(FieldDescriptor::name).toList(),
            "The id component is skipped");

        assertEquals(SemanticType.of(LiteralType.STRING), fields.get(0).semanticType());
        assertFalse(fields.get(0).required());

        assertEquals(SemanticType.of(LiteralType.INTEGER), fields.get(1).semanticType());
        assertTrue(fields.get(1).required(), "Primitives are required");

        assertEquals(SemanticType.of(LiteralType.DATE), fields.get(2).semanticType());
        assertFalse(fields.get(2).required());
        assertFalse(fields.get(2).list());

        assertEquals(SemanticType.reference("Person"), fields.get(3).semanticType());
        assertTrue(fields.get(3).list());

        assertEquals(SemanticType.reference("Dog"), fields.get(4).semanticType());
    }

    @Test
    @DisplayName("Test plain class fields are described and statics skipped")
    public void testPlainClass() {
        List<FieldDescriptor> fields = introspector.describe(Project.class);

        assertEquals(List.of("title", "budget", "keywords"),
            fields.stream().map(FieldDescriptor::name).toList());
        assertTrue(fields.get(1).required());
        assertEquals(SemanticType.of(LiteralType.STRING), fields.get(2).semanticType());
        assertTrue(fields.get(2).list());
    }

    @Test
    @DisplayName("Test a template built from a class converts to a Type")
    public void testTemplateFromClass() {
        Type type = TypeTemplate.from(Person.class, introspector).toType();

        assertEquals("Person", type.getId());
        assertTrue(type.getProperty("age").orElseThrow().isRequired());
        assertEquals(List.of("Dog"), type.getProperty("pet").orElseThrow().getRangeIncludes());
    }
}
