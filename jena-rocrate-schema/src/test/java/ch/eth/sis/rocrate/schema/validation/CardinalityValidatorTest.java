package ch.eth.sis.rocrate.schema.validation;

import ch.eth.sis.rocrate.schema.NotFoundException;
import ch.eth.sis.rocrate.schema.model.LiteralType;
import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.vocab.RoCrateVocab;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CardinalityValidator}.
 */
public class CardinalityValidatorTest {

    private final CardinalityValidator validator = new CardinalityValidator();

    private static final Type PERSON = Type.builder("Person")
        .property(TypeProperty.builder("name").range(LiteralType.STRING).required(true).build())
        .property(TypeProperty.builder("nickname").range(LiteralType.STRING).build())
        .restriction(Restriction.owned("Person", "nickname", 0, 2))
        .build();

    private static final Type STUDENT = Type.builder("Student")
        .subClassOf("Person")
        .property(TypeProperty.builder("school").range(LiteralType.STRING).required(true).build())
        .build();

    @Test
    @DisplayName("Test entries within bounds are valid")
    public void testValid() {
        ValidationReport report = validator.validate(List.of(PERSON), List.of(
            MetadataEntry.builder("a", "Person").property("name", "A")
                .property("nickname", List.of("x", "y")).build()));

        assertTrue(report.isValid());
        assertEquals(1, report.getCheckedEntries());
        report.throwIfInvalid();
    }

    @Test
    @DisplayName("Test every violation is collected")
    public void testViolations() {
        ValidationReport report = validator.validate(List.of(PERSON), List.of(
            MetadataEntry.builder("a", "Person")
                .property("nickname", List.of("x", "y", "z")).build(),
            MetadataEntry.builder("b", "Person").build()));

        assertFalse(report.isValid());
        assertEquals(3, report.getViolations().size());
        CardinalityViolation first = report.getViolations().get(0);
        assertEquals("a", first.entryId());
        assertEquals("name", first.propertyId());
        assertEquals(0, first.count());
        CardinalityViolation second = report.getViolations().get(1);
        assertEquals("nickname", second.propertyId());
        assertEquals(3, second.count());
        assertEquals(Integer.valueOf(2), second.max());
        assertTrue(second.describe().contains("0..2"));
    }

    @Test
    @DisplayName("Test restrictions of parent Types apply")
    public void testInheritedRestrictions() {
        ValidationReport report = validator.validate(List.of(PERSON, STUDENT), List.of(
            MetadataEntry.builder("s", "Student").property("school", "ETH").build()));

        assertEquals(1, report.getViolations().size());
        CardinalityViolation violation = report.getViolations().get(0);
        assertEquals("name", violation.propertyId());
        assertEquals("Person", violation.typeId());
    }

    @Test
    @DisplayName("Test references count as values")
    public void testReferencesCount() {
        Type team = Type.builder("Team")
            .property(TypeProperty.builder("lead").range("Person").required(true).build())
            .build();

        ValidationReport report = validator.validate(List.of(PERSON, team), List.of(
            MetadataEntry.builder("t", "Team").reference("lead", "a").build()));

        assertTrue(report.isValid());
    }

    @Test
    @DisplayName("Test opaque entries are skipped and unknown classes rejected")
    public void testOpaqueAndUnknown() {
        ValidationReport report = validator.validate(List.of(PERSON), List.of(
            MetadataEntry.builder("x", RoCrateVocab.UNKNOWN_CLASS).build()));
        assertEquals(0, report.getCheckedEntries());

        assertThrows(NotFoundException.class, () -> validator.validate(List.of(PERSON),
            List.of(MetadataEntry.builder("y", "Robot").build())));
    }

    @Test
    @DisplayName("Test cyclic parent chains terminate")
    public void testCyclicParents() {
        Type a = Type.builder("A").subClassOf("B")
            .property(TypeProperty.builder("p").required(true).build()).build();
        Type b = Type.builder("B").subClassOf("A").build();

        ValidationReport report = validator.validate(List.of(a, b), List.of(
            MetadataEntry.builder("e", "B").build()));

        assertEquals(1, report.getViolations().size());
    }
}
