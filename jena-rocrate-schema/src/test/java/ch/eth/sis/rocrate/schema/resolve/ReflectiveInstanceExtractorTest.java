package ch.eth.sis.rocrate.schema.resolve;

import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ReflectiveInstanceExtractor}.
 */
public class ReflectiveInstanceExtractorTest {

    enum Species { DOG, CAT }

    record Pet(String id, String name, Species species) {
    }

    record Owner(String id, String name, Optional<Integer> age, List<Pet> pets,
            List<String> nicknames) {
    }

    static class Employee {
        private String id;
        private String name;
        private final List<Employee> colleagues = new ArrayList<>();

        Employee(final String id, final String name) {
            this.id = id;
            this.name = name;
        }
    }

    private final ReflectiveInstanceExtractor extractor = new ReflectiveInstanceExtractor();

    @Test
    @DisplayName("Test record extraction")
    public void testRecord() {
        Pet rex = new Pet("rex", "Rex", Species.DOG);
        Owner owner = new Owner("ann", "Ann", Optional.empty(), List.of(rex), List.of("A", "Annie"));

        InstanceView view = extractor.extract(owner);

        assertEquals("Owner", view.classId());
        assertEquals("ann", view.explicitId());
        assertEquals(List.of("name", "pets", "nicknames"),
            view.fields().stream().map(FieldValue::name).toList(),
            "Empty optionals are skipped");
        assertFalse(view.fields().get(0).reference());
        assertTrue(view.fields().get(1).reference());
        assertFalse(view.fields().get(2).reference());
    }

    @Test
    @DisplayName("Test enum constants are stored by name")
    public void testEnum() {
        InstanceView view = extractor.extract(new Pet("rex", "Rex", Species.CAT));
        assertEquals("CAT", view.fields().get(1).value());
    }

    @Test
    @DisplayName("Test literals and collections are not extracted")
    public void testSupports() {
        assertTrue(extractor.supports(new Pet("rex", "Rex", Species.DOG)));
        assertFalse(extractor.supports("text"));
        assertFalse(extractor.supports(List.of()));
        assertFalse(extractor.supports(Species.DOG));
        assertFalse(extractor.supports(null));
    }

    @Test
    @DisplayName("Test cyclic plain objects resolve through the standard extractor")
    public void testCyclicObjects() {
        Employee sarah = new Employee("sarah", "Sarah");
        Employee marcus = new Employee("marcus", "Marcus");
        sarah.colleagues.add(marcus);
        marcus.colleagues.add(sarah);

        List<MetadataEntry> entries = new CycleResolver().resolve(sarah, marcus);

        assertEquals(2, entries.size());
        assertEquals("Employee", entries.get(0).getClassId());
        assertEquals(List.of("marcus"), entries.get(0).getReferences().get("colleagues"));
        assertEquals(List.of("sarah"), entries.get(1).getReferences().get("colleagues"));
    }

    @Test
    @DisplayName("Test nested records become separate entries")
    public void testNestedRecords() {
        Owner owner = new Owner("ann", "Ann", Optional.of(40), List.of(
            new Pet("rex", "Rex", Species.DOG), new Pet("tom", "Tom", Species.CAT)), List.of());

        List<MetadataEntry> entries = new CycleResolver().resolve(owner);

        assertEquals(List.of("ann", "rex", "tom"),
            entries.stream().map(MetadataEntry::getId).toList());
        assertEquals(40L, entries.get(0).getProperties().get("age"));
        assertEquals(List.of("rex", "tom"), entries.get(0).getReferences().get("pets"));
    }
}
