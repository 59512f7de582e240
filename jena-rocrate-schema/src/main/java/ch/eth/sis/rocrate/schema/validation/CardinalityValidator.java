package ch.eth.sis.rocrate.schema.validation;

import ch.eth.sis.rocrate.schema.NotFoundException;
import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks entries against the cardinality restrictions of their Type and of
 * the Type's local ancestors. All violations are collected; nothing is
 * thrown for a violation.
 */
public final class CardinalityValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        CardinalityValidator.class);

    /**
     * Validates entries.
     *
     * @param types the known Types
     * @param entries the entries; opaque entries are skipped
     * @return the report
     * @throws NotFoundException if an entry's class id names no Type
     */
    public ValidationReport validate(final List<Type> types,
            final List<MetadataEntry> entries) {
        Map<String, Type> byId = new LinkedHashMap<>();
        for (Type type : types) {
            byId.put(type.getId(), type);
        }
        List<CardinalityViolation> violations = new ArrayList<>();
        int checked = 0;
        for (MetadataEntry entry : entries) {
            if (entry.isOpaque()) {
                continue;
            }
            Type type = byId.get(entry.getClassId());
            if (type == null) {
                throw new NotFoundException(NotFoundException.Kind.TYPE,
                    entry.getClassId(), "class of entry " + entry.getId());
            }
            checked++;
            for (Owned owned : restrictions(type, byId)) {
                Restriction restriction = owned.restriction();
                int count = entry.valueCount(restriction.getPropertyId());
                if (!restriction.admits(count)) {
                    violations.add(new CardinalityViolation(entry.getId(),
                        owned.typeId(), restriction.getPropertyId(), count,
                        restriction.getMinCardinality(),
                        restriction.getMaxCardinality()));
                }
            }
        }
        ValidationReport report = new ValidationReport(checked, violations);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Validated {}", report);
        }
        return report;
    }

    /** Restrictions of a Type and its local ancestors, nearest first. */
    private static List<Owned> restrictions(final Type type,
            final Map<String, Type> byId) {
        List<Owned> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<Type> pending = new ArrayList<>(List.of(type));
        while (!pending.isEmpty()) {
            Type current = pending.remove(0);
            if (!seen.add(current.getId())) {
                continue;
            }
            for (Restriction restriction : current.getRestrictions()) {
                result.add(new Owned(current.getId(), restriction));
            }
            for (String parent : current.getSubClassOf()) {
                Type parentType = byId.get(parent);
                if (parentType != null) {
                    pending.add(parentType);
                }
            }
        }
        return result;
    }

    private record Owned(String typeId, Restriction restriction) {
    }
}
