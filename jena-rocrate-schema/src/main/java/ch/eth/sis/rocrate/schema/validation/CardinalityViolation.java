package ch.eth.sis.rocrate.schema.validation;

/**
 * An entry whose number of values for a property is outside the bounds a
 * restriction declares.
 *
 * @param entryId the entry
 * @param typeId the Type owning the restriction
 * @param propertyId the restricted property
 * @param count the number of values found
 * @param min the lower bound, null if unbounded
 * @param max the upper bound, null if unbounded
 */
public record CardinalityViolation(String entryId, String typeId,
        String propertyId, int count, Integer min, Integer max) {

    /**
     * Describes the violation in one line.
     *
     * @return the description
     */
    public String describe() {
        return "Entry " + entryId + " has " + count + " value(s) for "
            + propertyId + " but " + typeId + " requires "
            + (min == null ? "0" : min) + ".." + (max == null ? "*" : max);
    }
}
