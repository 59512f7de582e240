package ch.eth.sis.rocrate.schema.validation;

import ch.eth.sis.rocrate.schema.CardinalityViolationException;
import java.util.List;

/**
 * The findings of one validation pass.
 */
public final class ValidationReport {

    private final int checkedEntries;

    private final List<CardinalityViolation> violations;

    /**
     * Creates a report.
     *
     * @param checkedEntries number of entries checked
     * @param violations every violation found
     */
    public ValidationReport(final int checkedEntries,
            final List<CardinalityViolation> violations) {
        this.checkedEntries = checkedEntries;
        this.violations = List.copyOf(violations);
    }

    /**
     * Returns how many entries were checked.
     *
     * @return the entry count
     */
    public int getCheckedEntries() {
        return checkedEntries;
    }

    /**
     * Returns the violations found.
     *
     * @return the violations, in entry order
     */
    public List<CardinalityViolation> getViolations() {
        return violations;
    }

    /**
     * Checks whether the pass found nothing.
     *
     * @return true if there are no violations
     */
    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * Throws if the report has findings.
     *
     * @throws CardinalityViolationException carrying this report
     */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw new CardinalityViolationException(this);
        }
    }

    @Override
    public String toString() {
        return "ValidationReport[" + checkedEntries + " entries, "
            + violations.size() + " violation(s)]";
    }
}
