package ch.eth.sis.rocrate.schema;

import ch.eth.sis.rocrate.schema.validation.CardinalityViolation;
import ch.eth.sis.rocrate.schema.validation.ValidationReport;
import java.util.stream.Collectors;

/**
 * Signals that an explicit validation pass found entries whose property
 * counts fall outside the declared cardinality bounds. Carries every
 * violation found, not just the first one.
 */
public class CardinalityViolationException extends SchemaException {

    private static final long serialVersionUID = 2659034164883920157L;

    private final transient ValidationReport report;

    /**
     * Creates a new instance for the report specified.
     *
     * @param report a report with at least one violation
     */
    public CardinalityViolationException(final ValidationReport report) {
        super(report.getViolations().size() + " cardinality violation(s):\n"
            + report.getViolations().stream()
                .map(CardinalityViolation::describe)
                .collect(Collectors.joining("\n")));
        this.report = report;
    }

    /**
     * Returns the report that caused this exception.
     *
     * @return the validation report
     */
    public ValidationReport getReport() {
        return report;
    }
}
