package io.graphtranslit.core.error;

import io.graphtranslit.core.model.AmbiguityReport;
import java.util.List;

/**
 * Thrown at compile time when two rules of equal cost can match the same token window and no
 * cheaper rule pre-empts them. Every conflict found in the rule set is attached.
 */
public final class AmbiguousRulesException extends TransliterationBuildException {

    private static final long serialVersionUID = 1L;

    private final transient List<AmbiguityReport> reports;

    public AmbiguousRulesException(List<AmbiguityReport> reports) {
        this(reports, null);
    }

    public AmbiguousRulesException(List<AmbiguityReport> reports, String source) {
        super(buildMessage(reports), source);
        this.reports = List.copyOf(reports);
    }

    /** All ambiguities found, in rule order. Never empty. */
    public List<AmbiguityReport> reports() {
        return reports;
    }

    private static String buildMessage(List<AmbiguityReport> reports) {
        StringBuilder sb = new StringBuilder();
        sb.append(reports.size()).append(reports.size() == 1 ? " ambiguity" : " ambiguities").append(" found");
        for (AmbiguityReport report : reports) {
            sb.append(System.lineSeparator()).append("  ").append(report.describe());
        }
        return sb.toString();
    }
}
