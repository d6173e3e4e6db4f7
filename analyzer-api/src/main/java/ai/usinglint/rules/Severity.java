package ai.usinglint.rules;

import java.util.Locale;

/** Reporting level of a diagnostic. HIDDEN diagnostics are computed but not shown to the user. */
public enum Severity {
    ERROR,
    WARNING,
    INFO,
    HIDDEN;

    /**
     * Parses a severity name case-insensitively.
     *
     * @throws IllegalArgumentException if the name does not denote a severity
     */
    public static Severity parse(String value) {
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        for (var severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException(
                "Unknown severity '" + value + "'; expected one of error, warning, info, hidden");
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
