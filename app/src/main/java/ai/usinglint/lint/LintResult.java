package ai.usinglint.lint;

import ai.usinglint.rules.Severity;
import java.util.List;

/**
 * Result of linting files: the diagnostics found and the files that could not be analyzed.
 *
 * @param skippedFiles files that were requested but could not be read, as given to the linter
 */
public record LintResult(List<LintDiagnostic> diagnostics, List<String> skippedFiles) {

    public LintResult {
        diagnostics = List.copyOf(diagnostics);
        skippedFiles = List.copyOf(skippedFiles);
    }

    public static LintResult of(List<LintDiagnostic> diagnostics) {
        return new LintResult(diagnostics, List.of());
    }

    /** Returns true if there are any ERROR level diagnostics. */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    /** Returns only the ERROR level diagnostics. */
    public List<LintDiagnostic> getErrors() {
        return diagnostics.stream()
                .filter(d -> d.severity() == Severity.ERROR)
                .toList();
    }

    /** Returns diagnostics reported against the given file. */
    public List<LintDiagnostic> getDiagnosticsForFile(String file) {
        return diagnostics.stream().filter(d -> d.file().equals(file)).toList();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    /** Individual diagnostic message from linting. */
    public record LintDiagnostic(String file, int line, int column, Severity severity, String message, String code) {

        /** MSBuild style: {@code File.cs(3,1): warning SA1209: message}. */
        public String toDisplayString() {
            return "%s(%d,%d): %s %s: %s".formatted(file, line, column, severity.displayName(), code, message);
        }
    }
}
