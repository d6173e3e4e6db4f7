package ai.usinglint.lint;

import ai.usinglint.lint.LintResult.LintDiagnostic;
import ai.usinglint.rules.Severity;
import ai.usinglint.util.Json;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Renders a {@link LintResult} for the console. */
public final class LintReporter {

    public enum Format {
        TEXT,
        JSON
    }

    /** Shape of the JSON report. */
    public record JsonReport(List<LintDiagnostic> diagnostics, List<String> skippedFiles) {}

    private LintReporter() {}

    public static String render(LintResult result, Format format) {
        return switch (format) {
            case TEXT -> renderText(result);
            case JSON -> Json.toJson(new JsonReport(result.diagnostics(), result.skippedFiles()));
        };
    }

    /** One MSBuild style line per diagnostic; HIDDEN diagnostics are left out. Ends with a newline unless empty. */
    public static String renderText(LintResult result) {
        var sb = new StringBuilder();
        for (var diagnostic : result.diagnostics()) {
            if (diagnostic.severity() != Severity.HIDDEN) {
                sb.append(diagnostic.toDisplayString()).append('\n');
            }
        }
        for (var skipped : result.skippedFiles()) {
            sb.append(skipped).append(": skipped, file could not be read\n");
        }
        return sb.toString();
    }

    /** Short tally, e.g. {@code 2 warnings, 1 error}. */
    public static String summary(LintResult result) {
        if (result.isEmpty()) {
            return "No using directive ordering problems found.";
        }
        var counts = result.diagnostics().stream()
                .collect(Collectors.groupingBy(LintDiagnostic::severity, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getValue() + " " + e.getKey().displayName() + (e.getValue() == 1 ? "" : "s"))
                .collect(Collectors.joining(", "));
    }
}
