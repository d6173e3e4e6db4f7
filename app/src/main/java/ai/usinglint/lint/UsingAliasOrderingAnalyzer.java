package ai.usinglint.lint;

import ai.usinglint.analyzer.CSharpUsingExtractor;
import ai.usinglint.analyzer.GeneratedCodeDetector;
import ai.usinglint.lint.LintResult.LintDiagnostic;
import ai.usinglint.rules.RuleDescriptor;
import ai.usinglint.rules.Severity;
import ai.usinglint.rules.UsingAliasOrderingChecker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the SA1209 ordering check over C# files: extracts each scope's using directives and checks every scope on its
 * own, turning violations into diagnostics at the configured severity.
 */
public class UsingAliasOrderingAnalyzer {
    private static final Logger logger = LogManager.getLogger(UsingAliasOrderingAnalyzer.class);

    private final UsingLintConfig config;
    private final CSharpUsingExtractor extractor;
    private final RuleDescriptor descriptor = UsingAliasOrderingChecker.DESCRIPTOR;

    public UsingAliasOrderingAnalyzer(UsingLintConfig config) {
        this(config, new CSharpUsingExtractor());
    }

    public UsingAliasOrderingAnalyzer(UsingLintConfig config, CSharpUsingExtractor extractor) {
        this.config = config;
        this.extractor = extractor;
    }

    /**
     * Lints one file's content.
     *
     * @param fileName the name reported in diagnostics
     */
    public List<LintDiagnostic> lintSource(String fileName, String source) {
        if (!config.ruleEnabled() || config.severity() == Severity.HIDDEN) {
            return List.of();
        }
        if (!config.analyzeGeneratedCode() && GeneratedCodeDetector.isGenerated(fileName, source)) {
            logger.debug("Skipping generated file {}", fileName);
            return List.of();
        }

        var diagnostics = new ArrayList<LintDiagnostic>();
        for (var scope : extractor.extract(source, fileName)) {
            for (var violation : UsingAliasOrderingChecker.check(scope.directives())) {
                var position = violation.position();
                diagnostics.add(new LintDiagnostic(
                        position.file(),
                        position.line(),
                        position.column(),
                        config.severity(),
                        violation.message(descriptor),
                        descriptor.id()));
            }
        }
        if (!diagnostics.isEmpty()) {
            logger.debug("{} {} diagnostics in {}", diagnostics.size(), descriptor.id(), fileName);
        }
        return diagnostics;
    }

    /**
     * Lints files from disk. Files that cannot be read are logged and listed in {@link LintResult#skippedFiles()}.
     */
    public LintResult lintFiles(List<Path> files) {
        var diagnostics = new ArrayList<LintDiagnostic>();
        var skipped = new ArrayList<String>();
        for (var file : files) {
            String source;
            try {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.warn("Unable to read {}: {}", file, e.getMessage());
                skipped.add(file.toString());
                continue;
            }
            diagnostics.addAll(lintSource(file.toString(), source));
        }
        logger.info(
                "Linted {} files, {} diagnostics, {} skipped",
                files.size() - skipped.size(),
                diagnostics.size(),
                skipped.size());
        return new LintResult(diagnostics, skipped);
    }
}
