package ai.usinglint.cli;

import ai.usinglint.lint.CSharpSourceFiles;
import ai.usinglint.lint.LintReporter;
import ai.usinglint.lint.LintResult;
import ai.usinglint.lint.UsingAliasOrderingAnalyzer;
import ai.usinglint.lint.UsingLintConfig;
import ai.usinglint.rules.Severity;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // CommandSpec is injected by picocli before call()
@CommandLine.Command(
        name = "using-lint",
        mixinStandardHelpOptions = true,
        version = "using-lint 0.1.0",
        description = "Reports C# using-alias directives placed before regular using directives (SA1209).")
public final class UsingLintCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(UsingLintCli.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_FAILURE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "PATH", description = "C# files or directories to lint.")
    private List<Path> paths = new ArrayList<>();

    @CommandLine.Option(
            names = "--config",
            description = "Properties file with lint settings. Defaults to .usinglint/project.properties "
                    + "under the first PATH (or the directory of the first file).")
    @Nullable
    private Path configPath;

    @CommandLine.Option(
            names = "--format",
            description = "Output format: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}.",
            defaultValue = "TEXT")
    private LintReporter.Format format = LintReporter.Format.TEXT;

    @CommandLine.Option(
            names = "--severity",
            description = "Override the rule severity (error, warning, info, hidden).")
    @Nullable
    private String severity;

    @CommandLine.Option(names = "--include-generated", description = "Also lint generated code files.")
    private boolean includeGenerated = false;

    @CommandLine.Option(
            names = "--fail-on-warning",
            description = "Exit with status 1 on warnings as well as errors.")
    private boolean failOnWarning = false;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new UsingLintCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExitCodeExceptionMapper(e -> EXIT_FAILURE);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        UsingLintConfig config;
        try {
            config = resolveConfig();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        List<Path> files;
        try {
            files = CSharpSourceFiles.collect(paths, config);
        } catch (IOException e) {
            logger.error("Failed to collect source files: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        logger.debug("Linting {} files", files.size());

        LintResult result = new UsingAliasOrderingAnalyzer(config).lintFiles(files);
        out.print(LintReporter.render(result, format));
        if (format == LintReporter.Format.TEXT) {
            out.println(LintReporter.summary(result));
        } else {
            out.println();
        }
        out.flush();

        return exitCodeFor(result);
    }

    private UsingLintConfig resolveConfig() {
        if (configPath != null && !Files.exists(configPath)) {
            throw new IllegalArgumentException("Config file not found: " + configPath);
        }
        var config = configPath != null
                ? UsingLintConfig.load(configPath)
                : UsingLintConfig.loadForProject(projectRoot());
        if (severity != null) {
            config = config.withSeverity(Severity.parse(severity));
        }
        if (includeGenerated) {
            config = config.withAnalyzeGeneratedCode(true);
        }
        logger.debug(
                "Effective config: enabled={}, severity={}, excludes={}, generated={}",
                config.ruleEnabled(),
                config.severity().displayName(),
                config.excludes(),
                config.analyzeGeneratedCode());
        return config;
    }

    /** The first directory argument, or the directory holding the first file argument. */
    Path projectRoot() {
        var first = paths.get(0).toAbsolutePath().normalize();
        if (Files.isDirectory(first)) {
            return first;
        }
        var parent = first.getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }

    private int exitCodeFor(LintResult result) {
        if (result.hasErrors()) {
            return EXIT_VIOLATIONS;
        }
        if (failOnWarning && result.diagnostics().stream().anyMatch(d -> d.severity() == Severity.WARNING)) {
            return EXIT_VIOLATIONS;
        }
        return EXIT_CLEAN;
    }
}
