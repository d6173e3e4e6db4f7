package ai.usinglint.lint;

import ai.usinglint.rules.RuleDescriptor;
import ai.usinglint.rules.Severity;
import ai.usinglint.rules.UsingAliasOrderingChecker;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Settings of a lint run, usually read from {@code .usinglint/project.properties} under the project root.
 *
 * <pre>
 * rule.SA1209.enabled=true
 * rule.SA1209.severity=warning
 * exclude=**&#47;Migrations/**,legacy/**
 * analyzeGeneratedCode=false
 * </pre>
 */
public record UsingLintConfig(
        boolean ruleEnabled, Severity severity, List<String> excludes, boolean analyzeGeneratedCode) {
    private static final Logger logger = LogManager.getLogger(UsingLintConfig.class);

    public static final Path PROJECT_CONFIG = Path.of(".usinglint", "project.properties");

    static final String ENABLED_KEY = "rule." + UsingAliasOrderingChecker.DIAGNOSTIC_ID + ".enabled";
    static final String SEVERITY_KEY = "rule." + UsingAliasOrderingChecker.DIAGNOSTIC_ID + ".severity";
    static final String EXCLUDE_KEY = "exclude";
    static final String GENERATED_KEY = "analyzeGeneratedCode";

    public UsingLintConfig {
        excludes = List.copyOf(excludes);
    }

    public static UsingLintConfig defaults() {
        RuleDescriptor descriptor = UsingAliasOrderingChecker.DESCRIPTOR;
        return new UsingLintConfig(descriptor.enabledByDefault(), descriptor.defaultSeverity(), List.of(), false);
    }

    /**
     * Builds a config from properties, falling back to defaults for missing keys.
     *
     * @throws IllegalArgumentException if the severity value is not a known severity
     */
    public static UsingLintConfig fromProperties(Properties props) {
        var defaults = defaults();
        boolean enabled =
                Boolean.parseBoolean(props.getProperty(ENABLED_KEY, String.valueOf(defaults.ruleEnabled())));
        var severityValue = props.getProperty(SEVERITY_KEY);
        Severity severity;
        try {
            severity = severityValue == null ? defaults.severity() : Severity.parse(severityValue);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + SEVERITY_KEY + ": " + e.getMessage(), e);
        }
        var excludes = Arrays.stream(props.getProperty(EXCLUDE_KEY, "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        boolean generated = Boolean.parseBoolean(props.getProperty(GENERATED_KEY, "false"));
        return new UsingLintConfig(enabled, severity, excludes, generated);
    }

    /**
     * Loads the given properties file. A missing file yields defaults; an unreadable one is logged and yields
     * defaults as well.
     */
    public static UsingLintConfig load(Path propertiesFile) {
        var props = new Properties();
        try {
            if (Files.exists(propertiesFile)) {
                try (var reader = Files.newBufferedReader(propertiesFile)) {
                    props.load(reader);
                }
                logger.debug("Loaded lint configuration from {}", propertiesFile);
            }
        } catch (IOException e) {
            logger.error("Error loading lint configuration from {}: {}", propertiesFile, e.getMessage());
            props.clear();
        }
        return fromProperties(props);
    }

    /** Loads {@link #PROJECT_CONFIG} under the given project root. */
    public static UsingLintConfig loadForProject(Path projectRoot) {
        return load(projectRoot.resolve(PROJECT_CONFIG));
    }

    public UsingLintConfig withSeverity(Severity newSeverity) {
        return new UsingLintConfig(ruleEnabled, newSeverity, excludes, analyzeGeneratedCode);
    }

    public UsingLintConfig withAnalyzeGeneratedCode(boolean analyze) {
        return new UsingLintConfig(ruleEnabled, severity, excludes, analyze);
    }

    /** True if the path, relative to the scanned root, matches one of the exclude globs. */
    public boolean isExcluded(Path relativePath) {
        if (excludes.isEmpty()) {
            return false;
        }
        var fs = FileSystems.getDefault();
        for (var glob : excludes) {
            PathMatcher matcher = fs.getPathMatcher("glob:" + glob);
            if (matcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }
}
