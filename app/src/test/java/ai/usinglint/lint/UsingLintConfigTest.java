package ai.usinglint.lint;

import static org.junit.jupiter.api.Assertions.*;

import ai.usinglint.rules.Severity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class UsingLintConfigTest {

    @Test
    void defaultsFollowRuleDescriptor() {
        var config = UsingLintConfig.defaults();

        assertTrue(config.ruleEnabled());
        assertEquals(Severity.WARNING, config.severity());
        assertTrue(config.excludes().isEmpty());
        assertFalse(config.analyzeGeneratedCode());
    }

    @Test
    void readsAllKeys() {
        var props = new Properties();
        props.setProperty("rule.SA1209.enabled", "false");
        props.setProperty("rule.SA1209.severity", "Error");
        props.setProperty("exclude", " Legacy/** , **/Migrations/*.cs ,");
        props.setProperty("analyzeGeneratedCode", "true");

        var config = UsingLintConfig.fromProperties(props);

        assertFalse(config.ruleEnabled());
        assertEquals(Severity.ERROR, config.severity());
        assertEquals(List.of("Legacy/**", "**/Migrations/*.cs"), config.excludes());
        assertTrue(config.analyzeGeneratedCode());
    }

    @Test
    void invalidSeverityNamesTheKey() {
        var props = new Properties();
        props.setProperty("rule.SA1209.severity", "loud");

        var e = assertThrows(IllegalArgumentException.class, () -> UsingLintConfig.fromProperties(props));
        assertTrue(e.getMessage().contains("rule.SA1209.severity"), e.getMessage());
    }

    @Test
    void missingFileYieldsDefaults(@TempDir Path tempDir) {
        assertEquals(UsingLintConfig.defaults(), UsingLintConfig.load(tempDir.resolve("absent.properties")));
    }

    @Test
    void loadsProjectConfig(@TempDir Path tempDir) throws IOException {
        var file = tempDir.resolve(UsingLintConfig.PROJECT_CONFIG);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "rule.SA1209.severity=info\nexclude=gen/**\n");

        var config = UsingLintConfig.loadForProject(tempDir);

        assertEquals(Severity.INFO, config.severity());
        assertEquals(List.of("gen/**"), config.excludes());
    }

    @Test
    void excludesMatchRelativePaths() {
        var config = new UsingLintConfig(true, Severity.WARNING, List.of("Legacy/**", "**/*.Tests.cs"), false);

        assertTrue(config.isExcluded(Path.of("Legacy", "Old.cs")));
        assertTrue(config.isExcluded(Path.of("src", "Core", "Parser.Tests.cs")));
        assertFalse(config.isExcluded(Path.of("src", "Core", "Parser.cs")));
        assertFalse(UsingLintConfig.defaults().isExcluded(Path.of("Legacy", "Old.cs")));
    }

    @Test
    void withersKeepOtherValues() {
        var base = new UsingLintConfig(true, Severity.WARNING, List.of("a/**"), false);

        var changed = base.withSeverity(Severity.ERROR).withAnalyzeGeneratedCode(true);

        assertEquals(new UsingLintConfig(true, Severity.ERROR, List.of("a/**"), true), changed);
    }
}
