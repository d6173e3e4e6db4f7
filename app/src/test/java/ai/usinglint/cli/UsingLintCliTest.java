package ai.usinglint.cli;

import static org.junit.jupiter.api.Assertions.*;

import ai.usinglint.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class UsingLintCliTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        config = tempDir.resolve("lint.properties");
        Files.writeString(config, "exclude=Skip/**\n");
        Files.writeString(tempDir.resolve("Good.cs"), "using System;\nusing Col = System.Collections;\n");
        Files.writeString(tempDir.resolve("Bad.cs"), "using Col = System.Collections;\nusing System;\n");
        Files.createDirectories(tempDir.resolve("Skip"));
        Files.writeString(tempDir.resolve("Skip/Bad.cs"), "using Col = System.Collections;\nusing System;\n");
    }

    private int run(String... args) {
        var cmd = UsingLintCli.newCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void cleanFilesExitZero() {
        int exit = run("--config", config.toString(), tempDir.resolve("Good.cs").toString());

        assertEquals(UsingLintCli.EXIT_CLEAN, exit);
        assertTrue(out.toString().contains("No using directive ordering problems found."), out.toString());
    }

    @Test
    void warningsAreReportedButDoNotFailByDefault() {
        int exit = run("--config", config.toString(), tempDir.toString());

        assertEquals(UsingLintCli.EXIT_CLEAN, exit);
        var output = out.toString();
        assertTrue(
                output.contains("Bad.cs(1,1): warning SA1209: Using alias directive for 'Col' must appear after "
                        + "directive for 'System'"),
                output);
        assertFalse(output.contains("Skip"), "Excluded directory should not be linted: " + output);
        assertTrue(output.contains("1 warning"), output);
    }

    @Test
    void failOnWarningTurnsWarningsIntoFailure() {
        int exit = run("--config", config.toString(), "--fail-on-warning", tempDir.toString());

        assertEquals(UsingLintCli.EXIT_VIOLATIONS, exit);
    }

    @Test
    void errorSeverityFails() {
        int exit = run("--config", config.toString(), "--severity", "error", tempDir.resolve("Bad.cs").toString());

        assertEquals(UsingLintCli.EXIT_VIOLATIONS, exit);
        assertTrue(out.toString().contains("error SA1209"), out.toString());
    }

    @Test
    void projectConfigIsReadFromTheScannedDirectory() throws IOException {
        Files.createDirectories(tempDir.resolve(".usinglint"));
        Files.writeString(
                tempDir.resolve(".usinglint/project.properties"), "rule.SA1209.severity=error\nexclude=Skip/**\n");

        int exit = run(tempDir.toString());

        assertEquals(UsingLintCli.EXIT_VIOLATIONS, exit);
        var output = out.toString();
        assertTrue(output.contains("Bad.cs(1,1): error SA1209"), output);
        assertFalse(output.contains("Skip"), "Excluded directory should not be linted: " + output);
    }

    @Test
    void projectConfigIsReadFromTheDirectoryOfAFileArgument() throws IOException {
        Files.createDirectories(tempDir.resolve(".usinglint"));
        Files.writeString(tempDir.resolve(".usinglint/project.properties"), "rule.SA1209.enabled=false\n");

        int exit = run(tempDir.resolve("Bad.cs").toString());

        assertEquals(UsingLintCli.EXIT_CLEAN, exit);
        assertFalse(out.toString().contains("SA1209"), out.toString());
    }

    @Test
    void jsonFormat() throws JsonProcessingException {
        int exit = run("--config", config.toString(), "--format", "json", tempDir.resolve("Bad.cs").toString());

        assertEquals(UsingLintCli.EXIT_CLEAN, exit);
        var tree = Json.getMapper().readTree(out.toString());
        assertEquals(1, tree.get("diagnostics").size());
        assertEquals("SA1209", tree.get("diagnostics").get(0).get("code").asText());
        assertEquals(0, tree.get("skippedFiles").size());
    }

    @Test
    void generatedFilesNeedIncludeFlag() throws IOException {
        var designer = tempDir.resolve("Form1.Designer.cs");
        Files.writeString(designer, "using Col = System.Collections;\nusing System;\n");

        assertEquals(
                UsingLintCli.EXIT_CLEAN,
                run("--config", config.toString(), "--fail-on-warning", designer.toString()));
        assertEquals(
                UsingLintCli.EXIT_VIOLATIONS,
                run("--config", config.toString(), "--fail-on-warning", "--include-generated", designer.toString()));
    }

    @Test
    void invalidSeverityIsAUsageFailure() {
        int exit = run("--config", config.toString(), "--severity", "loud", tempDir.toString());

        assertEquals(UsingLintCli.EXIT_FAILURE, exit);
        assertTrue(err.toString().contains("loud"), err.toString());
    }

    @Test
    void missingConfigFileFails() {
        int exit = run("--config", tempDir.resolve("absent.properties").toString(), tempDir.toString());

        assertEquals(UsingLintCli.EXIT_FAILURE, exit);
        assertTrue(err.toString().contains("Config file not found"), err.toString());
    }

    @Test
    void missingPathFails() {
        int exit = run("--config", config.toString(), tempDir.resolve("nope").toString());

        assertEquals(UsingLintCli.EXIT_FAILURE, exit);
        assertTrue(err.toString().contains("nope"), err.toString());
    }

    @Test
    void pathIsRequired() {
        assertEquals(UsingLintCli.EXIT_FAILURE, run());
    }
}
