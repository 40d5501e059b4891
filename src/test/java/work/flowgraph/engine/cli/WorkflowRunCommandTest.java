package work.flowgraph.engine.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class WorkflowRunCommandTest {
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private final ByteArrayOutputStream capturedErr = new ByteArrayOutputStream();

    @TempDir
    Path workDir;

    @BeforeEach
    void captureStreams() {
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(capturedErr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void runsSpecificationAndPrintsResult() throws Exception {
        var spec = Path.of(WorkflowRunCommandTest.class.getResource("/workflows/echo.json").toURI());
        var config = Files.writeString(workDir.resolve("engine.toml"), "[executor]\nmax_concurrency = 2\n");

        int exitCode = command().execute(
            "--spec", spec.toString(),
            "--config", config.toString(),
            "--input", "{\"message\": \"from cli\"}",
            "--policy", "isolate",
            "--log-level", "warn"
        );

        assertEquals(0, exitCode);
        var printed = new ObjectMapper().readTree(captured.toString(StandardCharsets.UTF_8));
        assertEquals("success", printed.get("status").asText());
        assertEquals("from cli", printed.get("metadata").get("outputs").get("echoed").asText());
    }

    @Test
    void failedRunExitsWithOne() throws Exception {
        var spec = Files.writeString(workDir.resolve("broken.yaml"), "steps:\n  - type: Missing\n    name: m\n");
        var config = workDir.resolve("absent.toml");

        int exitCode = command().execute("--spec", spec.toString(), "--config", config.toString());

        assertEquals(1, exitCode);
        assertTrue(captured.toString(StandardCharsets.UTF_8).contains("invalid_specification"));
    }

    @Test
    void rejectsConflictingTargets() {
        int exitCode = command().execute("--spec", "a.yaml", "--workspace", "ws", "--workflow-id", "wf");

        assertNotEquals(0, exitCode);
        var err = capturedErr.toString(StandardCharsets.UTF_8);
        assertTrue(err.contains("not both"), err);
    }

    private static CommandLine command() {
        return new CommandLine(new WorkflowRunCommand()).setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
