package org.explorerscript.cli.commands;

import org.explorerscript.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the resolve-jumps command, run through the same command line as the entry point.
 */
@Tag("unit")
class ResolveJumpsCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void registersSubcommand() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("resolve-jumps");
    }

    @Test
    void printsRoutinesWithLabels() {
        int exitCode = run("resolve-jumps", resource("dumps/two-routines.json"));

        assertThat(exitCode).isZero();
        String output = out.toString();
        assertThat(output)
                .contains("routine 0:")
                .contains("routine 1:")
                .contains("    0: ES_JUMP<BranchValue>")
                .contains("-> @label_0")
                .contains("  ES_LABEL<0>:")
                .contains("  ES_LABEL<1> (cross-routine):")
                .contains("    40: ES_JUMP<Jump> [] -> @label_1")
                .contains("  foreign: ES_FOREIGN<1> (routine 0)");
        assertThat(output.indexOf("ES_LABEL<0>:")).isLessThan(output.indexOf("20: message_Talk"));
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void noPlaceLabelsOptionSkipsLabelLines() {
        int exitCode = run("resolve-jumps", "--no-place-labels", resource("dumps/two-routines.json"));

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .doesNotContain("  ES_LABEL<")
                .contains("-> @label_1")
                .contains("foreign: ES_FOREIGN<1>");
    }

    @Test
    void configFileDisablesPlacement() {
        int exitCode = run("--config", resource("config/no-placement.conf"),
                "resolve-jumps", resource("dumps/two-routines.json"));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).doesNotContain("  ES_LABEL<");
    }

    @Test
    void placeLabelsOptionOverridesConfigFile() {
        int exitCode = run("--config", resource("config/no-placement.conf"),
                "resolve-jumps", "--place-labels", resource("dumps/two-routines.json"));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("  ES_LABEL<0>:");
    }

    @Test
    void malformedOperationFails() {
        int exitCode = run("resolve-jumps", resource("dumps/malformed-jump.json"));

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString())
                .contains("Malformed operation in")
                .contains("BranchValue");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unreadableDumpFails() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"routines\": 3}");

        int exitCode = run("resolve-jumps", broken.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error reading");
    }

    @Test
    void missingDumpFails() {
        int exitCode = run("resolve-jumps", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error reading");
    }

    @Test
    void missingConfigFileFails() {
        int exitCode = run("--config", tempDir.resolve("missing.conf").toString(),
                "resolve-jumps", resource("dumps/two-routines.json"));

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Failed to load configuration");
    }

    private String resource(String name) {
        try {
            return Paths.get(getClass().getClassLoader().getResource(name).toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
