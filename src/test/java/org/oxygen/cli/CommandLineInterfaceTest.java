package org.oxygen.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CommandLineInterfaceTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    @Tag("unit")
    void testVersionOption() {
        assertThat(execute("--version")).isZero();
        assertThat(out.toString()).contains("Oxygen 0.1.0");
    }

    @Test
    @Tag("unit")
    void testHelpListsSubcommands() {
        // Act
        int exitCode = execute("--help");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("oxygen", "compile", "completions");
    }

    @Test
    @Tag("unit")
    void testUnknownSubcommandIsUsageError() {
        assertThat(execute("run")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("run");
    }

    @Test
    @Tag("unit")
    void testMissingConfigFileFailsCompilation(@TempDir Path dir) throws Exception {
        // Arrange
        Path source = Files.writeString(dir.resolve("main.o2"), "int main() { return 0; }\n");

        // Act
        int exitCode = execute("--config", dir.resolve("absent.conf").toString(), "compile", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
    }
}
