package org.oxygen.cli.commands;

import org.oxygen.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

public class CompletionsCommandTest {

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"bash", "zsh", "BASH"})
    void testPrintsCompletionScript(String shell) {
        // Arrange
        StringWriter out = new StringWriter();
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));

        // Act
        int exitCode = commandLine.execute("completions", shell);

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .startsWith("# oxygen completion for " + shell.toLowerCase())
                .contains("compile", "--display-tokens");
    }

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"fish", "powershell"})
    void testUnsupportedShellIsUsageError(String shell) {
        // Arrange
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        // Act & Assert
        assertThat(commandLine.execute("completions", shell)).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
