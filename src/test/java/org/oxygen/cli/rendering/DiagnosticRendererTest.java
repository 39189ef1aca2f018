package org.oxygen.cli.rendering;

import org.oxygen.compiler.api.CompilerErrorCode;
import org.oxygen.compiler.api.SourceInfo;
import org.oxygen.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import static org.assertj.core.api.Assertions.assertThat;

public class DiagnosticRendererTest {

    private final DiagnosticRenderer plain = new DiagnosticRenderer(Ansi.OFF);

    @Test
    @Tag("unit")
    void testErrorWithSourceShowsLineAndCaret() {
        // Arrange
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.EXPECTED_TOKEN,
                "expected ';', found '}'", new SourceInfo("main.o2", 12, 23, "int main() { return 0 }"));

        // Act
        String rendered = plain.render(diagnostic);

        // Assert
        assertThat(rendered).isEqualTo(
                "error: expected ';', found '}'\n"
                        + "  12 |    int main() { return 0 }\n"
                        + "     |                          ^");
    }

    @Test
    @Tag("unit")
    void testWarningWithoutSourceIsHeaderOnly() {
        // Arrange
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.WARNING, CompilerErrorCode.IO_ERROR_READING_FILE,
                "unable to read file 'a.o2'", null);

        // Act & Assert
        assertThat(plain.render(diagnostic)).isEqualTo("warning: unable to read file 'a.o2'");
    }

    @Test
    @Tag("unit")
    void testColouredOutputKeepsText() {
        // Arrange
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.UNKNOWN_CHARACTER,
                "unknown character '$'", new SourceInfo("main.o2", 1, 1, "$"));

        // Act
        String rendered = new DiagnosticRenderer(Ansi.ON).render(diagnostic);

        // Assert
        assertThat(rendered).contains("\u001B[", "error:", "unknown character '$'", "1 |");
        assertThat(rendered.replaceAll("\u001B\\[[0-9;]*m", "")).isEqualTo(plain.render(diagnostic));
    }
}
