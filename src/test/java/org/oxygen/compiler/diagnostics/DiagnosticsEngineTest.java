package org.oxygen.compiler.diagnostics;

import org.oxygen.compiler.api.CompilerErrorCode;
import org.oxygen.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void testWarningsAloneAreNotErrors() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning(CompilerErrorCode.UNEXPECTED_TOKEN, "odd", null);

        // Assert
        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testDiagnosticsKeepReportOrderInSummary() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportError(CompilerErrorCode.UNKNOWN_CHARACTER, "unknown character '$'",
                new SourceInfo("main.o2", 2, 12, "    return $;"));
        engine.reportError(CompilerErrorCode.FILE_NOT_FOUND, "unable to open file 'x.o2'", null);

        // Assert
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNKNOWN_CHARACTER, CompilerErrorCode.FILE_NOT_FOUND);
        assertThat(engine.summary()).isEqualTo(
                "[ERROR] main.o2:2:12: unknown character '$'\n[ERROR] unable to open file 'x.o2'");
    }

    @Test
    @Tag("unit")
    void testDiagnosticsViewIsUnmodifiable() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
