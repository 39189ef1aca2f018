package org.oxygen.cli.rendering;

import org.oxygen.compiler.api.SourceInfo;
import org.oxygen.compiler.diagnostics.Diagnostic;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.IStyle;
import picocli.CommandLine.Help.Ansi.Style;

/**
 * Renders a {@link Diagnostic} for the terminal:
 * <pre>
 * error: unknown character '$'
 *   2 |    return $;
 *     |           ^
 * </pre>
 * The caret is indented by {@code column - 1} characters beneath the quoted line.
 * Diagnostics without a source position render as the header line only.
 */
public class DiagnosticRenderer {

    private static final String GUTTER_GAP = "    ";

    private final Ansi ansi;

    /**
     * @param ansi Whether to emit ANSI colour codes; {@link Ansi#AUTO} detects the terminal.
     */
    public DiagnosticRenderer(Ansi ansi) {
        this.ansi = ansi;
    }

    /**
     * @param diagnostic The diagnostic to render.
     * @return The rendered text, without trailing newline.
     */
    public String render(Diagnostic diagnostic) {
        StringBuilder out = new StringBuilder();
        if (diagnostic.type() == Diagnostic.Type.ERROR) {
            out.append(style("error:", Style.fg_red, Style.bold));
        } else {
            out.append(style("warning:", Style.fg_yellow, Style.bold));
        }
        out.append(' ').append(style(diagnostic.message(), Style.bold));

        if (diagnostic.hasSource()) {
            SourceInfo source = diagnostic.source();
            String lineNumber = Integer.toString(source.lineNumber());
            out.append("\n  ")
                    .append(style(lineNumber + " |", Style.fg_blue, Style.bold))
                    .append(GUTTER_GAP)
                    .append(source.lineContent());
            out.append("\n  ")
                    .append(style(" ".repeat(lineNumber.length()) + " |", Style.fg_blue, Style.bold))
                    .append(GUTTER_GAP)
                    .append(" ".repeat(Math.max(0, source.columnNumber() - 1)))
                    .append(style("^", Style.fg_red, Style.bold));
        }
        return out.toString();
    }

    private String style(String text, IStyle... styles) {
        if (!ansi.enabled()) {
            return text;
        }
        return Style.on(styles) + text + Style.reset.on();
    }
}
