package org.oxygen.compiler.diagnostics;

import org.oxygen.compiler.api.CompilerErrorCode;
import org.oxygen.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code identifying the kind of problem.
 * @param message The diagnostic message.
 * @param source The position the diagnostic refers to, or {@code null} if it has none.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        SourceInfo source
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    /**
     * @return {@code true} if the diagnostic refers to a position in a source file.
     */
    public boolean hasSource() {
        return source != null;
    }

    @Override
    public String toString() {
        if (source == null) {
            return String.format("[%s] %s", type, message);
        }
        return String.format("[%s] %s: %s", type, source, message);
    }
}
