package org.oxygen.compiler.api;

import org.oxygen.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The diagnostics are ordered as they were found: all lexical errors of a file,
 * or the single error that stopped the parser.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception.
     * @param message The detail message.
     * @param diagnostics The diagnostics describing the errors.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param diagnostics The diagnostics describing the errors.
     * @param cause The cause.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics describing the errors.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
