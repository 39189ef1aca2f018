package org.oxygen.compiler.frontend.parser.error;

/**
 * Thrown when a term cannot be parsed.
 */
public class TermException extends Exception {

    private final TermError error;

    /**
     * @param error The term error.
     */
    public TermException(TermError error) {
        super(error.message());
        this.error = error;
    }

    /**
     * Wraps a token mismatch found while parsing a term.
     * @param cause The lower-level exception; kept as the cause.
     */
    public TermException(TokenMismatchException cause) {
        super(cause.getMessage(), cause);
        this.error = new TermError.TokenMismatch(cause.getError());
    }

    public TermError getError() {
        return error;
    }
}
