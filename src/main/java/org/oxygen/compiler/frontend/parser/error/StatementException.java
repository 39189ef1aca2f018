package org.oxygen.compiler.frontend.parser.error;

/**
 * Thrown when a statement cannot be parsed. Parsing stops at the first such exception.
 */
public class StatementException extends Exception {

    private final StatementError error;

    /**
     * @param error The statement error.
     */
    public StatementException(StatementError error) {
        super(error.message());
        this.error = error;
    }

    /**
     * Wraps a token mismatch found while parsing a statement.
     * @param cause The lower-level exception; kept as the cause.
     */
    public StatementException(TokenMismatchException cause) {
        super(cause.getMessage(), cause);
        this.error = new StatementError.TokenMismatch(cause.getError());
    }

    /**
     * Wraps a term error found while parsing a statement.
     * @param cause The lower-level exception; kept as the cause.
     */
    public StatementException(TermException cause) {
        super(cause.getMessage(), cause);
        this.error = new StatementError.InvalidTerm(cause.getError());
    }

    public StatementError getError() {
        return error;
    }
}
