package org.oxygen.compiler.frontend.parser.error;

/**
 * Thrown when a required token is missing or of the wrong type.
 */
public class TokenMismatchException extends Exception {

    private final TokenTypeError error;

    /**
     * @param error The mismatch.
     */
    public TokenMismatchException(TokenTypeError error) {
        super(error.message());
        this.error = error;
    }

    public TokenTypeError getError() {
        return error;
    }
}
