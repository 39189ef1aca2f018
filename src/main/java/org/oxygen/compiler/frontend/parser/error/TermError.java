package org.oxygen.compiler.frontend.parser.error;

import org.oxygen.compiler.api.CompilerErrorCode;
import org.oxygen.compiler.frontend.lexer.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * An error raised while parsing a term.
 */
public sealed interface TermError {

    /** @return The human readable description of the error. */
    String message();

    /** @return The stable error code of this error. */
    CompilerErrorCode code();

    /** @return The token the error refers to, or empty if the input had ended. */
    Optional<Token> location();

    /**
     * The token at the cursor cannot start a term.
     *
     * @param cause The underlying token mismatch.
     */
    record TokenMismatch(TokenTypeError cause) implements TermError {

        public TokenMismatch {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public String message() {
            return cause.message();
        }

        @Override
        public CompilerErrorCode code() {
            return cause.code();
        }

        @Override
        public Optional<Token> location() {
            return cause.location();
        }
    }

    /**
     * The input ended where a term was required.
     */
    record NoTerm() implements TermError {

        @Override
        public String message() {
            return "expected a term, found end of file";
        }

        @Override
        public CompilerErrorCode code() {
            return CompilerErrorCode.NO_TERM;
        }

        @Override
        public Optional<Token> location() {
            return Optional.empty();
        }
    }
}
