package org.oxygen.compiler.frontend.parser.error;

import org.oxygen.compiler.api.CompilerErrorCode;
import org.oxygen.compiler.frontend.lexer.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * An error raised while parsing a statement. This is the error type of a whole parse:
 * errors of the lower layers reach the caller wrapped, unchanged, in one of these variants.
 */
public sealed interface StatementError {

    /** @return The human readable description of the error. */
    String message();

    /** @return The stable error code of this error. */
    CompilerErrorCode code();

    /** @return The token the error refers to, or empty if the input had ended. */
    Optional<Token> location();

    /**
     * The term of a statement could not be parsed.
     *
     * @param cause The term error.
     */
    record InvalidTerm(TermError cause) implements StatementError {

        public InvalidTerm {
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
     * A token required by the statement grammar was missing or of the wrong type.
     *
     * @param cause The token mismatch.
     */
    record TokenMismatch(TokenTypeError cause) implements StatementError {

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
     * A function body does not end with a return statement.
     *
     * @param functionName The name token of the function.
     */
    record MissingReturn(Token functionName) implements StatementError {

        public MissingReturn {
            Objects.requireNonNull(functionName, "functionName");
        }

        @Override
        public String message() {
            return "function '" + functionName.text() + "' does not end with a return statement";
        }

        @Override
        public CompilerErrorCode code() {
            return CompilerErrorCode.MISSING_RETURN;
        }

        @Override
        public Optional<Token> location() {
            return Optional.of(functionName);
        }
    }

    /**
     * The next tokens match no statement rule.
     *
     * @param token The first token of the unmatched input.
     */
    record UnexpectedToken(Token token) implements StatementError {

        public UnexpectedToken {
            Objects.requireNonNull(token, "token");
        }

        @Override
        public String message() {
            return "unexpected " + token.describe() + ", expected a function declaration or a return statement";
        }

        @Override
        public CompilerErrorCode code() {
            return CompilerErrorCode.UNEXPECTED_TOKEN;
        }

        @Override
        public Optional<Token> location() {
            return Optional.of(token);
        }
    }
}
