package org.oxygen.compiler.frontend.parser.error;

import org.oxygen.compiler.api.CompilerErrorCode;
import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.lexer.TokenType;

import java.util.Objects;
import java.util.Optional;

/**
 * A mismatch between the token a grammar rule requires and the token actually found.
 */
public sealed interface TokenTypeError {

    /** @return The human readable description of the error. */
    String message();

    /** @return The stable error code of this error. */
    CompilerErrorCode code();

    /** @return The token the error refers to, or empty if the input had ended. */
    Optional<Token> location();

    /**
     * A token of type {@code expected} was required, but {@code got} was found.
     *
     * @param expected The required token type.
     * @param got The token found instead.
     */
    record Expected(TokenType expected, Token got) implements TokenTypeError {

        public Expected {
            Objects.requireNonNull(expected, "expected");
            Objects.requireNonNull(got, "got");
        }

        @Override
        public String message() {
            return "expected " + expected.describe() + ", found " + got.describe();
        }

        @Override
        public CompilerErrorCode code() {
            return CompilerErrorCode.EXPECTED_TOKEN;
        }

        @Override
        public Optional<Token> location() {
            return Optional.of(got);
        }
    }

    /**
     * A token of type {@code expected} was required, but the input had ended.
     *
     * @param expected The required token type.
     */
    record ExpectedGotNone(TokenType expected) implements TokenTypeError {

        public ExpectedGotNone {
            Objects.requireNonNull(expected, "expected");
        }

        @Override
        public String message() {
            return "expected " + expected.describe() + ", found end of file";
        }

        @Override
        public CompilerErrorCode code() {
            return CompilerErrorCode.EXPECTED_TOKEN_GOT_NONE;
        }

        @Override
        public Optional<Token> location() {
            return Optional.empty();
        }
    }

    /**
     * Some token was required, but the input had ended.
     */
    record ExpectedSomeGotNone() implements TokenTypeError {

        @Override
        public String message() {
            return "unexpected end of file";
        }

        @Override
        public CompilerErrorCode code() {
            return CompilerErrorCode.UNEXPECTED_END_OF_INPUT;
        }

        @Override
        public Optional<Token> location() {
            return Optional.empty();
        }
    }
}
