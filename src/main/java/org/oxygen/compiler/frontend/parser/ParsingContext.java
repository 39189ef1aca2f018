package org.oxygen.compiler.frontend.parser;

import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.lexer.TokenType;
import org.oxygen.compiler.frontend.parser.error.TokenMismatchException;

import java.util.Optional;

/**
 * An interface that encapsulates the cursor state during parsing.
 * It provides the grammar rules with access to the token stream
 * without coupling them directly to the {@link Parser}.
 */
public interface ParsingContext {

    /**
     * Returns a token ahead of the cursor without consuming it.
     * @param offset The distance from the cursor; 0 is the current token.
     * @return The token at {@code cursor + offset}, or empty past the end of the stream.
     */
    Optional<Token> peek(int offset);

    /**
     * Returns the current token and moves the cursor forward by one, even at the end of the stream.
     * @return The consumed token, or empty if the stream was exhausted.
     */
    Optional<Token> consume();

    /**
     * Checks the type of a token ahead of the cursor without consuming it.
     * @param offset The distance from the cursor.
     * @param type The token type to check.
     * @return true if a token exists at that offset and is of the given type.
     */
    default boolean check(int offset, TokenType type) {
        return peek(offset).map(t -> t.type() == type).orElse(false);
    }

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @return The consumed token.
     * @throws TokenMismatchException if the stream was exhausted or the token is of another type.
     *         The cursor has moved past the token in either case.
     */
    Token expect(TokenType type) throws TokenMismatchException;

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if no token is left at the cursor.
     */
    boolean isAtEnd();
}
