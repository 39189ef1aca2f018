package org.oxygen.compiler.frontend.lexer;

import java.util.Objects;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Identifier, TypeInt, SymbolSemicolon).
 * @param text The exact text of the token from the source code.
 * @param line The 1-based line number where the token was found.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Token position must be 1-based, got " + line + ":" + column);
        }
    }

    /**
     * Creates a token of a type with a fixed lexeme, such as a symbol or keyword.
     * @param type The token type; must not carry a payload.
     * @param line The line number.
     * @param column The column number.
     * @return The new token.
     */
    public static Token of(TokenType type, int line, int column) {
        if (type.hasPayload()) {
            throw new IllegalArgumentException(type.displayName() + " tokens need their scanned text");
        }
        return new Token(type, type.lexeme(), line, column);
    }

    /**
     * Describes this token for use in error messages, e.g. {@code 'main'}.
     * @return The quoted source text of the token.
     */
    public String describe() {
        return "'" + text + "'";
    }

    /**
     * Renders the token as {@code Kind:line:column}, e.g. {@code SymbolOpenParen:1:9}
     * or {@code Identifier(main):1:5}.
     */
    @Override
    public String toString() {
        String kind = type.hasPayload() ? type.displayName() + "(" + text + ")" : type.displayName();
        return kind + ":" + line + ":" + column;
    }
}
