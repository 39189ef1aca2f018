package org.oxygen.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * <p>
 * Keywords and symbols have a fixed lexeme. Literals and identifiers carry the
 * scanned text as payload in {@link Token#text()}.
 */
public enum TokenType {
    // Literals.
    /** A run of decimal digits, such as {@code 42}. */
    INTEGER_LITERAL("IntegerLiteral", null),
    /** A name, such as {@code main} or {@code _tmp1}. */
    IDENTIFIER("Identifier", null),

    // Keywords & types.
    /** The keyword {@code return}. */
    KEYWORD_RETURN("KeywordReturn", "return"),
    /** The type name {@code int}. */
    TYPE_INT("TypeInt", "int"),

    // Single-character symbols.
    /** The '(' character. */
    SYMBOL_OPEN_PAREN("SymbolOpenParen", "("),
    /** The ')' character. */
    SYMBOL_CLOSE_PAREN("SymbolCloseParen", ")"),
    /** The '{' character. */
    SYMBOL_OPEN_CURLY("SymbolOpenCurly", "{"),
    /** The '}' character. */
    SYMBOL_CLOSE_CURLY("SymbolCloseCurly", "}"),
    /** The ';' character. */
    SYMBOL_SEMICOLON("SymbolSemicolon", ";");

    private final String displayName;
    private final String lexeme;

    TokenType(String displayName, String lexeme) {
        this.displayName = displayName;
        this.lexeme = lexeme;
    }

    /**
     * @return The name used when listing tokens, e.g. {@code SymbolOpenParen}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return The fixed source text of this token type, or {@code null} for types with a text payload.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * @return {@code true} if tokens of this type carry the scanned text as payload.
     */
    public boolean hasPayload() {
        return lexeme == null;
    }

    /**
     * Describes this token type for use in error messages.
     * @return e.g. {@code '('} for symbols and keywords, {@code identifier} for identifiers.
     */
    public String describe() {
        return switch (this) {
            case INTEGER_LITERAL -> "integer literal";
            case IDENTIFIER -> "identifier";
            default -> "'" + lexeme + "'";
        };
    }
}
