package org.oxygen.compiler.frontend.lexer;

import org.oxygen.compiler.api.CompilerErrorCode;

/**
 * An error found while tokenizing a line. Lexer errors do not stop the scan; they are
 * collected and reported together once the whole file has been tokenized.
 */
public sealed interface LexerError {

    /** @return The human readable description of the error. */
    String message();

    /** @return The stable error code of this error. */
    CompilerErrorCode code();

    /** @return The full text of the line the error was found on. */
    String lineText();

    /** @return The 1-based line number. */
    int line();

    /** @return The 1-based column number. */
    int column();

    /**
     * A character that does not start any token.
     *
     * @param character The offending character (one code point).
     * @param lineText The full line containing it.
     * @param line The line number of the character.
     * @param column The column number of the character.
     */
    record UnknownCharacter(String character, String lineText, int line, int column) implements LexerError {

        @Override
        public String message() {
            return "unknown character '" + character + "'";
        }

        @Override
        public CompilerErrorCode code() {
            return CompilerErrorCode.UNKNOWN_CHARACTER;
        }
    }
}
