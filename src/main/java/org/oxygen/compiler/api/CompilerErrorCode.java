package org.oxygen.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that does not start any token. */
    UNKNOWN_CHARACTER,
    // endregion

    // region Parser Errors
    /** A token of a specific type was required, but a different token was found. */
    EXPECTED_TOKEN,
    /** A token of a specific type was required, but the input ended. */
    EXPECTED_TOKEN_GOT_NONE,
    /** More tokens were required, but the input ended. */
    UNEXPECTED_END_OF_INPUT,
    /** A term was required, but the input ended. */
    NO_TERM,
    /** A function body does not end with a return statement. */
    MISSING_RETURN,
    /** A token that does not start any statement. */
    UNEXPECTED_TOKEN,
    // endregion

    // region General Errors
    /** The source file does not exist or cannot be opened. */
    FILE_NOT_FOUND,
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE,
    /** The source file does not have the configured extension. */
    UNEXPECTED_FILE_EXTENSION
    // endregion
}
