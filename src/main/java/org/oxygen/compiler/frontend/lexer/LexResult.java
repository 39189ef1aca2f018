package org.oxygen.compiler.frontend.lexer;

import java.util.List;

/**
 * The outcome of tokenizing a whole file.
 *
 * @param tokens All tokens in source order.
 * @param errors All lexical errors in source order. If not empty, the tokens must not be parsed.
 */
public record LexResult(List<Token> tokens, List<LexerError> errors) {

    public LexResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }
}
