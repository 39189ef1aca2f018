package org.oxygen.compiler.frontend.parser;

import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.lexer.TokenType;
import org.oxygen.compiler.frontend.parser.ast.IntegerLiteralTerm;
import org.oxygen.compiler.frontend.parser.ast.Term;
import org.oxygen.compiler.frontend.parser.error.TermError;
import org.oxygen.compiler.frontend.parser.error.TermException;
import org.oxygen.compiler.frontend.parser.error.TokenMismatchException;
import org.oxygen.compiler.frontend.parser.error.TokenTypeError;

/**
 * The term rule of the grammar. Only integer literals are terms.
 */
final class TermParser {

    private TermParser() {}

    /**
     * Parses the term at the cursor.
     * @param context The token cursor.
     * @return The parsed term.
     * @throws TermException with {@link TermError.NoTerm} at the end of the stream, or with a
     *         token mismatch if the current token is not an integer literal.
     */
    static Term parseTerm(ParsingContext context) throws TermException {
        Token next = context.peek(0).orElseThrow(() -> new TermException(new TermError.NoTerm()));
        if (next.type() != TokenType.INTEGER_LITERAL) {
            throw new TermException(new TokenMismatchException(new TokenTypeError.Expected(TokenType.INTEGER_LITERAL, next)));
        }
        context.consume();
        return new IntegerLiteralTerm(next.text());
    }
}
