package org.oxygen.compiler.frontend.parser;

import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.lexer.TokenType;
import org.oxygen.compiler.frontend.parser.ast.FunctionDeclareStatement;
import org.oxygen.compiler.frontend.parser.ast.ReturnStatement;
import org.oxygen.compiler.frontend.parser.ast.Statement;
import org.oxygen.compiler.frontend.parser.ast.Term;
import org.oxygen.compiler.frontend.parser.ast.ValueType;
import org.oxygen.compiler.frontend.parser.error.StatementError;
import org.oxygen.compiler.frontend.parser.error.StatementException;
import org.oxygen.compiler.frontend.parser.error.TermException;
import org.oxygen.compiler.frontend.parser.error.TokenMismatchException;
import org.oxygen.compiler.frontend.parser.error.TokenTypeError;

import java.util.ArrayList;
import java.util.List;

/**
 * The statement rules of the grammar:
 * <pre>
 * FunctionDeclare ::= 'int' Identifier '(' ')' '{' Statement* '}'
 * Return          ::= 'return' Term ';'
 * </pre>
 */
final class StatementParser {

    private StatementParser() {}

    /**
     * Parses one statement, choosing the rule by looking ahead up to three tokens.
     * @param context The token cursor.
     * @return The parsed statement.
     * @throws StatementException if no rule matches or the chosen rule fails.
     */
    static Statement parseStatement(ParsingContext context) throws StatementException {
        if (context.check(0, TokenType.TYPE_INT)
                && context.check(1, TokenType.IDENTIFIER)
                && context.check(2, TokenType.SYMBOL_OPEN_PAREN)) {
            return parseFunctionDeclare(context);
        }
        if (context.check(0, TokenType.KEYWORD_RETURN)) {
            return parseReturn(context);
        }

        Token unexpected = context.peek(0).orElseThrow(() ->
                new StatementException(new StatementError.TokenMismatch(new TokenTypeError.ExpectedSomeGotNone())));
        throw new StatementException(new StatementError.UnexpectedToken(unexpected));
    }

    private static FunctionDeclareStatement parseFunctionDeclare(ParsingContext context) throws StatementException {
        // int main() {...}
        // ^^^
        expect(context, TokenType.TYPE_INT);
        // int main() {...}
        //     ^^^^
        Token name = expect(context, TokenType.IDENTIFIER);
        // int main() {...}
        //         ^^ ^
        expect(context, TokenType.SYMBOL_OPEN_PAREN);
        expect(context, TokenType.SYMBOL_CLOSE_PAREN);
        expect(context, TokenType.SYMBOL_OPEN_CURLY);

        // int main() {...}
        //             ^^^
        List<Statement> body = new ArrayList<>();
        while (nextIsNot(context, TokenType.SYMBOL_CLOSE_CURLY)) {
            body.add(parseStatement(context));
        }
        if (body.isEmpty() || !(body.get(body.size() - 1) instanceof ReturnStatement)) {
            throw new StatementException(new StatementError.MissingReturn(name));
        }

        // The loop above stopped on the '}'.
        context.consume();

        return new FunctionDeclareStatement(name.text(), ValueType.INT, body);
    }

    private static ReturnStatement parseReturn(ParsingContext context) throws StatementException {
        // return ...;
        // ^^^^^^
        expect(context, TokenType.KEYWORD_RETURN);
        // return ...;
        //        ^^^
        Term term;
        try {
            term = TermParser.parseTerm(context);
        } catch (TermException e) {
            throw new StatementException(e);
        }
        // return ...;
        //           ^
        expect(context, TokenType.SYMBOL_SEMICOLON);

        return new ReturnStatement(term);
    }

    private static boolean nextIsNot(ParsingContext context, TokenType type) throws StatementException {
        Token next = context.peek(0).orElseThrow(() ->
                new StatementException(new StatementError.TokenMismatch(new TokenTypeError.ExpectedSomeGotNone())));
        return next.type() != type;
    }

    private static Token expect(ParsingContext context, TokenType type) throws StatementException {
        try {
            return context.expect(type);
        } catch (TokenMismatchException e) {
            throw new StatementException(e);
        }
    }
}
