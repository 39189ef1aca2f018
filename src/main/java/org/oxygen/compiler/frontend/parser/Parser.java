package org.oxygen.compiler.frontend.parser;

import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.lexer.TokenType;
import org.oxygen.compiler.frontend.parser.ast.Statement;
import org.oxygen.compiler.frontend.parser.error.StatementException;
import org.oxygen.compiler.frontend.parser.error.TokenMismatchException;
import org.oxygen.compiler.frontend.parser.error.TokenTypeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The parser for the Oxygen language. It consumes the complete list of tokens
 * from the {@link org.oxygen.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Parsing is a single left-to-right pass with at most three tokens of lookahead.
 * The first error aborts the parse; no partial program is returned.
 * A parser instance is meant to be used for a single call to {@link #parse()}.
 */
public class Parser implements ParsingContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     */
    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Parses the entire token stream and returns the top-level statements.
     * @return The program as an unmodifiable list of statements, in source order.
     * @throws StatementException on the first grammar violation.
     */
    public List<Statement> parse() throws StatementException {
        List<Statement> program = new ArrayList<>();
        while (!isAtEnd()) {
            Statement statement = StatementParser.parseStatement(this);
            LOGGER.debug("Parsed top-level {}.", statement.getClass().getSimpleName());
            program.add(statement);
        }
        return Collections.unmodifiableList(program);
    }

    @Override
    public Optional<Token> peek(int offset) {
        int index = current + offset;
        if (index < 0 || index >= tokens.size()) return Optional.empty();
        return Optional.of(tokens.get(index));
    }

    @Override
    public Optional<Token> consume() {
        Optional<Token> token = peek(0);
        current++;
        return token;
    }

    @Override
    public Token expect(TokenType type) throws TokenMismatchException {
        Token token = consume().orElseThrow(() -> new TokenMismatchException(new TokenTypeError.ExpectedGotNone(type)));
        if (token.type() != type) {
            throw new TokenMismatchException(new TokenTypeError.Expected(type, token));
        }
        return token;
    }

    @Override
    public boolean isAtEnd() {
        return current >= tokens.size();
    }
}
