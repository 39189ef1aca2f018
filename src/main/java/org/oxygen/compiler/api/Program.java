package org.oxygen.compiler.api;

import org.oxygen.compiler.frontend.lexer.Token;
import org.oxygen.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * The result of a successful compilation.
 *
 * @param name The program name, usually the source file path.
 * @param tokens The token stream of the source, in source order.
 * @param statements The top-level statements, in source order.
 */
public record Program(String name, List<Token> tokens, List<Statement> statements) {

    public Program {
        tokens = List.copyOf(tokens);
        statements = List.copyOf(statements);
    }
}
