package org.oxygen.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An AST node that represents {@code return <term>;}.
 *
 * @param term The returned term.
 */
public record ReturnStatement(Term term) implements Statement {

    public ReturnStatement {
        Objects.requireNonNull(term, "term");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(term);
    }
}
