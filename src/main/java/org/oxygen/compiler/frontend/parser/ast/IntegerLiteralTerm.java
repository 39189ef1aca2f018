package org.oxygen.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * An AST node that represents an integer literal.
 *
 * @param text The digits exactly as written in the source; not converted to a number.
 */
public record IntegerLiteralTerm(String text) implements Term {

    public IntegerLiteralTerm {
        Objects.requireNonNull(text, "text");
    }

    // This node has no children and inherits the empty list from getChildren().
}
