package org.oxygen.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An AST node that represents a function declaration, e.g. {@code int main() { return 0; }}.
 * <p>
 * The body always ends with a {@link ReturnStatement}; a node violating this cannot be created.
 *
 * @param name The name of the function.
 * @param returnType The declared return type.
 * @param body The statements of the body, in source order.
 */
public record FunctionDeclareStatement(
        String name,
        ValueType returnType,
        List<Statement> body
) implements Statement {

    public FunctionDeclareStatement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        body = List.copyOf(body);
        if (body.isEmpty() || !(body.get(body.size() - 1) instanceof ReturnStatement)) {
            throw new IllegalArgumentException("Body of function '" + name + "' must end with a return statement");
        }
    }

    @Override
    public List<AstNode> getChildren() {
        // The children of a function are all the statements in its body.
        return Collections.unmodifiableList(body);
    }
}
