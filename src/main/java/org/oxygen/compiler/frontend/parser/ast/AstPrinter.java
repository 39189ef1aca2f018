package org.oxygen.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Renders an AST as an indented tree, one node per line, two spaces per level:
 * <pre>
 * FunctionDeclare main: int
 *   Return
 *     IntegerLiteral 0
 * </pre>
 */
public final class AstPrinter {

    private static final String INDENT = "  ";

    private AstPrinter() {}

    /**
     * Renders a list of top-level nodes.
     * @param nodes The nodes to render.
     * @return The rendered tree; empty for an empty program.
     */
    public static String print(List<? extends AstNode> nodes) {
        StringBuilder out = new StringBuilder();
        for (AstNode node : nodes) {
            print(node, 0, out);
        }
        return out.toString();
    }

    private static void print(AstNode node, int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth)).append(label(node)).append('\n');
        for (AstNode child : node.getChildren()) {
            print(child, depth + 1, out);
        }
    }

    private static String label(AstNode node) {
        if (node instanceof FunctionDeclareStatement function) {
            return "FunctionDeclare " + function.name() + ": " + function.returnType().keyword();
        }
        if (node instanceof ReturnStatement) {
            return "Return";
        }
        if (node instanceof IntegerLiteralTerm literal) {
            return "IntegerLiteral " + literal.text();
        }
        return node.getClass().getSimpleName();
    }
}
