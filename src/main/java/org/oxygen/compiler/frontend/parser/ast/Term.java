package org.oxygen.compiler.frontend.parser.ast;

/**
 * An expression-level leaf of the AST.
 */
public sealed interface Term extends AstNode permits IntegerLiteralTerm {
}
