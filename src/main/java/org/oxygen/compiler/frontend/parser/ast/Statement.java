package org.oxygen.compiler.frontend.parser.ast;

/**
 * A statement: either a top-level element of a program or an element of a function body.
 */
public sealed interface Statement extends AstNode permits FunctionDeclareStatement, ReturnStatement {
}
