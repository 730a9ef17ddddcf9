package org.monkeylang.compiler.frontend.parser.ast;

/**
 * Marker for AST nodes that produce a value when evaluated.
 */
public interface Expression extends AstNode {
}
