package org.monkeylang.compiler.frontend.parser.ast;

/**
 * Marker for AST nodes that appear directly in a program or block.
 */
public interface Statement extends AstNode {
}
