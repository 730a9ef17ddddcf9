package org.monkeylang.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes own their children exclusively; the tree never shares subtrees and never contains
 * cycles.
 */
public interface AstNode {

    /**
     * Renders the node back to source form, parenthesising every prefix and infix expression
     * so that the grouping chosen by the parser is visible, e.g. {@code ((a + b) - c)}.
     *
     * @return The canonical source form of this node.
     */
    String toSource();
}
