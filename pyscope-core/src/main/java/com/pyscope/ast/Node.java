package com.pyscope.ast;

/**
 * Base interface for all syntax tree nodes.
 *
 * <p>Nodes are immutable records. They hold no parent pointer: parents,
 * enclosing statements and scopes are answered by the
 * {@link com.pyscope.tree.SyntaxTree} built over them. A line of 0 means the
 * node carries no position (synthetic nodes).</p>
 */
public sealed interface Node permits
    Statement,
    Expression,
    Scope,
    AssignType,
    BlockRange,
    Keyword,
    WithItem,
    Decorators {

    String type();
    int line();
    int col();
}
