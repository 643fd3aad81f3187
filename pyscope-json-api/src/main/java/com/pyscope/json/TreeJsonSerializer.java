package com.pyscope.json;

import com.pyscope.ast.Node;
import com.pyscope.tree.SyntaxTree;

/**
 * Writes syntax trees as JSON, with positions as {@code lineno} and
 * {@code col_offset}.
 */
public interface TreeJsonSerializer {

    /**
     * @throws TreeJsonException if serialization fails
     */
    String serialize(Node node) throws TreeJsonException;

    String serializePretty(Node node) throws TreeJsonException;

    /**
     * Writes the module a tree was built from.
     */
    default String serialize(SyntaxTree tree) throws TreeJsonException {
        return serialize(tree.root());
    }
}
