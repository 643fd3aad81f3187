package com.pyscope.tree;

import com.pyscope.ast.Node;

/**
 * Where a descendant sits under a node: the field holding the branch and the
 * immediate child on the path to the descendant.
 */
public record ChildLocation(String field, Node child) {
}
