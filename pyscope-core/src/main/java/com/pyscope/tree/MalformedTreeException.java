package com.pyscope.tree;

/**
 * Thrown when a tree breaks a structural invariant the analysis relies on:
 * a binding occurrence without an assign type, a node reachable twice, or a
 * node that is not part of the tree it is queried against.
 */
public class MalformedTreeException extends RuntimeException {

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
