package com.pyscope.ast;

/**
 * Marker for a value that could not be determined statically. It never
 * appears in a parsed tree, only in inference results.
 */
public enum Uninferable implements Expression {
    INSTANCE;

    @Override
    public String type() {
        return "Uninferable";
    }

    @Override
    public int line() {
        return 0;
    }

    @Override
    public int col() {
        return 0;
    }
}
