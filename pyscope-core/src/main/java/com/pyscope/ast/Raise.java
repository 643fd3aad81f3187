package com.pyscope.ast;

public record Raise(
    int line,
    int col,
    Expression exc,   // Can be null for a bare re-raise
    Expression cause  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Raise";
    }
}
