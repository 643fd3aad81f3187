package com.pyscope.ast;

public record Continue(
    int line,
    int col
) implements Statement {

    @Override
    public String type() {
        return "Continue";
    }
}
