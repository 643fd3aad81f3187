package com.pyscope.ast;

public record Return(
    int line,
    int col,
    Expression value  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Return";
    }
}
