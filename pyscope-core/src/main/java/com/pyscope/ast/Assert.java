package com.pyscope.ast;

public record Assert(
    int line,
    int col,
    Expression test,
    Expression fail  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "Assert";
    }
}
