package com.pyscope.ast;

public record Pass(
    int line,
    int col
) implements Statement {

    @Override
    public String type() {
        return "Pass";
    }
}
