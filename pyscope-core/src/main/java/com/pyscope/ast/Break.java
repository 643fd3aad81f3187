package com.pyscope.ast;

public record Break(
    int line,
    int col
) implements Statement {

    @Override
    public String type() {
        return "Break";
    }
}
