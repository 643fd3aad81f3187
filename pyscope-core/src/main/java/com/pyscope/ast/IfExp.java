package com.pyscope.ast;

public record IfExp(
    int line,
    int col,
    Expression test,
    Expression body,
    Expression orelse
) implements Expression {

    @Override
    public String type() {
        return "IfExp";
    }
}
