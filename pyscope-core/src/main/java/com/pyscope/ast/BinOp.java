package com.pyscope.ast;

public record BinOp(
    int line,
    int col,
    Expression left,
    String op,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "BinOp";
    }
}
