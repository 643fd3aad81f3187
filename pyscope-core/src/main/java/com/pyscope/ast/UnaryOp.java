package com.pyscope.ast;

public record UnaryOp(
    int line,
    int col,
    String op,
    Expression operand
) implements Expression {

    @Override
    public String type() {
        return "UnaryOp";
    }
}
