package com.pyscope.ast;

public record Subscript(
    int line,
    int col,
    Expression value,
    Expression slice
) implements Expression {

    @Override
    public String type() {
        return "Subscript";
    }
}
