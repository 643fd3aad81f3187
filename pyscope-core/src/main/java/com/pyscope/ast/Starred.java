package com.pyscope.ast;

public record Starred(
    int line,
    int col,
    Expression value
) implements Expression {

    @Override
    public String type() {
        return "Starred";
    }
}
