package com.pyscope.ast;

public record Yield(
    int line,
    int col,
    Expression value  // Can be null
) implements Expression {

    @Override
    public String type() {
        return "Yield";
    }
}
