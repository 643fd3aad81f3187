package com.pyscope.ast;

public record Expr(
    int line,
    int col,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "Expr";
    }
}
