package com.pyscope.ast;

public record AugAssign(
    int line,
    int col,
    Expression target,
    String op,
    Expression value
) implements Statement, AssignType {

    @Override
    public String type() {
        return "AugAssign";
    }
}
