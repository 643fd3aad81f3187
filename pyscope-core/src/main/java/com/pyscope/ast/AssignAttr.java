package com.pyscope.ast;

public record AssignAttr(
    int line,
    int col,
    Expression expr,
    String attrname
) implements Expression {

    @Override
    public String type() {
        return "AssignAttr";
    }
}
