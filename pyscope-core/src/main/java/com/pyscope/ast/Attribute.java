package com.pyscope.ast;

public record Attribute(
    int line,
    int col,
    Expression expr,
    String attrname
) implements Expression {

    @Override
    public String type() {
        return "Attribute";
    }
}
