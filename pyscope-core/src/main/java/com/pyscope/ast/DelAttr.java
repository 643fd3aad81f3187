package com.pyscope.ast;

public record DelAttr(
    int line,
    int col,
    Expression expr,
    String attrname
) implements Expression {

    @Override
    public String type() {
        return "DelAttr";
    }
}
