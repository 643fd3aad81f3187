package com.pyscope.ast;

public record WithItem(
    int line,
    int col,
    Expression contextExpr,
    Expression optionalVars  // Can be null
) implements Node {

    @Override
    public String type() {
        return "WithItem";
    }
}
