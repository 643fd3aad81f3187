package com.pyscope.ast;

import java.util.List;

public record BoolOp(
    int line,
    int col,
    String op,  // "and" or "or"
    List<Expression> values
) implements Expression {

    @Override
    public String type() {
        return "BoolOp";
    }
}
