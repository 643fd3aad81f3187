package com.pyscope.ast;

import java.util.List;

public record Compare(
    int line,
    int col,
    Expression left,
    List<String> ops,
    List<Expression> comparators
) implements Expression {

    @Override
    public String type() {
        return "Compare";
    }
}
