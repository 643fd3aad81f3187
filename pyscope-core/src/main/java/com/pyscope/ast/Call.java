package com.pyscope.ast;

import java.util.List;

public record Call(
    int line,
    int col,
    Expression func,
    List<Expression> args,
    List<Keyword> keywords
) implements Expression {

    @Override
    public String type() {
        return "Call";
    }
}
