package com.pyscope.ast;

import java.util.List;

public record SetComp(
    int line,
    int col,
    Expression elt,
    List<Comprehension> generators
) implements Expression {

    @Override
    public String type() {
        return "SetComp";
    }
}
