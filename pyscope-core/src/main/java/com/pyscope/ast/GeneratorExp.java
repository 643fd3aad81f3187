package com.pyscope.ast;

import java.util.List;

public record GeneratorExp(
    int line,
    int col,
    Expression elt,
    List<Comprehension> generators
) implements Expression {

    @Override
    public String type() {
        return "GeneratorExp";
    }
}
