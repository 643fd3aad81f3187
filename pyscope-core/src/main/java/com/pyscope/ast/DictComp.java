package com.pyscope.ast;

import java.util.List;

public record DictComp(
    int line,
    int col,
    Expression key,
    Expression value,
    List<Comprehension> generators
) implements Expression {

    @Override
    public String type() {
        return "DictComp";
    }
}
