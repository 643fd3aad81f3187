package com.pyscope.ast;

import java.util.List;

public record ListLiteral(
    int line,
    int col,
    List<Expression> elts
) implements Expression {

    public ListLiteral(int line, List<Expression> elts) {
        this(line, 0, elts);
    }

    @Override
    public String type() {
        return "ListLiteral";
    }
}
