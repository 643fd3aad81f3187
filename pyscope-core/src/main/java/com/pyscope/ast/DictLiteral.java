package com.pyscope.ast;

import java.util.List;

public record DictLiteral(
    int line,
    int col,
    List<Expression> keys,
    List<Expression> values  // Same size as keys
) implements Expression {

    @Override
    public String type() {
        return "DictLiteral";
    }
}
