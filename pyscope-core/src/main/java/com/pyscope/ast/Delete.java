package com.pyscope.ast;

import java.util.List;

public record Delete(
    int line,
    int col,
    List<Expression> targets
) implements Statement, AssignType {

    @Override
    public String type() {
        return "Delete";
    }
}
