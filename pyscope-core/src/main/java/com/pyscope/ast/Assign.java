package com.pyscope.ast;

import java.util.List;

public record Assign(
    int line,
    int col,
    List<Expression> targets,
    Expression value
) implements Statement, AssignType {

    @Override
    public String type() {
        return "Assign";
    }
}
