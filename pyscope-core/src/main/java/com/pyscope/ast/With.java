package com.pyscope.ast;

import java.util.List;

public record With(
    int line,
    int col,
    List<WithItem> items,
    List<Statement> body
) implements Statement, AssignType, BlockRange {

    @Override
    public boolean optionalAssign() {
        return true;
    }

    @Override
    public String type() {
        return "With";
    }
}
