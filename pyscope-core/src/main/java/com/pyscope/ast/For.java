package com.pyscope.ast;

import java.util.List;

public record For(
    int line,
    int col,
    Expression target,
    Expression iter,
    List<Statement> body,
    List<Statement> orelse
) implements Statement, AssignType, BlockRange {

    @Override
    public boolean optionalAssign() {
        return true;
    }

    @Override
    public String type() {
        return "For";
    }
}
