package com.pyscope.ast;

import java.util.List;

public record If(
    int line,
    int col,
    Expression test,
    List<Statement> body,
    List<Statement> orelse   // Empty when there is no else branch
) implements Statement, BlockRange {

    @Override
    public String type() {
        return "If";
    }
}
