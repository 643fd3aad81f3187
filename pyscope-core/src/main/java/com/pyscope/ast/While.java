package com.pyscope.ast;

import java.util.List;

public record While(
    int line,
    int col,
    Expression test,
    List<Statement> body,
    List<Statement> orelse
) implements Statement, BlockRange {

    @Override
    public String type() {
        return "While";
    }
}
