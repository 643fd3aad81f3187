package com.pyscope.ast;

import java.util.List;

public record TryFinally(
    int line,
    int col,
    List<Statement> body,
    List<Statement> finalbody
) implements Statement, BlockRange {

    @Override
    public String type() {
        return "TryFinally";
    }
}
