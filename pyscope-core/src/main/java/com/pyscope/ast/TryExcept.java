package com.pyscope.ast;

import java.util.List;

public record TryExcept(
    int line,
    int col,
    List<Statement> body,
    List<ExceptHandler> handlers,
    List<Statement> orelse
) implements Statement, BlockRange {

    @Override
    public String type() {
        return "TryExcept";
    }
}
