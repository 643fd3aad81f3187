package com.pyscope.ast;

import java.util.List;

public record ImportFrom(
    int line,
    int col,
    String module,  // Can be null for "from . import x"
    List<Alias> names,
    int level
) implements Statement, AssignType {

    @Override
    public String type() {
        return "ImportFrom";
    }
}
