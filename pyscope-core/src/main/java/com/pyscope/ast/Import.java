package com.pyscope.ast;

import java.util.List;

public record Import(
    int line,
    int col,
    List<Alias> names
) implements Statement, AssignType {

    @Override
    public String type() {
        return "Import";
    }
}
