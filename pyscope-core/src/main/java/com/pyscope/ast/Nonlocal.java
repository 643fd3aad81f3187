package com.pyscope.ast;

import java.util.List;

public record Nonlocal(
    int line,
    int col,
    List<String> names
) implements Statement {

    @Override
    public String type() {
        return "Nonlocal";
    }
}
