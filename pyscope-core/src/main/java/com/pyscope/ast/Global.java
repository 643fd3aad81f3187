package com.pyscope.ast;

import java.util.List;

public record Global(
    int line,
    int col,
    List<String> names
) implements Statement {

    @Override
    public String type() {
        return "Global";
    }
}
