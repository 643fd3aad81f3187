package com.pyscope.ast;

import java.util.List;

public record Module(
    int line,
    int col,
    String name,
    List<Statement> body
) implements Scope {

    public Module(String name, List<Statement> body) {
        this(0, 0, name, body);
    }

    @Override
    public String type() {
        return "Module";
    }
}
