package com.pyscope.ast;

public record AssignName(
    int line,
    int col,
    String name
) implements Expression {

    public AssignName(int line, String name) {
        this(line, 0, name);
    }

    @Override
    public String type() {
        return "AssignName";
    }
}
