package com.pyscope.ast;

public record DelName(
    int line,
    int col,
    String name
) implements Expression {

    public DelName(int line, String name) {
        this(line, 0, name);
    }

    @Override
    public String type() {
        return "DelName";
    }
}
