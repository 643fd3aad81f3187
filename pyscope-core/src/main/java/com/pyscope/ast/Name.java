package com.pyscope.ast;

public record Name(
    int line,
    int col,
    String name
) implements Expression {

    public Name(int line, String name) {
        this(line, 0, name);
    }

    @Override
    public String type() {
        return "Name";
    }
}
