package com.pyscope.ast;

public record Lambda(
    int line,
    int col,
    Arguments args,
    Expression body
) implements Expression, Scope {

    @Override
    public String name() {
        return "<lambda>";
    }

    @Override
    public String type() {
        return "Lambda";
    }
}
