package com.pyscope.ast;

public record Keyword(
    int line,
    int col,
    String arg,  // Null for **kwargs
    Expression value
) implements Node {

    @Override
    public String type() {
        return "Keyword";
    }
}
