package com.pyscope.ast;

/**
 * A constant: number, string, boolean or None (a null value).
 */
public record Const(
    int line,
    int col,
    Object value  // Can be null for None
) implements Expression {

    public Const(int line, Object value) {
        this(line, 0, value);
    }

    @Override
    public String type() {
        return "Const";
    }
}
