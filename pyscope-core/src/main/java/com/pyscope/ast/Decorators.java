package com.pyscope.ast;

import java.util.List;

/**
 * The decorator list of a function or class. Names inside it resolve in the
 * scope enclosing the decorated definition.
 */
public record Decorators(
    int line,
    int col,
    List<Expression> nodes
) implements Node {

    @Override
    public String type() {
        return "Decorators";
    }
}
