package com.pyscope.ast;

import java.util.List;

public record ClassDef(
    int line,
    int col,
    String name,
    Decorators decorators,  // Can be null
    List<Expression> bases,
    List<Statement> body
) implements Statement, Scope, AssignType {

    /**
     * Whether {@code node} is one of this class's base expressions (identity,
     * not structural equality).
     */
    public boolean hasBase(Node node) {
        for (Expression base : bases) {
            if (base == node) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String type() {
        return "ClassDef";
    }
}
