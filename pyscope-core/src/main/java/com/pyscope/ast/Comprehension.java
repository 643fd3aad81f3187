package com.pyscope.ast;

import java.util.List;

/**
 * One {@code for target in iter if ...} clause of a comprehension.
 */
public record Comprehension(
    int line,
    int col,
    Expression target,
    Expression iter,
    List<Expression> ifs
) implements AssignType {

    @Override
    public boolean optionalAssign() {
        return true;
    }

    @Override
    public String type() {
        return "Comprehension";
    }
}
