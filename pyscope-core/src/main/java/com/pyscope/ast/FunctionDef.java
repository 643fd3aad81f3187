package com.pyscope.ast;

import java.util.List;

public record FunctionDef(
    int line,
    int col,
    String name,
    Decorators decorators,  // Can be null
    Arguments args,
    List<Statement> body
) implements Statement, Scope, AssignType {

    @Override
    public String type() {
        return "FunctionDef";
    }
}
