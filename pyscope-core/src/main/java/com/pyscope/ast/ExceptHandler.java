package com.pyscope.ast;

import java.util.List;
import java.util.Set;

public record ExceptHandler(
    int line,
    int col,
    Expression exceptionType,  // Can be null for a bare except
    AssignName name,           // Can be null
    List<Statement> body
) implements Statement, AssignType {

    /**
     * Whether this handler catches one of the given exception names. A bare
     * handler catches everything, and a null name set matches any handler.
     */
    public boolean catches(Set<String> exceptionNames) {
        if (exceptionType == null || exceptionNames == null) {
            return true;
        }
        for (Node node : NodeFields.walk(exceptionType)) {
            if (node instanceof Name ref && exceptionNames.contains(ref.name())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String type() {
        return "ExceptHandler";
    }
}
