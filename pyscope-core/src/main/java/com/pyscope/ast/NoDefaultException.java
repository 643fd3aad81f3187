package com.pyscope.ast;

/**
 * Thrown when an argument has no default value. Callers treat this as a
 * normal negative answer.
 */
public class NoDefaultException extends RuntimeException {

    private final String argName;

    public NoDefaultException(String argName) {
        super("No default value for argument '" + argName + "'");
        this.argName = argName;
    }

    public String getArgName() {
        return argName;
    }
}
