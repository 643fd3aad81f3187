package com.pyscope.ast;

/**
 * A construct that introduces bindings. Every binding occurrence resolves to
 * exactly one of these, either itself or the nearest one above it.
 */
public sealed interface AssignType extends Node permits
    Assign,
    AugAssign,
    For,
    With,
    Delete,
    ExceptHandler,
    Comprehension,
    Arguments,
    FunctionDef,
    ClassDef,
    Import,
    ImportFrom {

    /**
     * Whether the binding may not happen on a given run (loop, comprehension
     * and with targets).
     */
    default boolean optionalAssign() {
        return false;
    }
}
