package com.pyscope.ast;

/**
 * A node that can sit directly in a block (body, orelse, handlers, finalbody).
 */
public sealed interface Statement extends Node permits
    Assign,
    AugAssign,
    Expr,
    If,
    For,
    While,
    With,
    TryExcept,
    TryFinally,
    ExceptHandler,
    FunctionDef,
    ClassDef,
    Return,
    Delete,
    Pass,
    Break,
    Continue,
    Raise,
    Import,
    ImportFrom,
    Global,
    Nonlocal,
    Assert {
}
