package com.pyscope.ast;

public sealed interface Expression extends Node permits
    Name,
    AssignName,
    DelName,
    Attribute,
    AssignAttr,
    DelAttr,
    Const,
    ListLiteral,
    TupleLiteral,
    SetLiteral,
    DictLiteral,
    BinOp,
    BoolOp,
    UnaryOp,
    Compare,
    Call,
    Subscript,
    Starred,
    IfExp,
    Lambda,
    ListComp,
    SetComp,
    DictComp,
    GeneratorExp,
    Yield,
    Uninferable {
}
