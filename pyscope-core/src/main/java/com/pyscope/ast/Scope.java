package com.pyscope.ast;

/**
 * A node owning a name to bindings map: module, function, lambda or class.
 */
public sealed interface Scope extends Node permits Module, FunctionDef, ClassDef, Lambda {

    String name();
}
