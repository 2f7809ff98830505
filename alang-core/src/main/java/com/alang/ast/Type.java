package com.alang.ast;

public sealed interface Type extends Node permits
    IntType,
    BoolType,
    VoidType,
    ClassType,
    ImmutableType,
    RefType {
}
