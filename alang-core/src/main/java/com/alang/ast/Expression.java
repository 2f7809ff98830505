package com.alang.ast;

public sealed interface Expression extends Node permits
    Location,
    IntLit,
    StrLit,
    BoolLit,
    UnknownLit,
    CallExp,
    BinaryExp,
    UnaryExp {
}
