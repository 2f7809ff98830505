package com.alang.ast;

public sealed interface Declaration extends Node permits
    VarDecl,
    FormalDecl,
    FnDecl,
    ClassDecl {

    Id name();
}
