package com.alang.ast;

public sealed interface Statement extends Node permits
    VarDecl,
    AssignStmt,
    CallStmt,
    ReturnStmt,
    MaybeStmt,
    FromConsoleStmt,
    ToConsoleStmt,
    PostIncStmt,
    PostDecStmt,
    IfStmt,
    IfElseStmt,
    WhileStmt {
}
