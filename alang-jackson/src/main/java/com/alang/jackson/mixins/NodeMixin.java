package com.alang.jackson.mixins;

import com.alang.ast.*;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic type handling for the node interfaces: each node is written
 * with a {@code "kind"} property holding its simple class name.
 *
 * <p>Applied to {@link Node} and to every sealed sub-interface, since a
 * record field declared as {@code Expression} or {@code Type} needs the
 * type id on its own declared type.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Program.class, name = "Program"),
    // Declarations
    @JsonSubTypes.Type(value = VarDecl.class, name = "VarDecl"),
    @JsonSubTypes.Type(value = FormalDecl.class, name = "FormalDecl"),
    @JsonSubTypes.Type(value = FnDecl.class, name = "FnDecl"),
    @JsonSubTypes.Type(value = ClassDecl.class, name = "ClassDecl"),
    // Types
    @JsonSubTypes.Type(value = IntType.class, name = "IntType"),
    @JsonSubTypes.Type(value = BoolType.class, name = "BoolType"),
    @JsonSubTypes.Type(value = VoidType.class, name = "VoidType"),
    @JsonSubTypes.Type(value = ClassType.class, name = "ClassType"),
    @JsonSubTypes.Type(value = ImmutableType.class, name = "ImmutableType"),
    @JsonSubTypes.Type(value = RefType.class, name = "RefType"),
    // Expressions
    @JsonSubTypes.Type(value = Id.class, name = "Id"),
    @JsonSubTypes.Type(value = IntLit.class, name = "IntLit"),
    @JsonSubTypes.Type(value = StrLit.class, name = "StrLit"),
    @JsonSubTypes.Type(value = BoolLit.class, name = "BoolLit"),
    @JsonSubTypes.Type(value = UnknownLit.class, name = "UnknownLit"),
    @JsonSubTypes.Type(value = CallExp.class, name = "CallExp"),
    @JsonSubTypes.Type(value = BinaryExp.class, name = "BinaryExp"),
    @JsonSubTypes.Type(value = UnaryExp.class, name = "UnaryExp"),
    // Statements
    @JsonSubTypes.Type(value = AssignStmt.class, name = "AssignStmt"),
    @JsonSubTypes.Type(value = CallStmt.class, name = "CallStmt"),
    @JsonSubTypes.Type(value = ReturnStmt.class, name = "ReturnStmt"),
    @JsonSubTypes.Type(value = MaybeStmt.class, name = "MaybeStmt"),
    @JsonSubTypes.Type(value = FromConsoleStmt.class, name = "FromConsoleStmt"),
    @JsonSubTypes.Type(value = ToConsoleStmt.class, name = "ToConsoleStmt"),
    @JsonSubTypes.Type(value = PostIncStmt.class, name = "PostIncStmt"),
    @JsonSubTypes.Type(value = PostDecStmt.class, name = "PostDecStmt"),
    @JsonSubTypes.Type(value = IfStmt.class, name = "IfStmt"),
    @JsonSubTypes.Type(value = IfElseStmt.class, name = "IfElseStmt"),
    @JsonSubTypes.Type(value = WhileStmt.class, name = "WhileStmt"),
})
public abstract class NodeMixin {
}
