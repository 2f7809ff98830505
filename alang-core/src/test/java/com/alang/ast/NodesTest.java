package com.alang.ast;

import com.alang.Parser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NodesTest {

    @Test
    void testSpansAreIgnored() {
        Program spaced = Parser.parse("x : int = 1 + 2;");
        Program packed = Parser.parse("\n\nx:int=1+2;");
        assertNotEquals(spaced, packed);
        assertTrue(Nodes.structurallyEqual(spaced, packed));
    }

    @Test
    void testValuesAreCompared() {
        assertFalse(Nodes.structurallyEqual(Parser.parseExpression("1 + 2"), Parser.parseExpression("1 - 2")));
        assertFalse(Nodes.structurallyEqual(Parser.parseExpression("a"), Parser.parseExpression("b")));
        assertFalse(Nodes.structurallyEqual(Parser.parseExpression("1"), Parser.parseExpression("2")));
    }

    @Test
    void testVariantsAreCompared() {
        assertFalse(Nodes.structurallyEqual(
            Parser.parse("f : () -> void { if (a) { } }"),
            Parser.parse("f : () -> void { while (a) { } }")));
        assertFalse(Nodes.structurallyEqual(Parser.parseType("int"), Parser.parseType("bool")));
    }

    @Test
    void testChildOrderAndCount() {
        assertFalse(Nodes.structurallyEqual(Parser.parseExpression("f(a, b)"), Parser.parseExpression("f(b, a)")));
        assertFalse(Nodes.structurallyEqual(Parser.parseExpression("f(a)"), Parser.parseExpression("f(a, a)")));
    }

    @Test
    void testMissingOptionalChild() {
        Id x = new Id(Span.NONE, "x");
        VarDecl bare = new VarDecl(Span.NONE, x, new IntType(Span.NONE));
        VarDecl initialized = new VarDecl(Span.NONE, x, new IntType(Span.NONE), new IntLit(Span.NONE, 0));
        assertFalse(Nodes.structurallyEqual(bare, initialized));
        assertTrue(Nodes.structurallyEqual(bare, new VarDecl(new Span(3, 4, 1, 4, 1, 5), x, new IntType(Span.NONE), null)));
    }

    @Test
    void testChildListsAreImmutable() {
        Program program = Parser.parse("x : int;");
        assertThrows(UnsupportedOperationException.class, () -> program.globals().add(program.globals().get(0)));
        assertThrows(NullPointerException.class,
            () -> new BinaryExp(Span.NONE, BinaryOp.PLUS, new IntLit(Span.NONE, 1), null));
    }
}
