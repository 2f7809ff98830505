package com.alang;

import com.alang.ast.*;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UnparserTest {

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private static final String CANONICAL = lines(
        "Point : custom {",
        "\tx: int;",
        "\ty: int;",
        "\tlen : () -> int {",
        "\t\treturn (x * x) + (y * y);",
        "\t}",
        "};",
        "counter: int = 0;",
        "compute : (a : int, b : ref int) -> int {",
        "\ttotal: int = 0;",
        "\tcount: int = a;",
        "\tdone: bool = false;",
        "\twhile ((count > 0) and (!done)){",
        "\t\ttotal = total + (count * 2);",
        "\t\tcount--;",
        "\t\tif (total > 100){",
        "\t\t\tdone = true;",
        "\t\t} else {",
        "\t\t\ttoconsole \"looping\";",
        "\t\t}",
        "\t}",
        "\tmaybe total means compute(1, total) otherwise eh?;",
        "\tfromconsole counter;",
        "\tcounter++;",
        "\treport(total, \"done\");",
        "\tif (!(counter == 0)){",
        "\t\treturn;",
        "\t}",
        "\treturn total;",
        "}");

    private static final Span NO_SPAN = Span.NONE;

    private static Id id(String name) {
        return new Id(NO_SPAN, name);
    }

    @Test
    void testCanonicalProgramIsReproduced() {
        assertEquals(CANONICAL, Parser.parse(CANONICAL).unparse());
    }

    @Test
    void testLayoutIsNormalized() {
        String messy = """
            Point:custom{x:int;y:int;len:()->int{return x*x+y*y;}};
            counter : int = 0;   // global
            compute : ( a : int , b : ref int ) -> int {
              total : int = 0; count : int = a; done : bool = false;
              while (count > 0 and !done) {
                total = total + count * 2; count--;
                if (total > 100) { done = true; } else { toconsole "looping"; }
              }
              maybe total means compute(1, total) otherwise eh?;
              fromconsole counter; counter++; report(total, "done");
              if (!(counter == 0)) { return; }
              return total;
            }
            """;
        assertEquals(CANONICAL, Parser.parse(messy).unparse());
    }

    @Test
    void testIndentOfNestedDeclarations() {
        ClassDecl cls = new ClassDecl(NO_SPAN, id("C"), List.of(
            new VarDecl(NO_SPAN, id("v"), new RefType(NO_SPAN, new ClassType(NO_SPAN, id("C"))))));
        StringBuilder out = new StringBuilder();
        try {
            Unparser.unparse(cls, out, 2);
        } catch (IOException e) {
            fail(e);
        }
        assertEquals("\t\tC : custom {\n\t\t\tv: ref C;\n\t\t};\n", out.toString());
    }

    @Test
    void testNoIndentStatementForms() throws IOException {
        CallStmt call = new CallStmt(NO_SPAN, new CallExp(NO_SPAN, id("f"), List.of(new IntLit(NO_SPAN, 1))));
        MaybeStmt maybe = new MaybeStmt(NO_SPAN, id("x"), new IntLit(NO_SPAN, 1), new UnknownLit(NO_SPAN));
        PostIncStmt inc = new PostIncStmt(NO_SPAN, id("i"));
        PostDecStmt dec = new PostDecStmt(NO_SPAN, id("j"));

        StringBuilder out = new StringBuilder();
        call.unparse(out, Unparser.NO_INDENT);
        out.append('|');
        maybe.unparse(out, Unparser.NO_INDENT);
        out.append('|');
        inc.unparse(out, Unparser.NO_INDENT);
        out.append('|');
        dec.unparse(out, Unparser.NO_INDENT);

        assertEquals("f(1)|maybe x means 1 otherwise eh?|i++|j--", out.toString());
        assertEquals("\ti++;\n", indented(inc, 1));
        assertEquals("f(1);\n", indented(call, 0));
    }

    private static String indented(Node node, int indent) throws IOException {
        StringBuilder out = new StringBuilder();
        node.unparse(out, indent);
        return out.toString();
    }

    @Test
    void testOperandsOfOperatorsAreParenthesized() {
        Expression negNeg = new UnaryExp(NO_SPAN, UnaryOp.NEGATE, new UnaryExp(NO_SPAN, UnaryOp.NEGATE, id("x")));
        assertEquals("-(-x)", negNeg.unparse());

        Expression notSum = new UnaryExp(NO_SPAN, UnaryOp.NOT,
            new BinaryExp(NO_SPAN, BinaryOp.PLUS, id("a"), id("b")));
        assertEquals("!(a + b)", notSum.unparse());

        assertEquals("(1 - 2) - 3", Parser.parseExpression("1 - 2 - 3").unparse());
        assertEquals("1 - (2 - 3)", Parser.parseExpression("1 - (2 - 3)").unparse());
        assertEquals("f(x + 1) / g()", Parser.parseExpression("f(x+1)/g()").unparse());
        assertEquals("(a or b) and c", Parser.parseExpression("(a or b) and c").unparse());
    }

    @Test
    void testLiterals() {
        assertEquals("\"tab\\there\"", Parser.parseExpression("\"tab\\there\"").unparse());
        assertEquals("-7", Parser.parseExpression("-7").unparse());
        assertEquals("true != false", Parser.parseExpression("true != false").unparse());
    }

    @Test
    void testTypes() {
        assertEquals("immutable ref int", new ImmutableType(NO_SPAN, new RefType(NO_SPAN, new IntType(NO_SPAN))).unparse());
        assertEquals("void", new VoidType(NO_SPAN).unparse());
        assertEquals("bool", new BoolType(NO_SPAN).unparse());
    }

    @Test
    void testDeclarationSpacing() {
        // Variables use "name: type", formals and functions "name : type"
        assertEquals("n: int;\nm: bool = true;\n", Parser.parse("n : int; m:bool=true;").unparse());
        assertEquals("g : (a : int) -> void {\n\ta: ref int;\n}\n",
            Parser.parse("g : (a : int) -> void { a : ref int; }").unparse());
    }

    @Test
    void testBlockHeaders() {
        assertEquals(lines("f : () -> void {", "\twhile (i < 3){", "\t\tif (b){", "\t\t\ti++;", "\t\t}", "\t}", "}"),
            Parser.parse("f : () -> void { while (i < 3) { if (b) { i++; } } }").unparse());
    }

    @Test
    void testEmptyBodies() {
        assertEquals("E : custom {\n};\n", Parser.parse("E : custom {};").unparse());
        assertEquals(lines("f : () -> void {", "\tif (x){", "\t} else {", "\t}", "\twhile (y){", "\t}", "}"),
            Parser.parse("f : () -> void { if (x) {} else {} while (y) {} }").unparse());
    }

    @Test
    void testWriterFailuresPropagate() {
        Appendable failing = new Appendable() {
            @Override
            public Appendable append(CharSequence csq) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public Appendable append(CharSequence csq, int start, int end) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public Appendable append(char c) throws IOException {
                throw new IOException("disk full");
            }
        };
        Program program = Parser.parse("x : int;");
        IOException e = assertThrows(IOException.class, () -> Unparser.unparse(program, failing, 0));
        assertEquals("disk full", e.getMessage());
    }
}
