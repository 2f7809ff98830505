package com.alang;

import com.alang.ast.Nodes;
import com.alang.ast.Program;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parsing the unparsed text of a tree gives back the same tree, and unparsing
 * canonical text is a fixed point.
 */
public class RoundTripTest {

    static Stream<String> programs() {
        return Stream.of(
            "",
            "x : int;",
            "flag : bool = !(1 < 2) or false;",
            "p : immutable ref Point;",
            "Pair : custom { a : int; b : ref Pair; swap : () -> void { } };",
            "Outer : custom { Inner : custom { depth : int = 1 - -1; }; };",
            "main : () -> void { toconsole \"hi\\n\"; }",
            "f : (a : int, b : bool) -> bool { return a >= 0 and b; }",
            "g : () -> int { x : int = 3 * (4 + 5) / 2; x--; x++; return -x; }",
            "h : (n : int) -> void { while (n != 0) { if (n == 1) { n = 0; } else { n = n - 1; } } }",
            "k : () -> void { maybe r means read(1, 2 + 3) otherwise eh?; fromconsole r; done(); return; }",
            "m : () -> bool { return 1 + 2 * 3 - 4 / 5 < 6 == 7 >= 8 and 9 <= 10 or 11 > 12 and !false; }"
        );
    }

    @ParameterizedTest
    @MethodSource("programs")
    void testReparsedTreeIsEquivalent(String source) {
        Program first = Parser.parse(source);
        Program second = Parser.parse(first.unparse());
        assertTrue(Nodes.structurallyEqual(first, second), () -> first.unparse());
    }

    @ParameterizedTest
    @MethodSource("programs")
    void testUnparseIsAFixedPoint(String source) {
        String canonical = Parser.parse(source).unparse();
        assertEquals(canonical, Parser.parse(canonical).unparse());
    }
}
