package com.alang;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(Token::type).toList();
    }

    @Test
    void testOperatorsAndPunctuation() {
        assertEquals(List.of(
                TokenType.POSTINC, TokenType.CROSS, TokenType.ARROW, TokenType.POSTDEC, TokenType.DASH,
                TokenType.EQUALS, TokenType.ASSIGN, TokenType.NOTEQUALS, TokenType.NOT,
                TokenType.LESSEQ, TokenType.LESS, TokenType.GREATEREQ, TokenType.GREATER,
                TokenType.STAR, TokenType.SLASH, TokenType.LPAREN, TokenType.RPAREN,
                TokenType.LCURLY, TokenType.RCURLY, TokenType.COLON, TokenType.SEMICOL, TokenType.COMMA,
                TokenType.END),
            types("++ + -> -- - == = != ! <= < >= > * / ( ) { } : ; ,"));
    }

    @Test
    void testKeywordsAndIdentifiers() {
        assertEquals(List.of(
                TokenType.INT, TokenType.BOOL, TokenType.VOID, TokenType.IMMUTABLE, TokenType.REF,
                TokenType.CUSTOM, TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.RETURN,
                TokenType.MAYBE, TokenType.MEANS, TokenType.OTHERWISE, TokenType.FROMCONSOLE,
                TokenType.TOCONSOLE, TokenType.TRUE, TokenType.FALSE, TokenType.AND, TokenType.OR,
                TokenType.EH, TokenType.ID, TokenType.ID, TokenType.END),
            types("int bool void immutable ref custom if else while return maybe means otherwise "
                + "fromconsole toconsole true false and or eh? eh integer"));
    }

    @Test
    void testLiteralPayloads() {
        List<Token> tokens = new Lexer("count 42 \"a\\tb\"").tokenize();

        assertEquals("count", tokens.get(0).literal());
        assertEquals(42, tokens.get(1).literal());
        assertEquals("\"a\\tb\"", tokens.get(2).literal());
        assertNull(tokens.get(3).literal());
    }

    @Test
    void testPositions() {
        List<Token> tokens = new Lexer("x : int;\n  y++;").tokenize();

        Token x = tokens.get(0);
        assertEquals(0, x.position());
        assertEquals(1, x.endPosition());
        assertEquals(1, x.line());
        assertEquals(1, x.column());

        Token y = tokens.get(4);
        assertEquals("y", y.lexeme());
        assertEquals(11, y.position());
        assertEquals(2, y.line());
        assertEquals(3, y.column());

        Token inc = tokens.get(5);
        assertEquals(TokenType.POSTINC, inc.type());
        assertEquals(2, inc.line());
        assertEquals(4, inc.column());
        assertEquals(6, inc.endColumn());

        Token end = tokens.get(tokens.size() - 1);
        assertEquals(TokenType.END, end.type());
        assertEquals(15, end.position());
        assertEquals(end.position(), end.endPosition());
    }

    @Test
    void testCommentsAreSkipped() {
        assertEquals(List.of(TokenType.ID, TokenType.SEMICOL, TokenType.ID, TokenType.END),
            types("a; // trailing comment\n// whole line\nb"));
    }

    @Test
    void testSlashIsStillDivision() {
        assertEquals(List.of(TokenType.ID, TokenType.SLASH, TokenType.ID, TokenType.END), types("a / b"));
    }

    @Test
    void testEmptySource() {
        assertEquals(List.of(TokenType.END), types(""));
        assertEquals(List.of(TokenType.END), types("   \n\t// nothing\n"));
    }

    @Test
    void testUnexpectedCharacter() {
        LexerException e = assertThrows(LexerException.class, () -> new Lexer("x : int;\n@").tokenize());
        assertEquals(2, e.getSpan().startLine());
        assertEquals(1, e.getSpan().startCol());
        assertTrue(e.getMessage().contains("'@'"), e.getMessage());
    }

    @Test
    void testQuestionMarkNeedsEh() {
        assertThrows(LexerException.class, () -> new Lexer("eh ?").tokenize());
    }

    @Test
    void testUnterminatedString() {
        LexerException e = assertThrows(LexerException.class, () -> new Lexer("toconsole \"abc\n\";").tokenize());
        assertEquals(10, e.getSpan().start());
        assertTrue(e.getMessage().contains("unterminated"), e.getMessage());
    }

    @Test
    void testInvalidEscape() {
        assertThrows(LexerException.class, () -> new Lexer("\"a\\qb\"").tokenize());
    }

    @Test
    void testIntegerOutOfRange() {
        assertEquals(2147483647, new Lexer("2147483647").tokenize().get(0).literal());
        assertThrows(LexerException.class, () -> new Lexer("2147483648").tokenize());
    }
}
