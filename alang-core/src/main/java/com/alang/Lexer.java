package com.alang;

import com.alang.ast.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits A-language source text into tokens.
 */
public class Lexer {
    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("int", TokenType.INT),
        Map.entry("bool", TokenType.BOOL),
        Map.entry("void", TokenType.VOID),
        Map.entry("immutable", TokenType.IMMUTABLE),
        Map.entry("ref", TokenType.REF),
        Map.entry("custom", TokenType.CUSTOM),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("while", TokenType.WHILE),
        Map.entry("return", TokenType.RETURN),
        Map.entry("maybe", TokenType.MAYBE),
        Map.entry("means", TokenType.MEANS),
        Map.entry("otherwise", TokenType.OTHERWISE),
        Map.entry("fromconsole", TokenType.FROMCONSOLE),
        Map.entry("toconsole", TokenType.TOCONSOLE),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("and", TokenType.AND),
        Map.entry("or", TokenType.OR)
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    // Start of the token being scanned
    private int startPos;
    private int startLine;
    private int startCol;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Scans the whole source. The returned list always ends with an
     * {@link TokenType#END} token.
     *
     * @throws LexerException on the first character sequence that is not a token
     */
    public List<Token> tokenize() {
        while (true) {
            skipWhitespaceAndComments();
            startPos = pos;
            startLine = line;
            startCol = col;
            if (isAtEnd()) break;

            char c = advance();
            switch (c) {
                case '(' -> add(TokenType.LPAREN);
                case ')' -> add(TokenType.RPAREN);
                case '{' -> add(TokenType.LCURLY);
                case '}' -> add(TokenType.RCURLY);
                case ':' -> add(TokenType.COLON);
                case ';' -> add(TokenType.SEMICOL);
                case ',' -> add(TokenType.COMMA);
                case '*' -> add(TokenType.STAR);
                case '/' -> add(TokenType.SLASH);
                case '+' -> add(match('+') ? TokenType.POSTINC : TokenType.CROSS);
                case '-' -> {
                    if (match('-')) {
                        add(TokenType.POSTDEC);
                    } else if (match('>')) {
                        add(TokenType.ARROW);
                    } else {
                        add(TokenType.DASH);
                    }
                }
                case '=' -> add(match('=') ? TokenType.EQUALS : TokenType.ASSIGN);
                case '!' -> add(match('=') ? TokenType.NOTEQUALS : TokenType.NOT);
                case '<' -> add(match('=') ? TokenType.LESSEQ : TokenType.LESS);
                case '>' -> add(match('=') ? TokenType.GREATEREQ : TokenType.GREATER);
                case '"' -> string();
                default -> {
                    if (isDigit(c)) {
                        number();
                    } else if (isIdentStart(c)) {
                        identifier();
                    } else {
                        throw error("unexpected character '" + c + "'");
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.END, "", null, pos, pos, line, col, line, col));
        LOG.trace("Scanned {} tokens", tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private void number() {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        String text = source.substring(startPos, pos);
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw error("integer literal " + text + " is out of range");
        }
        add(TokenType.INTLITERAL, value);
    }

    private void identifier() {
        while (!isAtEnd() && isIdentPart(peek())) {
            advance();
        }
        String text = source.substring(startPos, pos);
        if (text.equals("eh") && !isAtEnd() && peek() == '?') {
            advance();
            add(TokenType.EH);
            return;
        }
        TokenType keyword = KEYWORDS.get(text);
        if (keyword != null) {
            add(keyword);
        } else {
            add(TokenType.ID, text);
        }
    }

    private void string() {
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw error("unterminated string literal");
            }
            char c = advance();
            if (c == '"') break;
            if (c == '\\') {
                if (isAtEnd()) {
                    throw error("unterminated string literal");
                }
                char escaped = advance();
                if (escaped != 'n' && escaped != 't' && escaped != '"' && escaped != '\\') {
                    throw error("invalid escape sequence '\\" + escaped + "'");
                }
            }
        }
        add(TokenType.STRINGLITERAL, source.substring(startPos, pos));
    }

    private void add(TokenType type) {
        add(type, null);
    }

    private void add(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(startPos, pos), literal, startPos, pos, startLine, startCol, line, col));
    }

    private LexerException error(String message) {
        return new LexerException(message, new Span(startPos, pos, startLine, startCol, line, col));
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
