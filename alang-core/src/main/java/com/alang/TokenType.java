package com.alang;

/**
 * Token kinds of the A language.
 */
public enum TokenType {
    // Literals and names
    ID("identifier"),
    INTLITERAL("integer literal"),
    STRINGLITERAL("string literal"),

    // Keywords
    INT("int"),
    BOOL("bool"),
    VOID("void"),
    IMMUTABLE("immutable"),
    REF("ref"),
    CUSTOM("custom"),
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    RETURN("return"),
    MAYBE("maybe"),
    MEANS("means"),
    OTHERWISE("otherwise"),
    FROMCONSOLE("fromconsole"),
    TOCONSOLE("toconsole"),
    TRUE("true"),
    FALSE("false"),
    EH("eh?"),
    AND("and"),
    OR("or"),

    // Operators
    ASSIGN("="),
    EQUALS("=="),
    NOTEQUALS("!="),
    NOT("!"),
    LESS("<"),
    LESSEQ("<="),
    GREATER(">"),
    GREATEREQ(">="),
    CROSS("+"),
    POSTINC("++"),
    DASH("-"),
    POSTDEC("--"),
    ARROW("->"),
    STAR("*"),
    SLASH("/"),

    // Punctuation
    LPAREN("("),
    RPAREN(")"),
    LCURLY("{"),
    RCURLY("}"),
    COLON(":"),
    SEMICOL(";"),
    COMMA(","),

    END("end of input");

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /**
     * How the token kind is shown in diagnostics.
     */
    public String text() {
        return text;
    }
}
