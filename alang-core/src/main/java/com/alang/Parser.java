package com.alang;

import com.alang.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the A language.
 *
 * <p>Declarations and statements are parsed by one method per production;
 * binary expressions go through a single binding-power loop
 * ({@link #parseExpr(int)}). Parsing is fail-fast: the first token that does
 * not fit the grammar raises a {@link SyntaxException} and no tree is returned.</p>
 *
 * <p>A parser instance consumes its token list once and is not thread-safe;
 * separate instances share nothing but immutable token sets.</p>
 */
public class Parser {
    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    // ========================================================================
    // Binding powers, higher binds tighter. All binary operators are
    // left-associative, so the right operand is parsed at lbp + 1.
    // ========================================================================
    private static final int BP_NONE = 0;
    private static final int BP_OR = 1;
    private static final int BP_AND = 2;
    private static final int BP_EQUALITY = 3;       // ==, !=
    private static final int BP_RELATIONAL = 4;     // <, <=, >, >=
    private static final int BP_ADDITIVE = 5;       // +, -
    private static final int BP_MULTIPLICATIVE = 6; // *, /
    private static final int BP_UNARY = 7;          // prefix -, !

    // ========================================================================
    // FIRST sets used to choose productions and to report expected tokens
    // ========================================================================
    private static final Set<TokenType> TYPE_START = Collections.unmodifiableSet(EnumSet.of(
        TokenType.INT, TokenType.BOOL, TokenType.VOID, TokenType.IMMUTABLE, TokenType.REF, TokenType.ID));

    private static final Set<TokenType> EXPRESSION_START = Collections.unmodifiableSet(EnumSet.of(
        TokenType.INTLITERAL, TokenType.STRINGLITERAL, TokenType.TRUE, TokenType.FALSE, TokenType.EH,
        TokenType.ID, TokenType.DASH, TokenType.NOT, TokenType.LPAREN));

    private static final Set<TokenType> STATEMENT_START = Collections.unmodifiableSet(EnumSet.of(
        TokenType.ID, TokenType.RETURN, TokenType.MAYBE, TokenType.FROMCONSOLE, TokenType.TOCONSOLE,
        TokenType.IF, TokenType.WHILE));

    // Tokens that may follow an identifier at the start of a statement
    private static final Set<TokenType> AFTER_STATEMENT_ID = Collections.unmodifiableSet(EnumSet.of(
        TokenType.COLON, TokenType.ASSIGN, TokenType.LPAREN, TokenType.POSTINC, TokenType.POSTDEC));

    private static final Set<TokenType> BINARY_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
        TokenType.OR, TokenType.AND, TokenType.EQUALS, TokenType.NOTEQUALS,
        TokenType.LESS, TokenType.LESSEQ, TokenType.GREATER, TokenType.GREATEREQ,
        TokenType.CROSS, TokenType.DASH, TokenType.STAR, TokenType.SLASH));

    private final List<Token> tokens;
    private int current = 0;

    // Index of the token right after the most recently completed expression,
    // so that errors at that point can also offer the binary operators.
    private int lastExpressionEnd = -1;
    private boolean lastExpressionWasLocation = false;

    // Set when the most recently parsed term is a bare name, which a '(' could
    // still turn into a call.
    private boolean lastTermWasLocation = false;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END) {
            throw new IllegalArgumentException("Token stream must be terminated by an END token");
        }
        this.tokens = List.copyOf(tokens);
    }

    public Program parse() {
        LOG.debug("Parsing program from {} tokens", tokens.size());
        List<Declaration> globals = new ArrayList<>();
        while (!check(TokenType.END)) {
            if (!check(TokenType.ID)) {
                throw error(EnumSet.of(TokenType.ID, TokenType.END));
            }
            globals.add(parseDeclaration());
        }

        Span span = globals.isEmpty()
            ? Span.emptyAt(peek().span())
            : Span.covering(globals.get(0).span(), globals.get(globals.size() - 1).span());
        LOG.debug("Parsed program with {} global declarations", globals.size());
        return new Program(span, globals);
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    /**
     * decl := varDecl | classDecl | fnDecl, all of which start with {@code name ':'}.
     */
    private Declaration parseDeclaration() {
        Id name = parseId();
        consume(TokenType.COLON);

        if (check(TokenType.CUSTOM)) {
            return parseClassDeclRest(name);
        }
        if (check(TokenType.LPAREN)) {
            return parseFnDeclRest(name);
        }
        if (TYPE_START.contains(peek().type())) {
            return parseVarDeclRest(name);
        }
        throw error(union(TYPE_START, TokenType.CUSTOM, TokenType.LPAREN));
    }

    // varDecl := name ':' type ('=' exp)? ';'
    private VarDecl parseVarDeclRest(Id name) {
        Type type = parseType();
        Expression init = null;
        if (match(TokenType.ASSIGN)) {
            init = parseExpression();
            consume(TokenType.SEMICOL);
        } else if (!match(TokenType.SEMICOL)) {
            throw error(EnumSet.of(TokenType.ASSIGN, TokenType.SEMICOL));
        }
        return new VarDecl(spanFrom(name.span()), name, type, init);
    }

    // classDecl := name ':' 'custom' '{' decl* '}' ';'
    private ClassDecl parseClassDeclRest(Id name) {
        consume(TokenType.CUSTOM);
        consume(TokenType.LCURLY);
        List<Declaration> members = new ArrayList<>();
        while (!check(TokenType.RCURLY)) {
            if (!check(TokenType.ID)) {
                throw error(EnumSet.of(TokenType.ID, TokenType.RCURLY));
            }
            members.add(parseDeclaration());
        }
        consume(TokenType.RCURLY);
        consume(TokenType.SEMICOL);
        return new ClassDecl(spanFrom(name.span()), name, members);
    }

    // fnDecl := name ':' '(' formalList? ')' '->' type '{' stmt* '}'
    private FnDecl parseFnDeclRest(Id name) {
        consume(TokenType.LPAREN);
        List<FormalDecl> formals = new ArrayList<>();
        if (check(TokenType.ID)) {
            formals.add(parseFormal());
            while (match(TokenType.COMMA)) {
                formals.add(parseFormal());
            }
            if (!match(TokenType.RPAREN)) {
                throw error(EnumSet.of(TokenType.COMMA, TokenType.RPAREN));
            }
        } else if (!match(TokenType.RPAREN)) {
            throw error(EnumSet.of(TokenType.ID, TokenType.RPAREN));
        }
        consume(TokenType.ARROW);
        Type returnType = parseType();
        List<Statement> body = parseBlock();
        return new FnDecl(spanFrom(name.span()), name, formals, returnType, body);
    }

    // formalDecl := name ':' type
    private FormalDecl parseFormal() {
        Id name = parseId();
        consume(TokenType.COLON);
        Type type = parseType();
        return new FormalDecl(spanFrom(name.span()), name, type);
    }

    // ========================================================================
    // Types
    // ========================================================================

    /**
     * type := 'ref' type | 'immutable' type | 'int' | 'bool' | 'void' | name
     */
    private Type parseType() {
        Token token = peek();
        switch (token.type()) {
            case REF -> {
                advance();
                Type inner = parseType();
                return new RefType(spanFrom(token.span()), inner);
            }
            case IMMUTABLE -> {
                advance();
                Type inner = parseType();
                return new ImmutableType(spanFrom(token.span()), inner);
            }
            case INT -> {
                advance();
                return new IntType(token.span());
            }
            case BOOL -> {
                advance();
                return new BoolType(token.span());
            }
            case VOID -> {
                advance();
                return new VoidType(token.span());
            }
            case ID -> {
                Id name = parseId();
                return new ClassType(name.span(), name);
            }
            default -> throw error(TYPE_START);
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    // '{' stmt* '}'
    private List<Statement> parseBlock() {
        consume(TokenType.LCURLY);
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RCURLY)) {
            if (!STATEMENT_START.contains(peek().type())) {
                throw error(union(STATEMENT_START, TokenType.RCURLY));
            }
            statements.add(parseStatement());
        }
        consume(TokenType.RCURLY);
        return statements;
    }

    private Statement parseStatement() {
        Token start = peek();
        return switch (start.type()) {
            case ID -> parseIdStatement();
            case RETURN -> parseReturn();
            case MAYBE -> {
                advance();
                Location dst = parseId();
                consume(TokenType.MEANS);
                Expression primary = parseExpression();
                consume(TokenType.OTHERWISE);
                Expression fallback = parseExpression();
                consume(TokenType.SEMICOL);
                yield new MaybeStmt(spanFrom(start.span()), dst, primary, fallback);
            }
            case FROMCONSOLE -> {
                advance();
                Location dst = parseId();
                consume(TokenType.SEMICOL);
                yield new FromConsoleStmt(spanFrom(start.span()), dst);
            }
            case TOCONSOLE -> {
                advance();
                Expression src = parseExpression();
                consume(TokenType.SEMICOL);
                yield new ToConsoleStmt(spanFrom(start.span()), src);
            }
            case IF -> parseIf();
            case WHILE -> {
                advance();
                Expression cond = parseCondition();
                List<Statement> body = parseBlock();
                yield new WhileStmt(spanFrom(start.span()), cond, body);
            }
            default -> throw error(STATEMENT_START);
        };
    }

    /**
     * Statements that begin with a name: a local declaration, an assignment,
     * a call, or a post-increment/decrement. The token after the name decides.
     */
    private Statement parseIdStatement() {
        Token next = tokens.get(current + 1);
        switch (next.type()) {
            case COLON -> {
                Id name = parseId();
                consume(TokenType.COLON);
                return parseVarDeclRest(name);
            }
            case ASSIGN -> {
                Id dst = parseId();
                advance();
                Expression src = parseExpression();
                consume(TokenType.SEMICOL);
                return new AssignStmt(spanFrom(dst.span()), dst, src);
            }
            case LPAREN -> {
                CallExp call = parseCallRest(parseId());
                consume(TokenType.SEMICOL);
                return new CallStmt(spanFrom(call.span()), call);
            }
            case POSTINC -> {
                Id loc = parseId();
                advance();
                consume(TokenType.SEMICOL);
                return new PostIncStmt(spanFrom(loc.span()), loc);
            }
            case POSTDEC -> {
                Id loc = parseId();
                advance();
                consume(TokenType.SEMICOL);
                return new PostDecStmt(spanFrom(loc.span()), loc);
            }
            default -> {
                advance();
                throw error(AFTER_STATEMENT_ID);
            }
        }
    }

    // 'return' exp? ';'
    private ReturnStmt parseReturn() {
        Token start = advance();
        Expression value = null;
        if (EXPRESSION_START.contains(peek().type())) {
            value = parseExpression();
            consume(TokenType.SEMICOL);
        } else if (!match(TokenType.SEMICOL)) {
            throw error(union(EXPRESSION_START, TokenType.SEMICOL));
        }
        return new ReturnStmt(spanFrom(start.span()), value);
    }

    // 'if' '(' exp ')' block ('else' block)?
    private Statement parseIf() {
        Token start = advance();
        Expression cond = parseCondition();
        List<Statement> trueBody = parseBlock();
        if (match(TokenType.ELSE)) {
            List<Statement> falseBody = parseBlock();
            return new IfElseStmt(spanFrom(start.span()), cond, trueBody, falseBody);
        }
        return new IfStmt(spanFrom(start.span()), cond, trueBody);
    }

    // '(' exp ')'
    private Expression parseCondition() {
        consume(TokenType.LPAREN);
        Expression cond = parseExpression();
        consume(TokenType.RPAREN);
        return cond;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpression() {
        return parseExpr(BP_NONE);
    }

    /**
     * Parses an expression whose binary operators all bind at least as tightly as
     * {@code minBp}: a prefix term followed by any number of infix operators.
     */
    private Expression parseExpr(int minBp) {
        Token startToken = peek();
        Expression left = parsePrefix();

        while (true) {
            BinaryOp op = binaryOp(peek().type());
            if (op == null) {
                break;
            }
            int lbp = bindingPower(op);
            if (lbp < minBp) {
                break;
            }
            advance();
            Expression right = parseExpr(lbp + 1);
            left = new BinaryExp(spanFrom(startToken.span()), op, left, right);
        }

        lastExpressionEnd = current;
        lastExpressionWasLocation = lastTermWasLocation;
        return left;
    }

    private Expression parsePrefix() {
        Token token = peek();
        lastTermWasLocation = false;
        switch (token.type()) {
            case INTLITERAL -> {
                advance();
                return new IntLit(token.span(), (Integer) token.literal());
            }
            case STRINGLITERAL -> {
                advance();
                return new StrLit(token.span(), (String) token.literal());
            }
            case TRUE, FALSE -> {
                advance();
                return new BoolLit(token.span(), token.type() == TokenType.TRUE);
            }
            case EH -> {
                advance();
                return new UnknownLit(token.span());
            }
            case ID -> {
                Id id = parseId();
                if (check(TokenType.LPAREN)) {
                    CallExp call = parseCallRest(id);
                    lastTermWasLocation = false;
                    return call;
                }
                lastTermWasLocation = true;
                return id;
            }
            case DASH, NOT -> {
                advance();
                Expression operand = parseExpr(BP_UNARY);
                UnaryOp op = token.type() == TokenType.DASH ? UnaryOp.NEGATE : UnaryOp.NOT;
                return new UnaryExp(spanFrom(token.span()), op, operand);
            }
            case LPAREN -> {
                advance();
                Expression inner = parseExpression();
                consume(TokenType.RPAREN);
                lastTermWasLocation = false;
                return inner;
            }
            default -> throw error(EXPRESSION_START);
        }
    }

    // callExp := loc '(' (exp (',' exp)*)? ')'
    private CallExp parseCallRest(Location callee) {
        consume(TokenType.LPAREN);
        List<Expression> args = new ArrayList<>();
        if (EXPRESSION_START.contains(peek().type())) {
            args.add(parseExpression());
            while (match(TokenType.COMMA)) {
                args.add(parseExpression());
            }
            if (!check(TokenType.RPAREN)) {
                throw error(EnumSet.of(TokenType.COMMA, TokenType.RPAREN));
            }
        } else if (!check(TokenType.RPAREN)) {
            throw error(union(EXPRESSION_START, TokenType.RPAREN));
        }
        advance();
        return new CallExp(spanFrom(callee.span()), callee, args);
    }

    private Id parseId() {
        Token token = consume(TokenType.ID);
        return new Id(token.span(), (String) token.literal());
    }

    private static BinaryOp binaryOp(TokenType type) {
        return switch (type) {
            case OR -> BinaryOp.OR;
            case AND -> BinaryOp.AND;
            case EQUALS -> BinaryOp.EQUALS;
            case NOTEQUALS -> BinaryOp.NOT_EQUALS;
            case LESS -> BinaryOp.LESS;
            case LESSEQ -> BinaryOp.LESS_EQ;
            case GREATER -> BinaryOp.GREATER;
            case GREATEREQ -> BinaryOp.GREATER_EQ;
            case CROSS -> BinaryOp.PLUS;
            case DASH -> BinaryOp.MINUS;
            case STAR -> BinaryOp.TIMES;
            case SLASH -> BinaryOp.DIVIDE;
            default -> null;
        };
    }

    private static int bindingPower(BinaryOp op) {
        return switch (op) {
            case OR -> BP_OR;
            case AND -> BP_AND;
            case EQUALS, NOT_EQUALS -> BP_EQUALITY;
            case LESS, LESS_EQ, GREATER, GREATER_EQ -> BP_RELATIONAL;
            case PLUS, MINUS -> BP_ADDITIVE;
            case TIMES, DIVIDE -> BP_MULTIPLICATIVE;
        };
    }

    // Helper methods

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error(EnumSet.of(type));
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.END) current++;
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    /**
     * Span from {@code start} to the end of the last consumed token.
     */
    private Span spanFrom(Span start) {
        return Span.covering(start, previous().span());
    }

    private SyntaxException error(Set<TokenType> expected) {
        EnumSet<TokenType> accepted = EnumSet.copyOf(expected);
        if (current == lastExpressionEnd) {
            accepted.addAll(BINARY_OPERATORS);
            if (lastExpressionWasLocation) {
                accepted.add(TokenType.LPAREN);
            }
        }
        Token found = peek();
        Span span = found.type() == TokenType.END && current > 0
            ? Span.emptyAfter(previous().span())
            : found.span();
        SyntaxException e = new SyntaxException(found, span, accepted);
        LOG.debug("Parse failed: {}", e.getMessage());
        return e;
    }

    private static Set<TokenType> union(Set<TokenType> base, TokenType... more) {
        EnumSet<TokenType> result = EnumSet.copyOf(base);
        Collections.addAll(result, more);
        return result;
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public static Program parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    public static Program parse(String source) {
        return parse(new Lexer(source).tokenize());
    }

    /**
     * Parses {@code source} as a single type followed by end of input.
     */
    public static Type parseType(String source) {
        Parser parser = new Parser(new Lexer(source).tokenize());
        Type type = parser.parseType();
        parser.consume(TokenType.END);
        return type;
    }

    /**
     * Parses {@code source} as a single expression followed by end of input.
     */
    public static Expression parseExpression(String source) {
        Parser parser = new Parser(new Lexer(source).tokenize());
        Expression expression = parser.parseExpression();
        parser.consume(TokenType.END);
        return expression;
    }
}
