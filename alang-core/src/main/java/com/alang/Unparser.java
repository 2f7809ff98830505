package com.alang;

import com.alang.ast.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Writes canonical A-language source text for an AST.
 *
 * <p>Blocks are indented one tab per nesting level. Operands of operators are
 * parenthesized unless they are literals, identifiers or calls, so the output
 * never depends on operator precedence.</p>
 */
public final class Unparser {

    /**
     * Indent value that renders call, maybe and post-increment/decrement
     * statements without indentation and without the trailing {@code ";\n"}.
     */
    public static final int NO_INDENT = -1;

    private static final String INDENT_UNIT = "\t";

    private Unparser() {
        // Utility class
    }

    public static String unparse(Node node) {
        StringBuilder out = new StringBuilder();
        try {
            unparse(node, out, 0);
        } catch (IOException e) {
            // StringBuilder never throws
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Writes {@code node} at nesting depth {@code indent}. I/O failures of
     * {@code out} are propagated as is.
     */
    public static void unparse(Node node, Appendable out, int indent) throws IOException {
        if (node instanceof Program program) {
            for (Declaration global : program.globals()) {
                unparse(global, out, indent);
            }
        } else if (node instanceof Declaration decl) {
            unparseDeclaration(decl, out, indent);
        } else if (node instanceof Statement stmt) {
            unparseStatement(stmt, out, indent);
        } else if (node instanceof Type type) {
            unparseType(type, out);
        } else if (node instanceof Expression exp) {
            unparseExpression(exp, out);
        } else {
            throw new IllegalArgumentException("Unknown node: " + node.getClass().getName());
        }
    }

    private static void doIndent(Appendable out, int indent) throws IOException {
        for (int k = 0; k < indent; k++) {
            out.append(INDENT_UNIT);
        }
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private static void unparseDeclaration(Declaration decl, Appendable out, int indent) throws IOException {
        if (decl instanceof VarDecl varDecl) {
            unparseVarDecl(varDecl, out, indent);
        } else if (decl instanceof FormalDecl formal) {
            doIndent(out, indent);
            out.append(formal.name().name()).append(" : ");
            unparseType(formal.type(), out);
        } else if (decl instanceof FnDecl fn) {
            doIndent(out, indent);
            out.append(fn.name().name()).append(" : (");
            boolean firstFormal = true;
            for (FormalDecl formal : fn.formals()) {
                if (firstFormal) {
                    firstFormal = false;
                } else {
                    out.append(", ");
                }
                unparseDeclaration(formal, out, 0);
            }
            out.append(") -> ");
            unparseType(fn.returnType(), out);
            out.append(" {\n");
            unparseBody(fn.body(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
        } else if (decl instanceof ClassDecl cls) {
            doIndent(out, indent);
            out.append(cls.name().name()).append(" : custom {\n");
            for (Declaration member : cls.members()) {
                unparseDeclaration(member, out, indent + 1);
            }
            doIndent(out, indent);
            out.append("};\n");
        }
    }

    private static void unparseVarDecl(VarDecl varDecl, Appendable out, int indent) throws IOException {
        doIndent(out, indent);
        out.append(varDecl.name().name()).append(": ");
        unparseType(varDecl.type(), out);
        if (varDecl.init() != null) {
            out.append(" = ");
            unparseExpression(varDecl.init(), out);
        }
        out.append(";\n");
    }

    private static void unparseBody(List<Statement> body, Appendable out, int indent) throws IOException {
        for (Statement stmt : body) {
            unparseStatement(stmt, out, indent);
        }
    }

    // ========================================================================
    // Types
    // ========================================================================

    private static void unparseType(Type type, Appendable out) throws IOException {
        if (type instanceof IntType) {
            out.append("int");
        } else if (type instanceof BoolType) {
            out.append("bool");
        } else if (type instanceof VoidType) {
            out.append("void");
        } else if (type instanceof ClassType cls) {
            out.append(cls.name().name());
        } else if (type instanceof ImmutableType immutable) {
            out.append("immutable ");
            unparseType(immutable.inner(), out);
        } else if (type instanceof RefType ref) {
            out.append("ref ");
            unparseType(ref.inner(), out);
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private static void unparseStatement(Statement stmt, Appendable out, int indent) throws IOException {
        if (stmt instanceof VarDecl varDecl) {
            unparseVarDecl(varDecl, out, indent);
        } else if (stmt instanceof AssignStmt assign) {
            doIndent(out, indent);
            unparseExpression(assign.dst(), out);
            out.append(" = ");
            unparseExpression(assign.src(), out);
            out.append(";\n");
        } else if (stmt instanceof CallStmt call) {
            if (indent != NO_INDENT) doIndent(out, indent);
            unparseExpression(call.call(), out);
            if (indent != NO_INDENT) out.append(";\n");
        } else if (stmt instanceof ReturnStmt ret) {
            doIndent(out, indent);
            out.append("return");
            if (ret.value() != null) {
                out.append(" ");
                unparseExpression(ret.value(), out);
            }
            out.append(";\n");
        } else if (stmt instanceof MaybeStmt maybe) {
            if (indent != NO_INDENT) doIndent(out, indent);
            out.append("maybe ");
            unparseExpression(maybe.dst(), out);
            out.append(" means ");
            unparseExpression(maybe.primary(), out);
            out.append(" otherwise ");
            unparseExpression(maybe.fallback(), out);
            if (indent != NO_INDENT) out.append(";\n");
        } else if (stmt instanceof FromConsoleStmt from) {
            doIndent(out, indent);
            out.append("fromconsole ");
            unparseExpression(from.dst(), out);
            out.append(";\n");
        } else if (stmt instanceof ToConsoleStmt to) {
            doIndent(out, indent);
            out.append("toconsole ");
            unparseExpression(to.src(), out);
            out.append(";\n");
        } else if (stmt instanceof PostIncStmt inc) {
            if (indent != NO_INDENT) doIndent(out, indent);
            unparseExpression(inc.loc(), out);
            out.append("++");
            if (indent != NO_INDENT) out.append(";\n");
        } else if (stmt instanceof PostDecStmt dec) {
            if (indent != NO_INDENT) doIndent(out, indent);
            unparseExpression(dec.loc(), out);
            out.append("--");
            if (indent != NO_INDENT) out.append(";\n");
        } else if (stmt instanceof IfStmt ifStmt) {
            doIndent(out, indent);
            unparseHeader("if", ifStmt.cond(), out);
            unparseBody(ifStmt.body(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
        } else if (stmt instanceof IfElseStmt ifElse) {
            doIndent(out, indent);
            unparseHeader("if", ifElse.cond(), out);
            unparseBody(ifElse.trueBody(), out, indent + 1);
            doIndent(out, indent);
            out.append("} else {\n");
            unparseBody(ifElse.falseBody(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
        } else if (stmt instanceof WhileStmt whileStmt) {
            doIndent(out, indent);
            unparseHeader("while", whileStmt.cond(), out);
            unparseBody(whileStmt.body(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
        }
    }

    // keyword (cond){
    private static void unparseHeader(String keyword, Expression cond, Appendable out) throws IOException {
        out.append(keyword).append(" (");
        unparseExpression(cond, out);
        out.append("){\n");
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private static void unparseExpression(Expression exp, Appendable out) throws IOException {
        if (exp instanceof Id id) {
            out.append(id.name());
        } else if (exp instanceof IntLit lit) {
            out.append(Integer.toString(lit.value()));
        } else if (exp instanceof StrLit lit) {
            out.append(lit.text());
        } else if (exp instanceof BoolLit lit) {
            out.append(lit.value() ? "true" : "false");
        } else if (exp instanceof UnknownLit) {
            out.append("eh?");
        } else if (exp instanceof CallExp call) {
            unparseExpression(call.callee(), out);
            out.append("(");
            boolean firstArg = true;
            for (Expression arg : call.args()) {
                if (firstArg) {
                    firstArg = false;
                } else {
                    out.append(", ");
                }
                unparseExpression(arg, out);
            }
            out.append(")");
        } else if (exp instanceof BinaryExp binary) {
            unparseNested(binary.left(), out);
            out.append(" ").append(binary.op().symbol()).append(" ");
            unparseNested(binary.right(), out);
        } else if (exp instanceof UnaryExp unary) {
            out.append(unary.op().symbol());
            unparseNested(unary.operand(), out);
        }
    }

    /**
     * Renders an operator operand, in parentheses unless it is a leaf term.
     */
    private static void unparseNested(Expression exp, Appendable out) throws IOException {
        if (isLeaf(exp)) {
            unparseExpression(exp, out);
        } else {
            out.append("(");
            unparseExpression(exp, out);
            out.append(")");
        }
    }

    private static boolean isLeaf(Expression exp) {
        return !(exp instanceof BinaryExp) && !(exp instanceof UnaryExp);
    }
}
