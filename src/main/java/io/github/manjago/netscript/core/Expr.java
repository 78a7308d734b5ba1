package io.github.manjago.netscript.core;

import java.util.List;

/**
 * Expression nodes of the legacy script syntax tree.
 */
public interface Expr {

    int line();

    record Literal(Object value, int line) implements Expr {}

    record Variable(String name, int line) implements Expr {}

    /** {@code op} is "=" or a compound operator such as "+=". */
    record Assign(Expr target, String op, Expr value, int line) implements Expr {}

    /** {@code ++x}, {@code x--} and friends. */
    record Update(Expr target, boolean increment, boolean prefix, int line) implements Expr {}

    /** Short-circuit {@code &&} and {@code ||}. */
    record Logical(Expr left, String op, Expr right, int line) implements Expr {}

    record Binary(Expr left, String op, Expr right, int line) implements Expr {}

    record Unary(String op, Expr operand, int line) implements Expr {}

    record Call(Expr callee, List<Expr> arguments, int line) implements Expr {}

    record Member(Expr object, String name, int line) implements Expr {}

    record Index(Expr object, Expr index, int line) implements Expr {}

    record ArrayLiteral(List<Expr> elements, int line) implements Expr {}

    record ObjectLiteral(List<String> keys, List<Expr> values, int line) implements Expr {}

    record Function(String name, List<String> params, List<Stmt> body, int line) implements Expr {}
}
