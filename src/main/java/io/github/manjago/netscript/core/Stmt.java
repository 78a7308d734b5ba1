package io.github.manjago.netscript.core;

import java.util.List;

/**
 * Statement nodes of the legacy script syntax tree.
 */
public interface Stmt {

    /** Line the statement starts on. */
    int line();

    /**
     * {@code import * as ns from "ref"} when {@code namespace} is set,
     * otherwise {@code import {a, b} from "ref"}.
     */
    record Import(List<String> names, String namespace, String source, Span span, int line) implements Stmt {
        public boolean isNamespace() {
            return namespace != null;
        }
    }

    record Function(String name, List<String> params, List<Stmt> body, Span span, int line) implements Stmt {}

    record Var(String name, Expr initializer, int line) implements Stmt {}

    record If(Expr condition, Stmt thenBranch, Stmt elseBranch, int line) implements Stmt {}

    record While(Expr condition, Stmt body, int line) implements Stmt {}

    /** Any of init, condition and update may be null. */
    record For(Stmt init, Expr condition, Expr update, Stmt body, int line) implements Stmt {}

    record Break(int line) implements Stmt {}

    record Continue(int line) implements Stmt {}

    record Return(Expr value, int line) implements Stmt {}

    record Block(List<Stmt> statements, int line) implements Stmt {}

    record Expression(Expr expression, int line) implements Stmt {}
}
