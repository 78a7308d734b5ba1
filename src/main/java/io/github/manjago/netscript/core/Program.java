package io.github.manjago.netscript.core;

import java.util.List;

/**
 * A parsed script: its top-level statements and the text they came from.
 */
public record Program(List<Stmt> body, String source) {

    /**
     * Top-level import declarations, in source order.
     */
    public List<Stmt.Import> imports() {
        return body.stream()
                .filter(Stmt.Import.class::isInstance)
                .map(Stmt.Import.class::cast)
                .toList();
    }

    /**
     * Top-level function declarations, in source order.
     */
    public List<Stmt.Function> functions() {
        return body.stream()
                .filter(Stmt.Function.class::isInstance)
                .map(Stmt.Function.class::cast)
                .toList();
    }
}
