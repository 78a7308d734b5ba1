package io.github.manjago.netscript.core;

/**
 * A guest function value: compiled code plus the scope it was created in.
 */
public record Closure(FunctionCode code, Scope scope) {

    @Override
    public String toString() {
        return "[function " + code.name() + "]";
    }
}
